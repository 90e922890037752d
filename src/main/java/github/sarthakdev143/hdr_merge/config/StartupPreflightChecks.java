package github.sarthakdev143.hdr_merge.config;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Component
@ConditionalOnProperty(name = "hdr-merge.preflight.enabled", havingValue = "true", matchIfMissing = true)
public class StartupPreflightChecks implements ApplicationRunner {

    private static final int TOOL_CHECK_TIMEOUT_SECONDS = 10;

    private final HdrMergeProperties properties;

    public StartupPreflightChecks(HdrMergeProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        // dcraw prints usage and exits 1 without arguments, so only its presence can be checked.
        checkTool("dcraw", properties.resolveDcrawBinary(), HdrMergeProperties.DCRAW_PATH_ENV, List.of(), false);
        checkTool("ExifTool", properties.resolveExiftoolBinary(), HdrMergeProperties.EXIFTOOL_PATH_ENV,
                List.of("-ver"), true);
    }

    private void checkTool(
            String toolName,
            String binary,
            String environmentVariable,
            List<String> versionArguments,
            boolean requireSuccess) {
        if (binary.contains("/") || binary.contains("\\")) {
            Path binaryPath = Path.of(binary);
            if (!Files.isRegularFile(binaryPath)) {
                throw new IllegalStateException(
                        toolName + " binary not found at " + binaryPath.toAbsolutePath()
                                + ". Set " + environmentVariable + " to a valid " + toolName + " executable path.");
            }
        }

        try {
            List<String> command = new ArrayList<>();
            command.add(binary);
            command.addAll(versionArguments);
            Process process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();
            boolean finished = process.waitFor(TOOL_CHECK_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
            }
            if (!finished || (requireSuccess && process.exitValue() != 0)) {
                throw new IllegalStateException(
                        toolName + " is not available. Install it or set " + environmentVariable + ".");
            }
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new IllegalStateException(
                    toolName + " is not available. Install it or set " + environmentVariable + ".",
                    e);
        }
    }
}
