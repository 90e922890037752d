package github.sarthakdev143.hdr_merge.integration.process;

import github.sarthakdev143.hdr_merge.config.HdrMergeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs command line tools and captures their standard output. Standard error is kept apart so
 * binary output stays intact, and is reported when the tool fails.
 * <p>
 * Both streams go to temporary files, so the timeout applies to the whole run.
 */
@Component
public class ExternalCommandRunner {

    private static final Logger logger = LoggerFactory.getLogger(ExternalCommandRunner.class);
    private static final int MAX_ERROR_OUTPUT_CHARS = 4000;

    private final Duration timeout;

    public ExternalCommandRunner(HdrMergeProperties properties) {
        this.timeout = properties.processTimeout();
    }

    public byte[] run(List<String> command, String stage) throws IOException {
        logger.debug("Running command for stage {}: {}", stage, String.join(" ", command));
        Path outputFile = Files.createTempFile("hdr-merge-stdout-", ".out");
        Path errorLog = Files.createTempFile("hdr-merge-stderr-", ".log");
        try {
            Process process = new ProcessBuilder(command)
                    .redirectOutput(outputFile.toFile())
                    .redirectError(errorLog.toFile())
                    .start();

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new IOException(command.get(0) + " timed out during stage: " + stage);
            }

            if (process.exitValue() != 0) {
                throw new IOException(
                        command.get(0)
                                + " failed during stage "
                                + stage
                                + " with exit code "
                                + process.exitValue()
                                + ". Output: "
                                + readErrorOutput(errorLog));
            }
            return Files.readAllBytes(outputFile);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException("Interrupted during stage: " + stage);
            interrupted.initCause(e);
            throw interrupted;
        } finally {
            Files.deleteIfExists(outputFile);
            Files.deleteIfExists(errorLog);
        }
    }

    public String runForText(List<String> command, String stage) throws IOException {
        return new String(run(command, stage), StandardCharsets.UTF_8);
    }

    private static String readErrorOutput(Path errorLog) throws IOException {
        String text = Files.readString(errorLog, StandardCharsets.UTF_8);
        return text.length() > MAX_ERROR_OUTPUT_CHARS ? text.substring(0, MAX_ERROR_OUTPUT_CHARS) : text;
    }
}
