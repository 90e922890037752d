package github.sarthakdev143.hdr_merge.integration.raw;

import github.sarthakdev143.hdr_merge.config.HdrMergeProperties;
import github.sarthakdev143.hdr_merge.integration.process.ExternalCommandRunner;
import github.sarthakdev143.hdr_merge.model.CreationInterval;
import github.sarthakdev143.hdr_merge.model.DecodedExposure;
import github.sarthakdev143.hdr_merge.model.ExposureParameters;
import github.sarthakdev143.hdr_merge.model.RawImage;
import github.sarthakdev143.hdr_merge.service.RawDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decodes raw files with dcraw.
 * <p>
 * The mosaic is read in document mode with unit multipliers, so dcraw subtracts the black level
 * and scales every frame to the same 16-bit range. Decoded samples therefore have black 0 and
 * white 65535.
 * <p>
 * dcraw does not print the orientation, so it is read from the EXIF {@code Orientation} tag with
 * ExifTool and kept as a dcraw flip code. Samples stay in sensor orientation.
 */
@Component
public class DcrawRawDecoder implements RawDecoder {

    private static final Logger logger = LoggerFactory.getLogger(DcrawRawDecoder.class);
    static final int DECODED_WHITE_LEVEL = 65535;
    // dcraw flip code for each EXIF orientation, indexed by orientation & 7.
    private static final String FLIP_BY_ORIENTATION = "50132467";

    private final ExternalCommandRunner commandRunner;
    private final HdrMergeProperties properties;
    private final ZoneId cameraZone;

    @Autowired
    public DcrawRawDecoder(ExternalCommandRunner commandRunner, HdrMergeProperties properties) {
        this(commandRunner, properties, ZoneId.systemDefault());
    }

    DcrawRawDecoder(ExternalCommandRunner commandRunner, HdrMergeProperties properties, ZoneId cameraZone) {
        this.commandRunner = commandRunner;
        this.properties = properties;
        this.cameraZone = cameraZone;
    }

    @Override
    public Optional<DecodedExposure> decode(Path file, int frame) throws IOException {
        DcrawIdentification identification = identify(file);
        if (identification.filterPattern().isEmpty()) {
            logger.warn("{} is not a color filter array image", file);
            return Optional.empty();
        }

        byte[] pgm = commandRunner.run(buildDecodeCommand(file, frame), "decode " + file.getFileName());
        RawImage image = PgmReader.read(pgm);

        ExposureParameters params = new ExposureParameters(file.toString());
        params.setRawWidth(image.width());
        params.setRawHeight(image.height());
        params.setWidth(image.width());
        params.setHeight(image.height());
        params.setCfaPattern(identification.filterPattern());
        params.setBlack(0);
        params.setMax(DECODED_WHITE_LEVEL);
        params.setCamMul(identification.cameraMultipliers());
        params.setMake(identification.make());
        params.setModel(identification.model());
        params.setTimestamp(identification.timestamp());
        params.setShutterSeconds(identification.shutterSeconds());
        params.setFlip(readFlip(file));
        return Optional.of(new DecodedExposure(params, image));
    }

    @Override
    public int probeFrameCount(Path file) {
        try {
            return identify(file).rawCount();
        } catch (IOException | IllegalArgumentException e) {
            logger.debug("Cannot identify {}", file, e);
            return 0;
        }
    }

    @Override
    public Optional<CreationInterval> probeCreationInterval(Path file) {
        try {
            DcrawIdentification identification = identify(file);
            if (identification.timestamp() == null) {
                return Optional.empty();
            }
            return Optional.of(CreationInterval.endingAt(identification.timestamp(), identification.shutterSeconds()));
        } catch (IOException | IllegalArgumentException e) {
            logger.debug("Cannot read capture time of {}", file, e);
            return Optional.empty();
        }
    }

    private int readFlip(Path file) {
        try {
            String output = commandRunner.runForText(buildOrientationCommand(file), "orientation " + file.getFileName());
            return flipForOrientation(output == null ? "" : output.trim());
        } catch (IOException e) {
            logger.warn("Cannot read orientation of {}, keeping sensor orientation", file, e);
            return 0;
        }
    }

    static int flipForOrientation(String orientation) {
        int value;
        try {
            value = Integer.parseInt(orientation);
        } catch (NumberFormatException e) {
            return 0;
        }
        if (value < 1 || value > 8) {
            return 0;
        }
        return FLIP_BY_ORIENTATION.charAt(value & 7) - '0';
    }

    private DcrawIdentification identify(Path file) throws IOException {
        String output = commandRunner.runForText(buildIdentifyCommand(file), "identify " + file.getFileName());
        try {
            return DcrawIdentification.parse(output, cameraZone);
        } catch (IllegalArgumentException e) {
            throw new IOException("dcraw cannot identify " + file, e);
        }
    }

    List<String> buildIdentifyCommand(Path file) {
        List<String> command = new ArrayList<>();
        command.add(properties.resolveDcrawBinary());
        command.add("-i");
        command.add("-v");
        command.add(file.toString());
        return command;
    }

    List<String> buildOrientationCommand(Path file) {
        List<String> command = new ArrayList<>();
        command.add(properties.resolveExiftoolBinary());
        command.add("-s3");
        command.add("-n");
        command.add("-EXIF:IFD0:Orientation");
        command.add(file.toString());
        return command;
    }

    List<String> buildDecodeCommand(Path file, int frame) {
        List<String> command = new ArrayList<>();
        command.add(properties.resolveDcrawBinary());
        command.add("-d");
        command.add("-4");
        command.add("-j");
        command.add("-t");
        command.add("0");
        command.add("-r");
        command.add("1");
        command.add("1");
        command.add("1");
        command.add("1");
        command.add("-s");
        command.add(String.valueOf(frame));
        command.add("-c");
        command.add(file.toString());
        return command;
    }
}
