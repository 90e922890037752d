package github.sarthakdev143.hdr_merge.integration.dng;

import github.sarthakdev143.hdr_merge.model.ExposureParameters;
import github.sarthakdev143.hdr_merge.model.FloatImage;
import github.sarthakdev143.hdr_merge.service.DngWriter;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Writes an uncompressed floating point DNG. The main directory holds an 8-bit RGB preview and
 * points to a single sub-directory with the color filter array data.
 */
@Component
public class TiffDngWriter implements DngWriter {

    static final String SOFTWARE = "hdr-merge";
    private static final int HEADER_SIZE = 8;
    private static final int TIFF_MAGIC = 42;
    private static final byte[] DNG_VERSION = {1, 4, 0, 0};
    private static final long RATIONAL_SCALE = 1_000_000L;

    @Override
    public byte[] write(FloatImage image, ExposureParameters params, int bitsPerSample, BufferedImage preview)
            throws IOException {
        int bytesPerSample = FloatSampleEncoder.bytesPerSample(bitsPerSample);
        BufferedImage thumbnail = preview != null ? preview : new BufferedImage(1, 1, BufferedImage.TYPE_INT_RGB);
        byte[] previewStrip = rgbStrip(thumbnail);
        long rawStripLength = (long) image.width() * image.height() * bytesPerSample;
        if (rawStripLength > Integer.MAX_VALUE - previewStrip.length - 65536L) {
            throw new IOException("Image too large for a single-strip DNG: " + image.width() + "x" + image.height());
        }

        TiffDirectory main = mainDirectory(thumbnail, params);
        TiffDirectory raw = rawDirectory(image, params, bitsPerSample, (int) rawStripLength);

        int mainOffset = HEADER_SIZE;
        int rawOffset = even(mainOffset + main.size());
        int previewOffset = even(rawOffset + raw.size());
        int rawStripOffset = even(previewOffset + previewStrip.length);
        main.putLongs(TiffTags.SUB_IFDS, rawOffset);
        main.putLongs(TiffTags.STRIP_OFFSETS, previewOffset);
        raw.putLongs(TiffTags.STRIP_OFFSETS, rawStripOffset);

        byte[] container = new byte[rawStripOffset + (int) rawStripLength];
        ByteBuffer out = ByteBuffer.wrap(container).order(ByteOrder.LITTLE_ENDIAN);
        out.put((byte) 'I').put((byte) 'I').putShort((short) TIFF_MAGIC).putInt(mainOffset);
        main.write(out, mainOffset, 0);
        raw.write(out, rawOffset, 0);
        System.arraycopy(previewStrip, 0, container, previewOffset, previewStrip.length);

        float[] data = image.data();
        for (int i = 0; i < data.length; i++) {
            FloatSampleEncoder.encode(data[i], bitsPerSample, container, rawStripOffset + i * bytesPerSample);
        }
        return container;
    }

    private TiffDirectory mainDirectory(BufferedImage thumbnail, ExposureParameters params) {
        TiffDirectory directory = new TiffDirectory();
        directory.putLongs(TiffTags.NEW_SUBFILE_TYPE, 1);
        directory.putLongs(TiffTags.IMAGE_WIDTH, thumbnail.getWidth());
        directory.putLongs(TiffTags.IMAGE_LENGTH, thumbnail.getHeight());
        directory.putShorts(TiffTags.BITS_PER_SAMPLE, 8, 8, 8);
        directory.putShorts(TiffTags.COMPRESSION, 1);
        directory.putShorts(TiffTags.PHOTOMETRIC_INTERPRETATION, TiffTags.PHOTOMETRIC_RGB);
        directory.putAscii(TiffTags.MAKE, params.getMake());
        directory.putAscii(TiffTags.MODEL, params.getModel());
        directory.putLongs(TiffTags.STRIP_OFFSETS, 0);
        directory.putShorts(TiffTags.ORIENTATION, orientation(params.getFlip()));
        directory.putShorts(TiffTags.SAMPLES_PER_PIXEL, 3);
        directory.putLongs(TiffTags.ROWS_PER_STRIP, thumbnail.getHeight());
        directory.putLongs(TiffTags.STRIP_BYTE_COUNTS, (long) thumbnail.getWidth() * thumbnail.getHeight() * 3);
        directory.putShorts(TiffTags.PLANAR_CONFIGURATION, 1);
        directory.putAscii(TiffTags.SOFTWARE, SOFTWARE);
        directory.putLongs(TiffTags.SUB_IFDS, 0);
        directory.putBytes(TiffTags.DNG_VERSION, DNG_VERSION);
        directory.putBytes(TiffTags.DNG_BACKWARD_VERSION, DNG_VERSION);
        directory.putAscii(TiffTags.UNIQUE_CAMERA_MODEL, (params.getMake() + " " + params.getModel()).trim());
        // No calibration data is available from the decoder, so camera space is declared as XYZ.
        directory.putRationals(TiffTags.COLOR_MATRIX_1, true,
                1, 1, 0, 1, 0, 1,
                0, 1, 1, 1, 0, 1,
                0, 1, 0, 1, 1, 1);
        directory.putShorts(TiffTags.CALIBRATION_ILLUMINANT_1, TiffTags.ILLUMINANT_D65);
        directory.putRationals(TiffTags.AS_SHOT_NEUTRAL, false, asShotNeutral(params));
        return directory;
    }

    private TiffDirectory rawDirectory(FloatImage image, ExposureParameters params, int bitsPerSample, int stripLength) {
        int tile = params.tileSize();
        TiffDirectory directory = new TiffDirectory();
        directory.putLongs(TiffTags.NEW_SUBFILE_TYPE, 0);
        directory.putLongs(TiffTags.IMAGE_WIDTH, image.width());
        directory.putLongs(TiffTags.IMAGE_LENGTH, image.height());
        directory.putShorts(TiffTags.BITS_PER_SAMPLE, bitsPerSample);
        directory.putShorts(TiffTags.COMPRESSION, 1);
        directory.putShorts(TiffTags.PHOTOMETRIC_INTERPRETATION, TiffTags.PHOTOMETRIC_CFA);
        directory.putLongs(TiffTags.STRIP_OFFSETS, 0);
        directory.putShorts(TiffTags.SAMPLES_PER_PIXEL, 1);
        directory.putLongs(TiffTags.ROWS_PER_STRIP, image.height());
        directory.putLongs(TiffTags.STRIP_BYTE_COUNTS, stripLength);
        directory.putShorts(TiffTags.PLANAR_CONFIGURATION, 1);
        directory.putShorts(TiffTags.SAMPLE_FORMAT, TiffTags.SAMPLE_FORMAT_FLOAT);
        directory.putShorts(TiffTags.CFA_REPEAT_PATTERN_DIM, tile, tile);
        directory.putBytes(TiffTags.CFA_PATTERN, cfaPattern(params, tile));
        directory.putBytes(TiffTags.CFA_PLANE_COLOR, (byte) 0, (byte) 1, (byte) 2);
        directory.putShorts(TiffTags.CFA_LAYOUT, 1);
        directory.putLongs(TiffTags.BLACK_LEVEL, 0);
        directory.putLongs(TiffTags.WHITE_LEVEL, 1);
        return directory;
    }

    static byte[] cfaPattern(ExposureParameters params, int tile) {
        byte[] pattern = new byte[tile * tile];
        for (int y = 0; y < tile; y++) {
            for (int x = 0; x < tile; x++) {
                pattern[y * tile + x] = switch (params.colorAt(x, y)) {
                    case 'R' -> 0;
                    case 'B' -> 2;
                    case 'C' -> 3;
                    case 'M' -> 4;
                    case 'Y' -> 5;
                    default -> 1;
                };
            }
        }
        return pattern;
    }

    /**
     * Maps dcraw flip codes to TIFF orientation values.
     */
    static int orientation(int flip) {
        return switch (flip) {
            case 1 -> 2;
            case 2 -> 4;
            case 3 -> 3;
            case 4 -> 5;
            case 5 -> 8;
            case 6 -> 6;
            case 7 -> 7;
            default -> 1;
        };
    }

    private static long[] asShotNeutral(ExposureParameters params) {
        float[] camMul = params.getCamMul();
        double green = camMul[1] > 0 ? camMul[1] : 1.0;
        long[] fractions = new long[6];
        for (int channel = 0; channel < 3; channel++) {
            double multiplier = camMul[channel] > 0 ? camMul[channel] / green : 1.0;
            fractions[channel * 2] = Math.round(RATIONAL_SCALE / multiplier);
            fractions[channel * 2 + 1] = RATIONAL_SCALE;
        }
        return fractions;
    }

    private static byte[] rgbStrip(BufferedImage image) {
        byte[] strip = new byte[image.getWidth() * image.getHeight() * 3];
        int i = 0;
        for (int y = 0; y < image.getHeight(); y++) {
            for (int x = 0; x < image.getWidth(); x++) {
                int rgb = image.getRGB(x, y);
                strip[i++] = (byte) (rgb >> 16);
                strip[i++] = (byte) (rgb >> 8);
                strip[i++] = (byte) rgb;
            }
        }
        return strip;
    }

    private static int even(int offset) {
        return (offset + 1) & ~1;
    }
}
