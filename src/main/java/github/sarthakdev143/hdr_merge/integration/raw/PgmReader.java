package github.sarthakdev143.hdr_merge.integration.raw;

import github.sarthakdev143.hdr_merge.model.RawImage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Reads binary (P5) PGM images as written by dcraw. Samples wider than 8 bits are big-endian.
 */
final class PgmReader {

    private PgmReader() {
    }

    static RawImage read(byte[] data) throws IOException {
        int[] position = {0};
        String magic = nextToken(data, position);
        if (!"P5".equals(magic)) {
            throw new IOException("Expected a binary PGM image but found: " + magic);
        }
        int width = nextNumber(data, position);
        int height = nextNumber(data, position);
        int maxValue = nextNumber(data, position);
        // Exactly one whitespace byte separates the header from the samples.
        int offset = position[0] + 1;

        int bytesPerSample = maxValue > 255 ? 2 : 1;
        long expected = (long) width * height * bytesPerSample;
        if (width <= 0 || height <= 0 || data.length - offset < expected) {
            throw new IOException("Truncated PGM image: " + width + "x" + height + " needs " + expected + " bytes.");
        }

        char[] samples = new char[width * height];
        for (int i = 0; i < samples.length; i++) {
            if (bytesPerSample == 2) {
                samples[i] = (char) (((data[offset] & 0xFF) << 8) | (data[offset + 1] & 0xFF));
                offset += 2;
            } else {
                samples[i] = (char) (data[offset++] & 0xFF);
            }
        }
        return new RawImage(width, height, samples);
    }

    private static int nextNumber(byte[] data, int[] position) throws IOException {
        String token = nextToken(data, position);
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new IOException("Malformed PGM header value: " + token, e);
        }
    }

    private static String nextToken(byte[] data, int[] position) throws IOException {
        int i = position[0];
        while (i < data.length) {
            if (data[i] == '#') {
                while (i < data.length && data[i] != '\n') {
                    i++;
                }
            } else if (Character.isWhitespace(data[i])) {
                i++;
            } else {
                break;
            }
        }
        int start = i;
        while (i < data.length && !Character.isWhitespace(data[i])) {
            i++;
        }
        if (start == i) {
            throw new IOException("Unexpected end of PGM header.");
        }
        position[0] = i;
        return new String(data, start, i - start, StandardCharsets.US_ASCII);
    }
}
