package github.sarthakdev143.hdr_merge.model;

/**
 * Unsigned 16-bit sensor mosaic, row major.
 */
public record RawImage(int width, int height, char[] samples) {

    public RawImage {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Raw image dimensions must be positive.");
        }
        if (samples == null || samples.length != width * height) {
            throw new IllegalArgumentException("Raw image buffer does not match " + width + "x" + height + ".");
        }
    }

    public int get(int x, int y) {
        return samples[y * width + x];
    }

    public boolean contains(int x, int y) {
        return x >= 0 && y >= 0 && x < width && y < height;
    }

    public int maxSample() {
        int max = 0;
        for (char sample : samples) {
            if (sample > max) {
                max = sample;
            }
        }
        return max;
    }
}
