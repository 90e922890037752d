package github.sarthakdev143.hdr_merge.model;

public record FloatImage(int width, int height, float[] data) {

    public FloatImage {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive.");
        }
        if (data == null || data.length != width * height) {
            throw new IllegalArgumentException("Image buffer does not match " + width + "x" + height + ".");
        }
    }

    public float get(int x, int y) {
        return data[y * width + x];
    }
}
