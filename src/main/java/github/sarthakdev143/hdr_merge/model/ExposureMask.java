package github.sarthakdev143.hdr_merge.model;

/**
 * Per-pixel index of the exposure chosen for the merged image, in stack order.
 */
public record ExposureMask(int width, int height, byte[] indexes) {

    public ExposureMask {
        if (indexes == null || indexes.length != width * height) {
            throw new IllegalArgumentException("Mask buffer does not match " + width + "x" + height + ".");
        }
    }

    public int get(int x, int y) {
        return indexes[y * width + x] & 0xFF;
    }
}
