package github.sarthakdev143.hdr_merge.model;

import java.util.Locale;

public enum PreviewSize {
    NONE(0),
    HALF(1),
    FULL(2);

    private final int factor;

    PreviewSize(int factor) {
        this.factor = factor;
    }

    public static PreviewSize fromInput(String input) {
        if (input == null || input.isBlank()) {
            return FULL;
        }

        try {
            return PreviewSize.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("previewSize must be one of NONE, HALF, FULL.");
        }
    }

    public int factor() {
        return factor;
    }

    /**
     * Preview width for an image {@code imageWidth} pixels wide; 0 disables the preview.
     */
    public int previewWidth(int imageWidth) {
        return factor * imageWidth / 2;
    }
}
