package github.sarthakdev143.hdr_merge.model;

import java.util.Set;

public record SaveOptions(
        int bps,
        int featherRadius,
        PreviewSize previewSize,
        boolean saveMask,
        String maskFileName,
        String fileName) {

    public static final Set<Integer> SUPPORTED_BITS_PER_SAMPLE = Set.of(16, 24, 32);
    public static final int DEFAULT_BITS_PER_SAMPLE = 16;
    public static final int DEFAULT_FEATHER_RADIUS = 3;

    public SaveOptions {
        previewSize = previewSize == null ? PreviewSize.FULL : previewSize;
        maskFileName = maskFileName == null ? "" : maskFileName;
        fileName = fileName == null ? "" : fileName;
    }

    public static SaveOptions defaults() {
        return new SaveOptions(DEFAULT_BITS_PER_SAMPLE, DEFAULT_FEATHER_RADIUS, PreviewSize.FULL, false, "", "");
    }

    public SaveOptions withFileName(String newFileName) {
        return new SaveOptions(bps, featherRadius, previewSize, saveMask, maskFileName, newFileName);
    }
}
