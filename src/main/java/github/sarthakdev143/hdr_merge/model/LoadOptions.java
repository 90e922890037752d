package github.sarthakdev143.hdr_merge.model;

import java.util.List;

public record LoadOptions(
        List<String> fileNames,
        boolean align,
        boolean crop,
        boolean useCustomWl,
        int customWl,
        boolean batch,
        double batchGap,
        boolean withSingles) {

    public static final double DEFAULT_BATCH_GAP_SECONDS = 2.0;

    public LoadOptions {
        fileNames = fileNames == null ? List.of() : List.copyOf(fileNames);
    }

    public static LoadOptions of(List<String> fileNames) {
        return new LoadOptions(fileNames, true, true, false, 0, false, DEFAULT_BATCH_GAP_SECONDS, false);
    }

    public LoadOptions withFileNames(List<String> newFileNames) {
        return new LoadOptions(newFileNames, align, crop, useCustomWl, customWl, batch, batchGap, withSingles);
    }
}
