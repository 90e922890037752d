package github.sarthakdev143.hdr_merge.dto;

import java.util.List;

/**
 * Merge job request. Absent fields take their defaults.
 *
 * @param customWhiteLevel white level ceiling in decoded sample units
 * @param outputFileName   output pattern; {@code .dng} is appended when missing
 * @param maskFileName     mask pattern; when present the blend mask is written
 */
public record MergeRequest(
        List<String> fileNames,
        Boolean align,
        Boolean crop,
        Integer customWhiteLevel,
        Boolean batch,
        Double batchGapSeconds,
        Boolean withSingles,
        Integer bitsPerSample,
        Integer featherRadius,
        String previewSize,
        String outputFileName,
        String maskFileName) {

    public MergeRequest {
        fileNames = fileNames == null ? List.of() : fileNames.stream().toList();
    }
}
