package github.sarthakdev143.hdr_merge.model;

import java.time.Instant;
import java.util.List;

public record MergeJobStatus(
        String jobId,
        MergeJobState state,
        String message,
        int progressPercent,
        Instant createdAt,
        Instant updatedAt,
        List<String> outputFiles,
        List<String> skippedFiles,
        String warningMessage) {

    public MergeJobStatus {
        outputFiles = outputFiles == null ? List.of() : List.copyOf(outputFiles);
        skippedFiles = skippedFiles == null ? List.of() : List.copyOf(skippedFiles);
    }
}
