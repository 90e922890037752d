package github.sarthakdev143.hdr_merge.dto;

import github.sarthakdev143.hdr_merge.model.MergeJobState;

public record MergeJobSubmissionResponse(
        String jobId,
        MergeJobState state,
        String message) {
}
