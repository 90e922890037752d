package github.sarthakdev143.hdr_merge.model;

public enum MergeJobState {
    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED
}
