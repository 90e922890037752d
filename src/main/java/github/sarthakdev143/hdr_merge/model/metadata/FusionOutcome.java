package github.sarthakdev143.hdr_merge.model.metadata;

public enum FusionOutcome {
    FUSED,
    SOURCE_UNREADABLE,
    DESTINATION_UNREADABLE,
    WRITE_FAILURE
}
