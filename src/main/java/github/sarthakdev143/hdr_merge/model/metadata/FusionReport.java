package github.sarthakdev143.hdr_merge.model.metadata;

import java.util.List;

public record FusionReport(
        FusionOutcome outcome,
        int xmpCopied,
        int iptcCopied,
        int exifCopied,
        List<String> failures) {

    public FusionReport {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static FusionReport destinationUnreadable(String failure) {
        return new FusionReport(FusionOutcome.DESTINATION_UNREADABLE, 0, 0, 0, List.of(failure));
    }

    /**
     * True when the destination file holds the written container.
     */
    public boolean written() {
        return outcome == FusionOutcome.FUSED || outcome == FusionOutcome.SOURCE_UNREADABLE;
    }
}
