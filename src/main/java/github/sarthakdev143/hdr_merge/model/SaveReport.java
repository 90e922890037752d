package github.sarthakdev143.hdr_merge.model;

import github.sarthakdev143.hdr_merge.model.metadata.FusionReport;

import java.util.List;

public record SaveReport(String outputFile, FusionReport fusion, String maskFile, List<String> warnings) {

    public SaveReport {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
