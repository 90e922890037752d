package github.sarthakdev143.hdr_merge.model;

public record MergePlan(LoadOptions loadOptions, SaveOptions saveOptions) {
}
