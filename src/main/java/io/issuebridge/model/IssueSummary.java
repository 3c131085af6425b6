package io.issuebridge.model;

public record IssueSummary(
        String key,
        String id,
        String title,
        String status,
        String issueType
) implements IssueView {
    @Override
    public FetchMode mode() {
        return FetchMode.SUMMARY;
    }
}
