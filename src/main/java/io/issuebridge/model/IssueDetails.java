package io.issuebridge.model;

import io.issuebridge.doc.Document;

import java.util.List;

public record IssueDetails(
        String key,
        String id,
        String title,
        String status,
        String issueType,
        Document description,
        TrackerUser assignee,
        TrackerUser reporter,
        String priority,
        List<String> labels,
        String created,
        String updated,
        String projectKey
) implements IssueView {
    public IssueDetails {
        labels = labels == null ? List.of() : List.copyOf(labels);
    }

    @Override
    public FetchMode mode() {
        return FetchMode.DETAILS;
    }

    public IssueSummary toSummary() {
        return new IssueSummary(key, id, title, status, issueType);
    }
}
