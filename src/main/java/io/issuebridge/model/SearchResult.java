package io.issuebridge.model;

import java.util.List;

public record SearchResult(
        List<IssueSummary> issues,
        int total,
        int startAt,
        int maxResults,
        boolean hasMore
) {
    public SearchResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public static SearchResult empty() {
        return new SearchResult(List.of(), 0, 0, 0, false);
    }
}
