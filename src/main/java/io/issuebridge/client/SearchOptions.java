package io.issuebridge.client;

import io.issuebridge.model.FetchMode;

import java.util.List;

public record SearchOptions(
        int maxResults,
        int startAt,
        List<String> fields,
        List<String> expand,
        boolean fetchAll
) {
    public static final int DEFAULT_MAX_RESULTS = 50;

    public SearchOptions {
        maxResults = maxResults <= 0 ? DEFAULT_MAX_RESULTS : maxResults;
        startAt = Math.max(0, startAt);
        fields = fields == null || fields.isEmpty() ? FetchMode.SUMMARY.fields() : List.copyOf(fields);
        expand = expand == null ? List.of() : List.copyOf(expand);
    }

    public static SearchOptions defaults() {
        return new SearchOptions(DEFAULT_MAX_RESULTS, 0, null, null, false);
    }

    public SearchOptions withMaxResults(int value) {
        return new SearchOptions(value, startAt, fields, expand, fetchAll);
    }

    public SearchOptions withStartAt(int value) {
        return new SearchOptions(maxResults, value, fields, expand, fetchAll);
    }

    public SearchOptions withFields(List<String> value) {
        return new SearchOptions(maxResults, startAt, value, expand, fetchAll);
    }

    public SearchOptions withExpand(List<String> value) {
        return new SearchOptions(maxResults, startAt, fields, value, fetchAll);
    }

    public SearchOptions withFetchAll(boolean value) {
        return new SearchOptions(maxResults, startAt, fields, expand, value);
    }
}
