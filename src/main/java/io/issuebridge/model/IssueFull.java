package io.issuebridge.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.issuebridge.doc.Document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record IssueFull(
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
        String projectKey,
        List<Component> components,
        List<Version> fixVersions,
        Map<String, JsonNode> customFields,
        List<Comment> comments,
        List<Transition> transitions
) implements IssueView {
    public IssueFull {
        labels = labels == null ? List.of() : List.copyOf(labels);
        components = components == null ? List.of() : List.copyOf(components);
        fixVersions = fixVersions == null ? List.of() : List.copyOf(fixVersions);
        customFields = customFields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(customFields));
        comments = comments == null ? List.of() : List.copyOf(comments);
        transitions = transitions == null ? List.of() : List.copyOf(transitions);
    }

    @Override
    public FetchMode mode() {
        return FetchMode.FULL;
    }

    public IssueSummary toSummary() {
        return new IssueSummary(key, id, title, status, issueType);
    }

    public IssueDetails toDetails() {
        return new IssueDetails(
                key, id, title, status, issueType,
                description, assignee, reporter, priority, labels,
                created, updated, projectKey
        );
    }

    public IssueView project(FetchMode mode) {
        return switch (mode == null ? FetchMode.SUMMARY : mode) {
            case SUMMARY -> toSummary();
            case DETAILS -> toDetails();
            case FULL -> this;
        };
    }
}
