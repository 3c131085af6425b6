package io.issuebridge.model;

public record Project(
        String id,
        String key,
        String name,
        String projectTypeKey
) {
}
