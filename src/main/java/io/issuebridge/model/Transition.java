package io.issuebridge.model;

public record Transition(
        String id,
        String name,
        String toId,
        String toName
) {
}
