package io.issuebridge.storage;

import com.fasterxml.jackson.databind.JsonNode;

// key is null for creations; timestamp is epoch millis at recording time.
public record PendingChange(Kind kind, String key, JsonNode payload, long timestamp) {
    public enum Kind {
        CREATE,
        UPDATE,
        TRANSITION,
        COMMENT
    }
}
