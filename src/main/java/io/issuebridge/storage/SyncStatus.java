package io.issuebridge.storage;

import java.util.Locale;

public enum SyncStatus {
    SUCCESS,
    FAILED,
    PARTIAL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SyncStatus fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
