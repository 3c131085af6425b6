package io.issuebridge.sync;

import io.issuebridge.storage.SyncStatus;

public record SyncReport(
        SyncStatus status,
        boolean online,
        int replayed,
        int dropped,
        int remaining,
        int refreshed,
        int refreshFailed
) {
}
