package io.issuebridge.storage;

public record SyncState(Long lastSyncAt, SyncStatus lastSyncStatus, int pendingChangeCount) {
}
