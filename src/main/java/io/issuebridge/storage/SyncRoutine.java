package io.issuebridge.storage;

@FunctionalInterface
public interface SyncRoutine {
    SyncStatus run();
}
