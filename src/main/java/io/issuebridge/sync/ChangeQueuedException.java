package io.issuebridge.sync;

import io.issuebridge.client.TrackerException;
import io.issuebridge.storage.PendingChange;

public class ChangeQueuedException extends TrackerException {
    private final PendingChange change;

    public ChangeQueuedException(PendingChange change, Throwable cause) {
        super(
                Kind.OFFLINE_QUEUED,
                change.kind() + (change.key() == null ? "" : " " + change.key()) + " queued for sync",
                null,
                null,
                false,
                cause
        );
        this.change = change;
    }

    public PendingChange change() {
        return change;
    }
}
