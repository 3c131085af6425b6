package io.issuebridge.model;

public record TrackerUser(
        String accountId,
        String displayName,
        String emailAddress,
        boolean active
) {
}
