package io.issuebridge.model;

import io.issuebridge.doc.Document;

public record Comment(
        String id,
        TrackerUser author,
        Document body,
        String created,
        String updated
) {
}
