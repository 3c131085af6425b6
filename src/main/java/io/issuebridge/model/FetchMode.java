package io.issuebridge.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public enum FetchMode {
    SUMMARY("summary", List.of("key", "summary", "status", "issuetype")),
    DETAILS("details", List.of(
            "key", "summary", "status", "issuetype",
            "description", "assignee", "reporter", "priority", "labels", "created", "updated", "project")),
    FULL("full", List.of(
            "key", "summary", "status", "issuetype",
            "description", "assignee", "reporter", "priority", "labels", "created", "updated", "project",
            "components", "fixVersions", "comment", "transitions"));

    private final String wireName;
    private final List<String> fields;

    FetchMode(String wireName, List<String> fields) {
        this.wireName = wireName;
        this.fields = fields;
    }

    public String wireName() {
        return wireName;
    }

    public List<String> fields() {
        return fields;
    }

    public String fieldsParam() {
        return String.join(",", fields);
    }

    public boolean expandsTransitions() {
        return this == FULL;
    }

    public static Set<String> standardFieldNames() {
        List<String> names = new ArrayList<>(FULL.fields);
        names.add("id");
        names.add("key");
        names.add("self");
        return Set.copyOf(names);
    }

    public static FetchMode fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return SUMMARY;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        for (FetchMode mode : values()) {
            if (mode.wireName.equals(value) || mode.name().equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown fetch mode: " + raw);
    }
}
