package io.issuebridge.model;

public record Version(String id, String name, boolean released) {
}
