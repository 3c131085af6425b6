package io.issuebridge.model;

public record Component(String id, String name) {
}
