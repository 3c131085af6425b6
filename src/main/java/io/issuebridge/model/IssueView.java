package io.issuebridge.model;

public interface IssueView {
    FetchMode mode();

    String key();

    String id();

    String title();

    String status();

    String issueType();
}
