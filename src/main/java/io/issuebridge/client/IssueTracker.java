package io.issuebridge.client;

import io.issuebridge.doc.Document;
import io.issuebridge.doc.DocumentConverter;
import io.issuebridge.model.Comment;
import io.issuebridge.model.FetchMode;
import io.issuebridge.model.IssuePayload;
import io.issuebridge.model.IssueSummary;
import io.issuebridge.model.IssueView;
import io.issuebridge.model.Project;
import io.issuebridge.model.SearchResult;
import io.issuebridge.model.TrackerUser;
import io.issuebridge.model.Transition;

import java.util.List;

/**
 * Operations against the issue tracker. Lookups of missing resources return {@code null}
 * (or {@code false} for mutations); every other failure is a {@link TrackerException}.
 */
public interface IssueTracker {
    TrackerUser testConnection();

    IssueView getIssue(String key, FetchMode mode);

    SearchResult search(String query, SearchOptions options);

    IssueSummary createIssue(IssuePayload payload);

    boolean updateIssue(String key, IssuePayload payload);

    /**
     * @param idOrName an all-digit value is used as the transition id, anything else is matched
     *                 case-insensitively against the available transition names
     */
    boolean transitionIssue(String key, String idOrName);

    Comment addComment(String key, Document body);

    default Comment addComment(String key, String text) {
        return addComment(key, DocumentConverter.textToDocument(text));
    }

    Project getProject(String key);

    List<Transition> getTransitions(String key);
}
