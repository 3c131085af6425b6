package io.issuebridge.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.issuebridge.client.IssueTracker;
import io.issuebridge.client.SearchOptions;
import io.issuebridge.client.TrackerException;
import io.issuebridge.doc.Document;
import io.issuebridge.model.Comment;
import io.issuebridge.model.FetchMode;
import io.issuebridge.model.IssueFull;
import io.issuebridge.model.IssuePayload;
import io.issuebridge.model.IssueSummary;
import io.issuebridge.model.IssueView;
import io.issuebridge.model.Project;
import io.issuebridge.model.SearchResult;
import io.issuebridge.model.TrackerUser;
import io.issuebridge.model.Transition;
import io.issuebridge.storage.LocalCacheStore;
import io.issuebridge.storage.PendingChange;
import io.issuebridge.storage.SyncStatus;
import io.issuebridge.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.function.Supplier;

public final class CachingIssueTracker implements IssueTracker {
    private static final Logger log = LoggerFactory.getLogger(CachingIssueTracker.class);

    private final IssueTracker primary;
    private final LocalCacheStore store;
    private final Clock clock;
    // Guards replay and refresh; a waiting caller sees the queue the previous pass left.
    private final Object syncLock = new Object();
    private volatile boolean online = true;

    public CachingIssueTracker(IssueTracker primary, LocalCacheStore store) {
        this(primary, store, Clock.systemUTC());
    }

    public CachingIssueTracker(IssueTracker primary, LocalCacheStore store, Clock clock) {
        this.primary = primary;
        this.store = store;
        this.clock = clock;
    }

    public boolean isOnline() {
        return online;
    }

    public void setOnline(boolean online) {
        if (this.online != online) {
            log.info("tracker mode changed online={}", online);
        }
        this.online = online;
    }

    public boolean checkConnectivity() {
        try {
            primary.testConnection();
            setOnline(true);
        } catch (RuntimeException e) {
            log.warn("connectivity check failed: {}", e.getMessage());
            setOnline(false);
        }
        return online;
    }

    @Override
    public TrackerUser testConnection() {
        return passThrough("testConnection", primary::testConnection);
    }

    @Override
    public IssueView getIssue(String key, FetchMode mode) {
        requireKey(key);
        if (online) {
            try {
                IssueView remote = primary.getIssue(key, FetchMode.FULL);
                if (remote == null) {
                    return null;
                }
                if (remote instanceof IssueFull full) {
                    store.cacheIssue(full);
                    return full.project(mode);
                }
                return remote;
            } catch (RuntimeException e) {
                goOffline("getIssue " + key, e);
            }
        }
        return store.getCachedIssue(key, mode);
    }

    @Override
    public SearchResult search(String query, SearchOptions options) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query is required");
        }
        if (online) {
            try {
                SearchResult result = primary.search(query, options);
                store.cacheSearchResult(query, result);
                return result;
            } catch (RuntimeException e) {
                goOffline("search", e);
            }
        }
        SearchResult cached = store.getCachedSearchResult(query);
        return cached == null ? SearchResult.empty() : cached;
    }

    @Override
    public Project getProject(String key) {
        requireKey(key);
        return passThrough("getProject " + key, () -> primary.getProject(key));
    }

    @Override
    public List<Transition> getTransitions(String key) {
        requireKey(key);
        try {
            return passThrough("getTransitions " + key, () -> primary.getTransitions(key));
        } catch (RuntimeException e) {
            if (store.getCachedIssue(key, FetchMode.FULL) instanceof IssueFull cached) {
                log.warn("serving cached transitions for {}", key);
                return cached.transitions();
            }
            throw e;
        }
    }

    @Override
    public IssueSummary createIssue(IssuePayload payload) {
        if (payload == null) {
            throw new IllegalArgumentException("payload is required");
        }
        PendingChange change = change(PendingChange.Kind.CREATE, null, Jsons.compact().valueToTree(payload));
        return mutate(change, () -> {
            IssueSummary created = primary.createIssue(payload);
            store.invalidateSearchCache();
            return created;
        });
    }

    @Override
    public boolean updateIssue(String key, IssuePayload payload) {
        requireKey(key);
        if (payload == null) {
            throw new IllegalArgumentException("payload is required");
        }
        PendingChange change = change(PendingChange.Kind.UPDATE, key, Jsons.compact().valueToTree(payload));
        return mutate(change, () -> afterWrite(key, primary.updateIssue(key, payload)));
    }

    @Override
    public boolean transitionIssue(String key, String idOrName) {
        requireKey(key);
        if (idOrName == null || idOrName.isBlank()) {
            throw new IllegalArgumentException("transition id or name is required");
        }
        ObjectNode payload = Jsons.compact().createObjectNode().put("transition", idOrName.trim());
        PendingChange change = change(PendingChange.Kind.TRANSITION, key, payload);
        return mutate(change, () -> afterWrite(key, primary.transitionIssue(key, idOrName)));
    }

    @Override
    public Comment addComment(String key, Document body) {
        requireKey(key);
        ObjectNode payload = Jsons.compact().createObjectNode();
        payload.set("body", Jsons.compact().valueToTree(body == null ? Document.empty() : body));
        PendingChange change = change(PendingChange.Kind.COMMENT, key, payload);
        return mutate(change, () -> {
            Comment comment = primary.addComment(key, body);
            store.invalidateIssue(key);
            return comment;
        });
    }

    public SyncReport synchronize() {
        synchronized (syncLock) {
            return synchronizeLocked();
        }
    }

    private SyncReport synchronizeLocked() {
        if (!checkConnectivity()) {
            int queued = store.getPendingChanges().size();
            log.info("sync skipped: tracker unreachable pending={}", queued);
            return new SyncReport(SyncStatus.FAILED, false, 0, 0, queued, 0, 0);
        }

        int replayed = 0;
        int dropped = 0;
        boolean blocked = false;
        for (PendingChange change : store.getPendingChanges()) {
            try {
                replay(change);
                replayed++;
            } catch (TrackerException e) {
                if (e.retryable()) {
                    log.warn("replay stopped at {} {}: {}", change.kind(), change.key(), e.getMessage());
                    setOnline(false);
                    blocked = true;
                    break;
                }
                log.warn("dropping {} {} after non-retryable failure: {}", change.kind(), change.key(), e.getMessage());
                dropped++;
            }
            store.acknowledgePendingChange(change);
        }

        int refreshed = 0;
        int refreshFailed = 0;
        if (!blocked) {
            for (String key : store.getAllCachedIssueKeys()) {
                try {
                    IssueView remote = primary.getIssue(key, FetchMode.FULL);
                    if (remote instanceof IssueFull full) {
                        store.cacheIssue(full);
                    } else if (remote == null) {
                        store.invalidateIssue(key);
                    }
                    refreshed++;
                } catch (TrackerException e) {
                    log.warn("refresh failed for {}: {}", key, e.getMessage());
                    refreshFailed++;
                }
            }
        }

        int remaining = store.getPendingChanges().size();
        SyncStatus status = remaining == 0 && refreshFailed == 0 && !blocked ? SyncStatus.SUCCESS : SyncStatus.PARTIAL;
        SyncReport report = new SyncReport(status, online, replayed, dropped, remaining, refreshed, refreshFailed);
        log.info("sync finished status={} replayed={} dropped={} remaining={} refreshed={} refreshFailed={}",
                status, replayed, dropped, remaining, refreshed, refreshFailed);
        return report;
    }

    public SyncReport syncNow() {
        SyncReport report = synchronize();
        store.updateSyncState(report.status());
        return report;
    }

    public void startBackgroundSync() {
        store.startPeriodicSync(() -> synchronize().status());
    }

    public void stopBackgroundSync() {
        store.stopPeriodicSync();
    }

    private void replay(PendingChange change) {
        JsonNode payload = change.payload();
        switch (change.kind()) {
            case CREATE -> {
                primary.createIssue(readPayload(payload, IssuePayload.class));
                store.invalidateSearchCache();
            }
            case UPDATE -> afterWrite(change.key(), primary.updateIssue(change.key(), readPayload(payload, IssuePayload.class)));
            case TRANSITION -> afterWrite(change.key(), primary.transitionIssue(change.key(), payload.path("transition").asText()));
            case COMMENT -> {
                primary.addComment(change.key(), readPayload(payload.path("body"), Document.class));
                store.invalidateIssue(change.key());
            }
        }
    }

    private <T> T mutate(PendingChange change, Supplier<T> remoteCall) {
        if (!online) {
            store.recordPendingChange(change);
            log.warn("offline; queued {} {}", change.kind(), change.key());
            throw new ChangeQueuedException(change, null);
        }
        try {
            return remoteCall.get();
        } catch (TrackerException e) {
            if (!e.retryable()) {
                throw e;
            }
            setOnline(false);
            store.recordPendingChange(change);
            log.warn("{} {} failed ({}); queued for sync", change.kind(), change.key(), e.kind());
            throw new ChangeQueuedException(change, e);
        }
    }

    private boolean afterWrite(String key, boolean applied) {
        store.invalidateIssue(key);
        store.invalidateSearchCache();
        return applied;
    }

    private <T> T passThrough(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (RuntimeException e) {
            goOffline(operation, e);
            throw e;
        }
    }

    private void goOffline(String operation, RuntimeException cause) {
        log.warn("{} failed, switching to offline cache: {}", operation, cause.getMessage());
        setOnline(false);
    }

    private PendingChange change(PendingChange.Kind kind, String key, JsonNode payload) {
        return new PendingChange(kind, key, payload, clock.millis());
    }

    private static <T> T readPayload(JsonNode node, Class<T> type) {
        try {
            return Jsons.compact().treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new TrackerException(
                    TrackerException.Kind.INVALID_RESPONSE,
                    "Queued " + type.getSimpleName() + " could not be read",
                    null,
                    null,
                    false,
                    e
            );
        }
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key is required");
        }
    }
}
