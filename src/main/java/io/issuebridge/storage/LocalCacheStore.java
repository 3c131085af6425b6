package io.issuebridge.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.issuebridge.config.IssueBridgeConfig;
import io.issuebridge.model.FetchMode;
import io.issuebridge.model.IssueFull;
import io.issuebridge.model.IssueView;
import io.issuebridge.model.SearchResult;
import io.issuebridge.util.Hashing;
import io.issuebridge.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

public final class LocalCacheStore implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LocalCacheStore.class);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final TypeReference<List<PendingChange>> PENDING_LIST = new TypeReference<>() {
    };

    private final CacheDatabase database;
    private final long cacheExpiryMs;
    private final long syncIntervalMs;
    private final Clock clock;
    private final Object schedulerLock = new Object();

    // Guarded by the store monitor; the periodic sync thread shares it with callers.
    private Connection conn;
    private boolean closed;
    private ScheduledExecutorService scheduler;

    public LocalCacheStore(IssueBridgeConfig config) {
        this(config, Clock.systemUTC());
    }

    public LocalCacheStore(IssueBridgeConfig config, Clock clock) {
        this.database = new CacheDatabase(config.cacheFile());
        this.cacheExpiryMs = config.cacheExpiryMs();
        this.syncIntervalMs = config.syncIntervalMs();
        this.clock = clock;
    }

    public synchronized void initialize() {
        if (closed) {
            throw new IllegalStateException("cache store is closed");
        }
        if (conn != null) {
            return;
        }
        conn = database.open();
        log.info("cache store initialized file={}", database.file());
    }

    @Override
    public void close() {
        stopPeriodicSync();
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            if (conn == null) {
                return;
            }
            try {
                conn.close();
            } catch (SQLException e) {
                throw new RuntimeException("Failed to close cache database", e);
            } finally {
                conn = null;
            }
            log.info("cache store closed file={}", database.file());
        }
    }

    public static String queryHash(String query) {
        String normalized = WHITESPACE.matcher(query == null ? "" : query.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
        return Hashing.sha256Hex(normalized);
    }

    public synchronized void cacheIssue(IssueFull issue) {
        Connection c = connection();
        try {
            upsertIssue(c, issue, clock.millis());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to cache issue", e);
        }
    }

    public synchronized void cacheIssues(List<IssueFull> issues) {
        if (issues == null || issues.isEmpty()) {
            return;
        }
        Connection c = connection();
        long now = clock.millis();
        try {
            c.setAutoCommit(false);
            try {
                for (IssueFull issue : issues) {
                    upsertIssue(c, issue, now);
                }
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to cache issues", e);
        }
    }

    private void upsertIssue(Connection c, IssueFull issue, long now) throws SQLException {
        if (issue == null || issue.key() == null || issue.key().isBlank()) {
            throw new IllegalArgumentException("issue with a key is required");
        }
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT OR REPLACE INTO issues(key,data,cached_at,expires_at) VALUES(?,?,?,?)")) {
            ps.setString(1, issue.key());
            ps.setString(2, Jsons.toCompactJson(issue));
            ps.setLong(3, now);
            ps.setLong(4, now + cacheExpiryMs);
            ps.executeUpdate();
        }
    }

    public synchronized IssueView getCachedIssue(String key, FetchMode mode) {
        Connection c = connection();
        try (PreparedStatement ps = c.prepareStatement("SELECT data FROM issues WHERE key=? AND expires_at>?")) {
            ps.setString(1, key);
            ps.setLong(2, clock.millis());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return null;
                }
                return Jsons.fromJson(rs.getString("data"), IssueFull.class).project(mode);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read cached issue", e);
        }
    }

    public synchronized void cacheSearchResult(String query, SearchResult result) {
        Connection c = connection();
        long now = clock.millis();
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT OR REPLACE INTO search_cache(jql_hash,jql,result,cached_at,expires_at) VALUES(?,?,?,?,?)")) {
            ps.setString(1, queryHash(query));
            ps.setString(2, query == null ? "" : query);
            ps.setString(3, Jsons.toCompactJson(result));
            ps.setLong(4, now);
            ps.setLong(5, now + cacheExpiryMs);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to cache search result", e);
        }
    }

    public synchronized SearchResult getCachedSearchResult(String query) {
        Connection c = connection();
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT result FROM search_cache WHERE jql_hash=? AND expires_at>?")) {
            ps.setString(1, queryHash(query));
            ps.setLong(2, clock.millis());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return null;
                }
                return Jsons.fromJson(rs.getString("result"), SearchResult.class);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read cached search result", e);
        }
    }

    public synchronized List<String> getAllCachedIssueKeys() {
        Connection c = connection();
        List<String> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement("SELECT key FROM issues WHERE expires_at>? ORDER BY key")) {
            ps.setLong(1, clock.millis());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(rs.getString("key"));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list cached issue keys", e);
        }
    }

    public synchronized void invalidateIssue(String key) {
        Connection c = connection();
        try (PreparedStatement ps = c.prepareStatement("DELETE FROM issues WHERE key=?")) {
            ps.setString(1, key);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to invalidate issue", e);
        }
    }

    public synchronized void invalidateSearchCache() {
        Connection c = connection();
        try (Statement st = c.createStatement()) {
            st.executeUpdate("DELETE FROM search_cache");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to invalidate search cache", e);
        }
    }

    public synchronized void clearAllCache() {
        Connection c = connection();
        try (Statement st = c.createStatement()) {
            st.executeUpdate("DELETE FROM issues");
            st.executeUpdate("DELETE FROM search_cache");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to clear cache", e);
        }
    }

    public synchronized int cleanExpiredCache() {
        Connection c = connection();
        long now = clock.millis();
        try (PreparedStatement issues = c.prepareStatement("DELETE FROM issues WHERE expires_at<=?");
             PreparedStatement searches = c.prepareStatement("DELETE FROM search_cache WHERE expires_at<=?")) {
            issues.setLong(1, now);
            searches.setLong(1, now);
            int removed = issues.executeUpdate() + searches.executeUpdate();
            if (removed > 0) {
                log.info("expired cache entries removed count={}", removed);
            }
            return removed;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to clean expired cache", e);
        }
    }

    public synchronized void recordPendingChange(PendingChange change) {
        if (change == null || change.kind() == null) {
            throw new IllegalArgumentException("pending change with a kind is required");
        }
        List<PendingChange> changes = new ArrayList<>(readPending());
        changes.add(change);
        writePending(changes);
    }

    public synchronized List<PendingChange> getPendingChanges() {
        return List.copyOf(readPending());
    }

    public synchronized void clearPendingChanges() {
        writePending(List.of());
    }

    public synchronized boolean acknowledgePendingChange(PendingChange change) {
        List<PendingChange> changes = new ArrayList<>(readPending());
        if (!changes.remove(change)) {
            return false;
        }
        writePending(changes);
        return true;
    }

    private List<PendingChange> readPending() {
        Connection c = connection();
        try (Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT pending_changes FROM sync_state WHERE id=1")) {
            if (!rs.next()) {
                return List.of();
            }
            String raw = rs.getString(1);
            if (raw == null || raw.isBlank()) {
                return List.of();
            }
            return Jsons.compact().readValue(raw, PENDING_LIST);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read pending changes", e);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to parse pending changes", e);
        }
    }

    private void writePending(List<PendingChange> changes) {
        Connection c = connection();
        try (PreparedStatement ps = c.prepareStatement("UPDATE sync_state SET pending_changes=? WHERE id=1")) {
            ps.setString(1, Jsons.toCompactJson(changes));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to write pending changes", e);
        }
    }

    public synchronized void updateSyncState(SyncStatus status) {
        Connection c = connection();
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE sync_state SET last_sync_at=?, last_sync_status=? WHERE id=1")) {
            ps.setLong(1, clock.millis());
            ps.setString(2, status.wireName());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update sync state", e);
        }
    }

    public synchronized SyncState getSyncState() {
        Connection c = connection();
        Long lastSyncAt;
        SyncStatus status;
        try (Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT last_sync_at,last_sync_status FROM sync_state WHERE id=1")) {
            if (!rs.next()) {
                return new SyncState(null, null, 0);
            }
            long at = rs.getLong("last_sync_at");
            lastSyncAt = rs.wasNull() ? null : at;
            status = SyncStatus.fromWire(rs.getString("last_sync_status"));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read sync state", e);
        }
        return new SyncState(lastSyncAt, status, readPending().size());
    }

    public synchronized CacheStats getCacheStats() {
        Connection c = connection();
        long now = clock.millis();
        try (PreparedStatement issues = c.prepareStatement(
                "SELECT COUNT(*) AS n, MIN(cached_at) AS oldest, MAX(cached_at) AS newest FROM issues WHERE expires_at>?");
             PreparedStatement searches = c.prepareStatement(
                     "SELECT COUNT(*) AS n FROM search_cache WHERE expires_at>?")) {
            issues.setLong(1, now);
            searches.setLong(1, now);
            long issueCount;
            Long oldest;
            Long newest;
            try (ResultSet rs = issues.executeQuery()) {
                rs.next();
                issueCount = rs.getLong("n");
                long o = rs.getLong("oldest");
                oldest = rs.wasNull() ? null : o;
                long n = rs.getLong("newest");
                newest = rs.wasNull() ? null : n;
            }
            long searchCount;
            try (ResultSet rs = searches.executeQuery()) {
                rs.next();
                searchCount = rs.getLong("n");
            }
            return new CacheStats(issueCount, searchCount, oldest, newest);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read cache stats", e);
        }
    }

    public void startPeriodicSync(SyncRoutine routine) {
        synchronized (this) {
            connection();
        }
        synchronized (schedulerLock) {
            stopPeriodicSync();
            ScheduledExecutorService next = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "issuebridge-sync");
                t.setDaemon(true);
                return t;
            });
            next.scheduleAtFixedRate(() -> runSync(routine), syncIntervalMs, syncIntervalMs, TimeUnit.MILLISECONDS);
            scheduler = next;
            log.info("periodic sync started intervalMs={}", syncIntervalMs);
        }
    }

    public void stopPeriodicSync() {
        synchronized (schedulerLock) {
            if (scheduler == null) {
                return;
            }
            ScheduledExecutorService current = scheduler;
            scheduler = null;
            current.shutdownNow();
            try {
                if (!current.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("periodic sync did not stop within 5s");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            log.info("periodic sync stopped");
        }
    }

    public boolean isPeriodicSyncRunning() {
        synchronized (schedulerLock) {
            return scheduler != null;
        }
    }

    private void runSync(SyncRoutine routine) {
        SyncStatus status;
        try {
            status = routine.run();
            if (status == null) {
                status = SyncStatus.FAILED;
            }
        } catch (RuntimeException e) {
            log.warn("periodic sync failed: {}", e.getMessage(), e);
            status = SyncStatus.FAILED;
        } catch (Error e) {
            // Rethrowing cancels the fixed-rate schedule; record the failure first.
            log.error("periodic sync aborted, no further runs until restarted", e);
            recordSyncStatus(SyncStatus.FAILED);
            throw e;
        }
        recordSyncStatus(status);
    }

    private void recordSyncStatus(SyncStatus status) {
        try {
            updateSyncState(status);
        } catch (RuntimeException e) {
            log.warn("failed to record sync status={}: {}", status, e.getMessage());
        }
    }

    private Connection connection() {
        if (closed) {
            throw new IllegalStateException("cache store is closed");
        }
        if (conn == null) {
            throw new IllegalStateException("cache store is not initialized");
        }
        return conn;
    }
}
