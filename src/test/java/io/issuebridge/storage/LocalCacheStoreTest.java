package io.issuebridge.storage;

import io.issuebridge.config.IssueBridgeConfig;
import io.issuebridge.model.FetchMode;
import io.issuebridge.model.IssueDetails;
import io.issuebridge.model.IssueFull;
import io.issuebridge.model.IssueSummary;
import io.issuebridge.model.IssueView;
import io.issuebridge.model.SearchResult;
import io.issuebridge.model.Transition;
import io.issuebridge.testing.MutableClock;
import io.issuebridge.testing.TestFiles;
import io.issuebridge.testing.TestJson;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

final class LocalCacheStoreTest {
    private static final Instant START = Instant.parse("2024-06-01T12:00:00Z");

    @Test
    void initializeCreatesSchemaAndSingletonSyncRow() throws Exception {
        Path root = Files.createTempDirectory("issuebridge-test-schema-");
        try {
            IssueBridgeConfig config = config(root.resolve("nested").resolve("dir"));
            try (LocalCacheStore store = new LocalCacheStore(config, new MutableClock(START))) {
                store.initialize();
                store.initialize();
                SyncState state = store.getSyncState();
                Assertions.assertNull(state.lastSyncAt());
                Assertions.assertNull(state.lastSyncStatus());
                Assertions.assertEquals(0, state.pendingChangeCount());
            }
            try (Connection c = DriverManager.getConnection("jdbc:sqlite:" + config.cacheFile());
                 Statement st = c.createStatement();
                 ResultSet rs = st.executeQuery(
                         "SELECT name FROM sqlite_master WHERE type IN ('table','index') AND name NOT LIKE 'sqlite_%' ORDER BY name")) {
                StringBuilder names = new StringBuilder();
                while (rs.next()) {
                    names.append(rs.getString(1)).append(',');
                }
                Assertions.assertEquals("idx_issues_expires_at,idx_search_cache_expires_at,issues,search_cache,sync_state,",
                        names.toString());
            }
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void operationsOutsideLifecycleAreRejected() throws Exception {
        Path root = Files.createTempDirectory("issuebridge-test-lifecycle-");
        try {
            LocalCacheStore store = new LocalCacheStore(config(root), new MutableClock(START));
            Assertions.assertThrows(IllegalStateException.class, store::getCacheStats);
            store.initialize();
            store.close();
            store.close();
            Assertions.assertThrows(IllegalStateException.class, store::getPendingChanges);
            Assertions.assertThrows(IllegalStateException.class, store::initialize);
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void cachedIssueIsProjectedToRequestedMode() throws Exception {
        Path root = Files.createTempDirectory("issuebridge-test-issue-");
        try (LocalCacheStore store = new LocalCacheStore(config(root), new MutableClock(START))) {
            store.initialize();
            store.cacheIssue(issue("PROJ-1", "Cached title"));

            IssueView summary = store.getCachedIssue("PROJ-1", FetchMode.SUMMARY);
            IssueView details = store.getCachedIssue("PROJ-1", FetchMode.DETAILS);
            IssueView full = store.getCachedIssue("PROJ-1", FetchMode.FULL);

            Assertions.assertInstanceOf(IssueSummary.class, summary);
            Assertions.assertEquals("Cached title", summary.title());
            Assertions.assertInstanceOf(IssueDetails.class, details);
            Assertions.assertInstanceOf(IssueFull.class, full);
            Assertions.assertEquals("Done", ((IssueFull) full).transitions().get(0).name());
            Assertions.assertNull(store.getCachedIssue("PROJ-2", FetchMode.SUMMARY));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void recachingReplacesEntry() throws Exception {
        Path root = Files.createTempDirectory("issuebridge-test-replace-");
        try (LocalCacheStore store = new LocalCacheStore(config(root), new MutableClock(START))) {
            store.initialize();
            store.cacheIssue(issue("PROJ-1", "Old"));
            store.cacheIssue(issue("PROJ-1", "New"));

            Assertions.assertEquals("New", store.getCachedIssue("PROJ-1", FetchMode.SUMMARY).title());
            Assertions.assertEquals(1, store.getCacheStats().issueCount());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void expiredEntriesAreInvisibleAndCleanedOnce() throws Exception {
        Path root = Files.createTempDirectory("issuebridge-test-expiry-");
        MutableClock clock = new MutableClock(START);
        try (LocalCacheStore store = new LocalCacheStore(config(root), clock)) {
            store.initialize();
            store.cacheIssues(List.of(issue("PROJ-1", "a"), issue("PROJ-2", "b")));
            store.cacheSearchResult("project = PROJ", searchResult());

            clock.advance(Duration.ofHours(24));

            Assertions.assertNull(store.getCachedIssue("PROJ-1", FetchMode.SUMMARY));
            Assertions.assertNull(store.getCachedSearchResult("project = PROJ"));
            Assertions.assertTrue(store.getAllCachedIssueKeys().isEmpty());
            Assertions.assertEquals(0, store.getCacheStats().issueCount());
            Assertions.assertEquals(3, store.cleanExpiredCache());
            Assertions.assertEquals(0, store.cleanExpiredCache());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void entryIsVisibleJustBeforeExpiry() throws Exception {
        Path root = Files.createTempDirectory("issuebridge-test-before-expiry-");
        MutableClock clock = new MutableClock(START);
        try (LocalCacheStore store = new LocalCacheStore(config(root), clock)) {
            store.initialize();
            store.cacheIssue(issue("PROJ-1", "a"));

            clock.advance(Duration.ofHours(24).minusMillis(1));

            Assertions.assertNotNull(store.getCachedIssue("PROJ-1", FetchMode.SUMMARY));
            Assertions.assertEquals(0, store.cleanExpiredCache());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void searchCacheKeyIgnoresCaseAndWhitespace() throws Exception {
        Path root = Files.createTempDirectory("issuebridge-test-search-");
        try (LocalCacheStore store = new LocalCacheStore(config(root), new MutableClock(START))) {
            store.initialize();
            store.cacheSearchResult("project = PROJ  AND status = Open", searchResult());

            SearchResult hit = store.getCachedSearchResult("  PROJECT = proj and status = open ");

            Assertions.assertNotNull(hit);
            Assertions.assertEquals(2, hit.issues().size());
            Assertions.assertEquals("PROJ-1", hit.issues().get(0).key());
            Assertions.assertTrue(hit.hasMore());
            Assertions.assertEquals(LocalCacheStore.queryHash("a  b"), LocalCacheStore.queryHash(" A B"));
            Assertions.assertNotEquals(LocalCacheStore.queryHash("a b"), LocalCacheStore.queryHash("ab"));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void invalidationAndClearing() throws Exception {
        Path root = Files.createTempDirectory("issuebridge-test-invalidate-");
        try (LocalCacheStore store = new LocalCacheStore(config(root), new MutableClock(START))) {
            store.initialize();
            store.cacheIssues(List.of(issue("PROJ-2", "b"), issue("PROJ-1", "a")));
            store.cacheSearchResult("q", searchResult());

            Assertions.assertEquals(List.of("PROJ-1", "PROJ-2"), store.getAllCachedIssueKeys());
            store.invalidateIssue("PROJ-1");
            Assertions.assertEquals(List.of("PROJ-2"), store.getAllCachedIssueKeys());
            store.invalidateSearchCache();
            Assertions.assertNull(store.getCachedSearchResult("q"));
            store.cacheSearchResult("q", searchResult());
            store.clearAllCache();
            CacheStats stats = store.getCacheStats();
            Assertions.assertEquals(0, stats.issueCount());
            Assertions.assertEquals(0, stats.searchCacheCount());
            Assertions.assertNull(stats.oldestCachedAt());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void pendingChangesKeepOrderAndAcknowledgeOneEntry() throws Exception {
        Path root = Files.createTempDirectory("issuebridge-test-pending-");
        try (LocalCacheStore store = new LocalCacheStore(config(root), new MutableClock(START))) {
            store.initialize();
            store.recordPendingChange(change(PendingChange.Kind.UPDATE, "PROJ-1", 1L));
            store.recordPendingChange(change(PendingChange.Kind.TRANSITION, "PROJ-2", 2L));
            store.recordPendingChange(change(PendingChange.Kind.COMMENT, "PROJ-3", 3L));

            List<PendingChange> pending = store.getPendingChanges();
            Assertions.assertEquals(3, pending.size());
            Assertions.assertEquals(PendingChange.Kind.UPDATE, pending.get(0).kind());
            Assertions.assertEquals("PROJ-3", pending.get(2).key());
            Assertions.assertEquals("v", pending.get(1).payload().path("k").asText());
            Assertions.assertEquals(3, store.getSyncState().pendingChangeCount());

            Assertions.assertTrue(store.acknowledgePendingChange(pending.get(1)));
            Assertions.assertEquals(List.of("PROJ-1", "PROJ-3"),
                    store.getPendingChanges().stream().map(PendingChange::key).toList());
            Assertions.assertFalse(store.acknowledgePendingChange(pending.get(1)));
            Assertions.assertTrue(store.acknowledgePendingChange(pending.get(0)));
            Assertions.assertTrue(store.acknowledgePendingChange(pending.get(2)));
            Assertions.assertTrue(store.getPendingChanges().isEmpty());

            store.recordPendingChange(change(PendingChange.Kind.CREATE, null, 4L));
            store.clearPendingChanges();
            Assertions.assertEquals(0, store.getSyncState().pendingChangeCount());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void pendingChangesSurviveReopen() throws Exception {
        Path root = Files.createTempDirectory("issuebridge-test-reopen-");
        try {
            IssueBridgeConfig config = config(root);
            try (LocalCacheStore store = new LocalCacheStore(config, new MutableClock(START))) {
                store.initialize();
                store.recordPendingChange(change(PendingChange.Kind.UPDATE, "PROJ-1", 1L));
                store.updateSyncState(SyncStatus.PARTIAL);
            }
            try (LocalCacheStore store = new LocalCacheStore(config, new MutableClock(START))) {
                store.initialize();
                SyncState state = store.getSyncState();
                Assertions.assertEquals(1, state.pendingChangeCount());
                Assertions.assertEquals(SyncStatus.PARTIAL, state.lastSyncStatus());
                Assertions.assertEquals(START.toEpochMilli(), state.lastSyncAt());
            }
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void statsCoverOnlyLiveEntries() throws Exception {
        Path root = Files.createTempDirectory("issuebridge-test-stats-");
        MutableClock clock = new MutableClock(START);
        try (LocalCacheStore store = new LocalCacheStore(config(root), clock)) {
            store.initialize();
            store.cacheIssue(issue("PROJ-1", "a"));
            clock.advance(Duration.ofHours(2));
            store.cacheIssue(issue("PROJ-2", "b"));
            store.cacheSearchResult("q", searchResult());

            CacheStats stats = store.getCacheStats();

            Assertions.assertEquals(2, stats.issueCount());
            Assertions.assertEquals(1, stats.searchCacheCount());
            Assertions.assertEquals(START.toEpochMilli(), stats.oldestCachedAt());
            Assertions.assertEquals(START.plus(Duration.ofHours(2)).toEpochMilli(), stats.newestCachedAt());

            clock.advance(Duration.ofHours(23));
            CacheStats later = store.getCacheStats();
            Assertions.assertEquals(1, later.issueCount());
            Assertions.assertEquals(START.plus(Duration.ofHours(2)).toEpochMilli(), later.oldestCachedAt());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void periodicSyncRecordsRoutineStatus() throws Exception {
        Path root = Files.createTempDirectory("issuebridge-test-periodic-");
        IssueBridgeConfig config = IssueBridgeConfig.builder(root).syncIntervalMs(50L).build();
        try (LocalCacheStore store = new LocalCacheStore(config, new MutableClock(START))) {
            store.initialize();
            CountDownLatch ran = new CountDownLatch(2);
            AtomicInteger calls = new AtomicInteger();
            store.startPeriodicSync(() -> {
                calls.incrementAndGet();
                ran.countDown();
                return SyncStatus.PARTIAL;
            });
            Assertions.assertTrue(store.isPeriodicSyncRunning());
            Assertions.assertTrue(ran.await(5, TimeUnit.SECONDS));
            store.stopPeriodicSync();
            store.stopPeriodicSync();
            Assertions.assertFalse(store.isPeriodicSyncRunning());

            int after = calls.get();
            Thread.sleep(200L);
            Assertions.assertEquals(after, calls.get());
            Assertions.assertEquals(SyncStatus.PARTIAL, store.getSyncState().lastSyncStatus());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void failingRoutineIsRecordedAsFailed() throws Exception {
        Path root = Files.createTempDirectory("issuebridge-test-periodic-fail-");
        IssueBridgeConfig config = IssueBridgeConfig.builder(root).syncIntervalMs(50L).build();
        try (LocalCacheStore store = new LocalCacheStore(config, new MutableClock(START))) {
            store.initialize();
            CountDownLatch ran = new CountDownLatch(2);
            store.startPeriodicSync(() -> {
                ran.countDown();
                throw new IllegalStateException("remote exploded");
            });
            Assertions.assertTrue(ran.await(5, TimeUnit.SECONDS));
            store.stopPeriodicSync();

            Assertions.assertEquals(SyncStatus.FAILED, store.getSyncState().lastSyncStatus());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void routineErrorIsRecordedAndEndsSchedule() throws Exception {
        Path root = Files.createTempDirectory("issuebridge-test-periodic-error-");
        IssueBridgeConfig config = IssueBridgeConfig.builder(root).syncIntervalMs(50L).build();
        try (LocalCacheStore store = new LocalCacheStore(config, new MutableClock(START))) {
            store.initialize();
            store.updateSyncState(SyncStatus.SUCCESS);
            CountDownLatch ran = new CountDownLatch(1);
            AtomicInteger calls = new AtomicInteger();
            store.startPeriodicSync(() -> {
                calls.incrementAndGet();
                ran.countDown();
                throw new NoClassDefFoundError("io/issuebridge/Missing");
            });
            Assertions.assertTrue(ran.await(5, TimeUnit.SECONDS));
            Thread.sleep(300L);

            Assertions.assertEquals(1, calls.get());
            Assertions.assertEquals(SyncStatus.FAILED, store.getSyncState().lastSyncStatus());
            store.stopPeriodicSync();
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void closeStopsRunningSchedule() throws Exception {
        Path root = Files.createTempDirectory("issuebridge-test-close-sync-");
        IssueBridgeConfig config = IssueBridgeConfig.builder(root).syncIntervalMs(20L).build();
        try {
            LocalCacheStore store = new LocalCacheStore(config, new MutableClock(START));
            store.initialize();
            CountDownLatch ran = new CountDownLatch(1);
            store.startPeriodicSync(() -> {
                ran.countDown();
                return SyncStatus.SUCCESS;
            });
            Assertions.assertTrue(ran.await(5, TimeUnit.SECONDS));
            store.close();
            Assertions.assertFalse(store.isPeriodicSyncRunning());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    private static IssueBridgeConfig config(Path root) {
        return IssueBridgeConfig.builder(root).build();
    }

    private static PendingChange change(PendingChange.Kind kind, String key, long at) {
        return new PendingChange(kind, key, TestJson.tree("{\"k\":\"v\"}"), at);
    }

    private static IssueFull issue(String key, String title) {
        return new IssueFull(key, "1", title, "Open", "Task", null, null, null, null, List.of(),
                "", "", "PROJ", null, null, null, null, List.of(new Transition("41", "Done", "4", "Done")));
    }

    private static SearchResult searchResult() {
        return new SearchResult(
                List.of(new IssueSummary("PROJ-1", "1", "a", "Open", "Task"),
                        new IssueSummary("PROJ-2", "2", "b", "Open", "Task")),
                5,
                0,
                2,
                true
        );
    }
}
