package io.issuebridge.cli;

import io.issuebridge.client.SearchOptions;
import io.issuebridge.client.TrackerException;
import io.issuebridge.client.TrackerRestClient;
import io.issuebridge.config.IssueBridgeConfig;
import io.issuebridge.model.FetchMode;
import io.issuebridge.model.IssueView;
import io.issuebridge.storage.LocalCacheStore;
import io.issuebridge.sync.CachingIssueTracker;
import io.issuebridge.sync.ChangeQueuedException;
import io.issuebridge.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "issuebridge",
        mixinStandardHelpOptions = true,
        description = "Issue tracker client with an offline cache",
        subcommands = {
                IssueBridgeCommand.WhoamiCommand.class,
                IssueBridgeCommand.IssueCommand.class,
                IssueBridgeCommand.SearchCommand.class,
                IssueBridgeCommand.TransitionCommand.class,
                IssueBridgeCommand.CommentCommand.class,
                IssueBridgeCommand.CacheStatsCommand.class,
                IssueBridgeCommand.CacheCleanCommand.class,
                IssueBridgeCommand.PendingCommand.class,
                IssueBridgeCommand.SyncCommand.class,
                IssueBridgeCommand.SettingsCommand.class
        }
)
public final class IssueBridgeCommand implements Runnable {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_QUEUED = 2;

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--base-url"}, description = "Tracker base URL, e.g. https://example.atlassian.net")
    String baseUrl;

    @Option(names = {"--email"}, description = "Account email")
    String email;

    @Option(names = {"--api-token"}, description = "API token")
    String apiToken;

    @Option(names = {"--offline"}, defaultValue = "false", description = "Answer from the local cache only")
    boolean offline;

    private final Map<String, String> env;

    public IssueBridgeCommand() {
        this(System.getenv());
    }

    IssueBridgeCommand(Map<String, String> env) {
        this.env = env;
    }

    @Override
    public void run() {
        System.out.println("Use subcommands: whoami | issue | search | transition | comment | cache-stats | cache-clean | pending | sync | settings");
    }

    IssueBridgeConfig config() {
        IssueBridgeConfig.Builder builder = IssueBridgeConfig.fromRoot(root, env).toBuilder();
        if (baseUrl != null && !baseUrl.isBlank()) {
            builder.baseUrl(baseUrl);
        }
        if (email != null && !email.isBlank()) {
            builder.email(email);
        }
        if (apiToken != null && !apiToken.isBlank()) {
            builder.apiToken(apiToken);
        }
        return builder.build();
    }

    int withStore(StoreAction action) {
        try (LocalCacheStore store = new LocalCacheStore(config())) {
            store.initialize();
            Object out = action.apply(store);
            System.out.println(Jsons.toJson(out));
            return EXIT_OK;
        } catch (RuntimeException e) {
            System.err.println("error: " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    int withTracker(TrackerAction action) {
        IssueBridgeConfig config;
        try {
            config = config();
        } catch (RuntimeException e) {
            System.err.println("error: " + e.getMessage());
            return EXIT_FAILED;
        }
        if (!config.hasCredentials()) {
            System.err.println("error: base url, email and api token are required (options or "
                    + IssueBridgeConfig.ENV_BASE_URL + "/" + IssueBridgeConfig.ENV_EMAIL + "/" + IssueBridgeConfig.ENV_API_TOKEN + ")");
            return EXIT_FAILED;
        }
        try (LocalCacheStore store = new LocalCacheStore(config)) {
            store.initialize();
            CachingIssueTracker tracker = new CachingIssueTracker(new TrackerRestClient(config), store);
            if (offline) {
                tracker.setOnline(false);
            }
            Object out = action.apply(tracker);
            System.out.println(Jsons.toJson(out));
            return EXIT_OK;
        } catch (ChangeQueuedException e) {
            System.err.println("queued: " + e.getMessage());
            return EXIT_QUEUED;
        } catch (TrackerException e) {
            System.err.println("error: " + e.kind() + " " + e.getMessage());
            return EXIT_FAILED;
        } catch (RuntimeException e) {
            System.err.println("error: " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    @FunctionalInterface
    interface StoreAction {
        Object apply(LocalCacheStore store);
    }

    @FunctionalInterface
    interface TrackerAction {
        Object apply(CachingIssueTracker tracker);
    }

    @Command(name = "whoami", description = "Show the authenticated account")
    static final class WhoamiCommand implements Callable<Integer> {
        @ParentCommand
        IssueBridgeCommand parent;

        @Override
        public Integer call() {
            return parent.withTracker(CachingIssueTracker::testConnection);
        }
    }

    @Command(name = "issue", description = "Fetch one issue")
    static final class IssueCommand implements Callable<Integer> {
        @ParentCommand
        IssueBridgeCommand parent;

        @Parameters(index = "0", description = "Issue key")
        String key;

        @Option(names = {"--mode"}, defaultValue = "summary", description = "summary|details|full")
        String mode;

        @Override
        public Integer call() {
            return parent.withTracker(tracker -> {
                IssueView view = tracker.getIssue(key, FetchMode.fromString(mode));
                if (view == null) {
                    return Map.of("error", "issue not found", "key", key);
                }
                return view;
            });
        }
    }

    @Command(name = "search", description = "Run a query")
    static final class SearchCommand implements Callable<Integer> {
        @ParentCommand
        IssueBridgeCommand parent;

        @Parameters(index = "0", description = "Query text")
        String query;

        @Option(names = {"--max"}, description = "Page size")
        Integer max;

        @Option(names = {"--start"}, defaultValue = "0", description = "First result offset")
        int start;

        @Option(names = {"--all"}, defaultValue = "false", description = "Fetch every page")
        boolean all;

        @Override
        public Integer call() {
            return parent.withTracker(tracker -> {
                int pageSize = max == null ? parent.config().searchPageSize() : max;
                SearchOptions options = SearchOptions.defaults()
                        .withMaxResults(pageSize)
                        .withStartAt(start)
                        .withFetchAll(all);
                return tracker.search(query, options);
            });
        }
    }

    @Command(name = "transition", description = "Move an issue through its workflow")
    static final class TransitionCommand implements Callable<Integer> {
        @ParentCommand
        IssueBridgeCommand parent;

        @Parameters(index = "0", description = "Issue key")
        String key;

        @Parameters(index = "1", description = "Transition id or name")
        String transition;

        @Override
        public Integer call() {
            return parent.withTracker(tracker -> Map.of(
                    "key", key,
                    "transitioned", tracker.transitionIssue(key, transition)
            ));
        }
    }

    @Command(name = "comment", description = "Add a comment; inline markup is converted")
    static final class CommentCommand implements Callable<Integer> {
        @ParentCommand
        IssueBridgeCommand parent;

        @Parameters(index = "0", description = "Issue key")
        String key;

        @Parameters(index = "1", description = "Comment text")
        String text;

        @Override
        public Integer call() {
            return parent.withTracker(tracker -> tracker.addComment(key, text));
        }
    }

    @Command(name = "cache-stats", description = "Show cache counts and sync state")
    static final class CacheStatsCommand implements Callable<Integer> {
        @ParentCommand
        IssueBridgeCommand parent;

        @Override
        public Integer call() {
            return parent.withStore(store -> {
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("cache", store.getCacheStats());
                out.put("sync", store.getSyncState());
                return out;
            });
        }
    }

    @Command(name = "cache-clean", description = "Delete expired cache entries")
    static final class CacheCleanCommand implements Callable<Integer> {
        @ParentCommand
        IssueBridgeCommand parent;

        @Option(names = {"--all"}, defaultValue = "false", description = "Delete every cached entry")
        boolean all;

        @Override
        public Integer call() {
            return parent.withStore(store -> {
                if (all) {
                    store.clearAllCache();
                    return Map.of("cleared", true);
                }
                return Map.of("removed", store.cleanExpiredCache());
            });
        }
    }

    @Command(name = "pending", description = "List changes queued while offline")
    static final class PendingCommand implements Callable<Integer> {
        @ParentCommand
        IssueBridgeCommand parent;

        @Option(names = {"--clear"}, defaultValue = "false", description = "Discard every queued change")
        boolean clear;

        @Override
        public Integer call() {
            return parent.withStore(store -> {
                if (clear) {
                    int count = store.getPendingChanges().size();
                    store.clearPendingChanges();
                    return Map.of("discarded", count);
                }
                return store.getPendingChanges();
            });
        }
    }

    @Command(name = "sync", description = "Replay queued changes and refresh cached issues")
    static final class SyncCommand implements Callable<Integer> {
        @ParentCommand
        IssueBridgeCommand parent;

        @Override
        public Integer call() {
            return parent.withTracker(CachingIssueTracker::syncNow);
        }
    }

    @Command(name = "settings", description = "Show effective settings with secrets masked")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        IssueBridgeCommand parent;

        @Override
        public Integer call() {
            try {
                System.out.println(Jsons.toJson(parent.config().view()));
                return EXIT_OK;
            } catch (RuntimeException e) {
                System.err.println("error: " + e.getMessage());
                return EXIT_FAILED;
            }
        }
    }
}
