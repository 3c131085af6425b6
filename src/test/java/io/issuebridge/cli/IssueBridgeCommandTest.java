package io.issuebridge.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.issuebridge.config.IssueBridgeConfig;
import io.issuebridge.model.IssueFull;
import io.issuebridge.storage.LocalCacheStore;
import io.issuebridge.storage.PendingChange;
import io.issuebridge.testing.TestFiles;
import io.issuebridge.testing.TestJson;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

final class IssueBridgeCommandTest {
    private static final String[] OFFLINE_CREDENTIALS = {
            "--base-url", "http://127.0.0.1:1",
            "--email", "dana@example.com",
            "--api-token", "cli-secret",
            "--offline"
    };

    private final PrintStream originalOut = System.out;
    private final PrintStream originalErr = System.err;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private Path root;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("issuebridge-test-cli-");
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() throws Exception {
        System.setOut(originalOut);
        System.setErr(originalErr);
        TestFiles.deleteRecursively(root);
    }

    @Test
    void settingsPrintsMaskedToken() {
        int code = run("--api-token", "cli-secret", "settings");

        Assertions.assertEquals(IssueBridgeCommand.EXIT_OK, code);
        JsonNode view = TestJson.tree(stdout());
        Assertions.assertEquals("***", view.path("api_token").asText());
        Assertions.assertFalse(stdout().contains("cli-secret"));
    }

    @Test
    void trackerCommandsRequireCredentials() {
        int code = run("issue", "PROJ-1");

        Assertions.assertEquals(IssueBridgeCommand.EXIT_FAILED, code);
        Assertions.assertTrue(stderr().contains(IssueBridgeConfig.ENV_API_TOKEN));
    }

    @Test
    void offlineIssueIsServedFromCache() {
        try (LocalCacheStore store = new LocalCacheStore(config())) {
            store.initialize();
            store.cacheIssue(new IssueFull("PROJ-1", "1", "Cached title", "Open", "Bug", null, null, null, null,
                    List.of(), "", "", "PROJ", null, null, null, null, null));
        }

        int code = run(args("issue", "PROJ-1", "--mode", "details"));

        Assertions.assertEquals(IssueBridgeCommand.EXIT_OK, code);
        JsonNode issue = TestJson.tree(stdout());
        Assertions.assertEquals("PROJ-1", issue.path("key").asText());
        Assertions.assertEquals("Cached title", issue.path("title").asText());
    }

    @Test
    void offlineTransitionIsQueued() {
        int code = run(args("transition", "PROJ-1", "Done"));

        Assertions.assertEquals(IssueBridgeCommand.EXIT_QUEUED, code);
        Assertions.assertTrue(stderr().contains("queued: TRANSITION PROJ-1"));
        try (LocalCacheStore store = new LocalCacheStore(config())) {
            store.initialize();
            List<PendingChange> pending = store.getPendingChanges();
            Assertions.assertEquals(1, pending.size());
            Assertions.assertEquals(PendingChange.Kind.TRANSITION, pending.get(0).kind());
        }
    }

    @Test
    void pendingListsAndClearsQueue() {
        try (LocalCacheStore store = new LocalCacheStore(config())) {
            store.initialize();
            store.recordPendingChange(new PendingChange(
                    PendingChange.Kind.COMMENT, "PROJ-2", TestJson.tree("{\"body\":{}}"), 1L));
        }

        Assertions.assertEquals(IssueBridgeCommand.EXIT_OK, run("pending"));
        JsonNode listed = TestJson.tree(stdout());
        Assertions.assertEquals("COMMENT", listed.get(0).path("kind").asText());
        out.reset();

        Assertions.assertEquals(IssueBridgeCommand.EXIT_OK, run("pending", "--clear"));
        Assertions.assertEquals(1, TestJson.tree(stdout()).path("discarded").asInt());
    }

    @Test
    void cacheStatsReportsEmptyStore() {
        int code = run("cache-stats");

        Assertions.assertEquals(IssueBridgeCommand.EXIT_OK, code);
        JsonNode stats = TestJson.tree(stdout());
        Assertions.assertEquals(0, stats.path("cache").path("issueCount").asInt());
        Assertions.assertEquals(0, stats.path("sync").path("pendingChangeCount").asInt());
    }

    private IssueBridgeConfig config() {
        return IssueBridgeConfig.fromRoot(root.toString(), Map.of());
    }

    private String[] args(String... command) {
        List<String> all = new ArrayList<>(List.of(OFFLINE_CREDENTIALS));
        all.addAll(List.of(command));
        return all.toArray(new String[0]);
    }

    private int run(String... args) {
        List<String> all = new ArrayList<>(List.of("--root", root.toString()));
        all.addAll(List.of(args));
        return new CommandLine(new IssueBridgeCommand(Map.of())).execute(all.toArray(new String[0]));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }
}
