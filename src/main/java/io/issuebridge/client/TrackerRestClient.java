package io.issuebridge.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.issuebridge.config.IssueBridgeConfig;
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
import io.issuebridge.security.SensitiveDataMasker;
import io.issuebridge.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;

public final class TrackerRestClient implements IssueTracker {
    private static final Logger log = LoggerFactory.getLogger(TrackerRestClient.class);
    private static final int MAX_ERROR_BODY_CHARS = 500;

    private final IssueBridgeConfig config;
    private final HttpClient http;
    private final BackoffPolicy backoff;
    private final Sleeper sleeper;
    private final Clock clock;
    private final String apiBase;
    private final String authorization;

    public TrackerRestClient(IssueBridgeConfig config) {
        this(
                config,
                HttpClient.newBuilder().connectTimeout(Duration.ofMillis(config.timeoutMs())).build(),
                new BackoffPolicy(config.retryDelayMs(), config.maxBackoffMs()),
                Sleeper.SYSTEM,
                Clock.systemUTC()
        );
    }

    public TrackerRestClient(
            IssueBridgeConfig config,
            HttpClient http,
            BackoffPolicy backoff,
            Sleeper sleeper,
            Clock clock
    ) {
        if (!config.hasCredentials()) {
            throw new IllegalArgumentException("base url, email and api token are required");
        }
        this.config = config;
        this.http = http;
        this.backoff = backoff;
        this.sleeper = sleeper;
        this.clock = clock;
        this.apiBase = config.apiBaseUrl();
        String basic = config.email() + ":" + config.apiToken();
        this.authorization = "Basic " + Base64.getEncoder().encodeToString(basic.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public TrackerUser testConnection() {
        Reply reply = execute("testConnection", "GET", "/myself", null);
        if (!reply.found()) {
            throw new TrackerException(TrackerException.Kind.CLIENT_FAULT, "Current user endpoint not found", 404, false);
        }
        return IssueMapper.toUser(requireBody("testConnection", reply));
    }

    @Override
    public IssueView getIssue(String key, FetchMode mode) {
        IssueFull full = fetchIssue(key, mode);
        return full == null ? null : full.project(mode);
    }

    private IssueFull fetchIssue(String key, FetchMode mode) {
        FetchMode effective = mode == null ? FetchMode.SUMMARY : mode;
        StringBuilder path = new StringBuilder("/issue/")
                .append(encodePath(requireKey(key)))
                .append("?fields=")
                .append(URLEncoder.encode(effective.fieldsParam(), StandardCharsets.UTF_8));
        if (effective.expandsTransitions()) {
            path.append("&expand=transitions");
        }
        Reply reply = execute("getIssue", "GET", path.toString(), null);
        if (!reply.found()) {
            return null;
        }
        return IssueMapper.toFull(requireBody("getIssue", reply));
    }

    @Override
    public SearchResult search(String query, SearchOptions options) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query is required");
        }
        SearchOptions opts = options == null ? SearchOptions.defaults() : options;
        if (!opts.fetchAll()) {
            return searchPage(query, opts);
        }
        List<IssueSummary> all = new ArrayList<>();
        int startAt = 0;
        int total;
        do {
            SearchResult page = searchPage(
                    query,
                    opts.withMaxResults(IssueBridgeConfig.FETCH_ALL_PAGE_SIZE).withStartAt(startAt)
            );
            all.addAll(page.issues());
            total = page.total();
            if (page.issues().isEmpty()) {
                break;
            }
            startAt += page.maxResults() > 0 ? page.maxResults() : page.issues().size();
        } while (startAt < total);
        log.debug("search fetchAll collected={} total={}", all.size(), total);
        return new SearchResult(all, total, 0, all.size(), false);
    }

    private SearchResult searchPage(String query, SearchOptions opts) {
        ObjectNode body = Jsons.compact().createObjectNode();
        body.put("jql", query);
        body.put("maxResults", opts.maxResults());
        body.put("startAt", opts.startAt());
        ArrayNode fields = body.putArray("fields");
        opts.fields().forEach(fields::add);
        ArrayNode expand = body.putArray("expand");
        opts.expand().forEach(expand::add);
        Reply reply = execute("search", "POST", "/search", body.toString());
        if (!reply.found()) {
            return SearchResult.empty();
        }
        JsonNode root = requireBody("search", reply);
        List<IssueSummary> issues = new ArrayList<>();
        for (JsonNode issue : root.path("issues")) {
            issues.add(IssueMapper.toSummary(issue));
        }
        int startAt = root.path("startAt").asInt(opts.startAt());
        int total = root.path("total").asInt(issues.size());
        int maxResults = root.path("maxResults").asInt(opts.maxResults());
        return new SearchResult(issues, total, startAt, maxResults, startAt + issues.size() < total);
    }

    @Override
    public IssueSummary createIssue(IssuePayload payload) {
        ObjectNode body = Jsons.compact().createObjectNode();
        body.set("fields", IssueMapper.toFields(payload, false));
        Reply reply = execute("createIssue", "POST", "/issue", body.toString());
        JsonNode created = requireBody("createIssue", reply);
        String key = created.path("key").asText("");
        if (key.isBlank()) {
            throw new TrackerException(TrackerException.Kind.INVALID_RESPONSE, "Create reply has no issue key", null, false);
        }
        IssueFull full = fetchIssue(key, FetchMode.SUMMARY);
        if (full == null) {
            return new IssueSummary(
                    key,
                    created.path("id").asText(""),
                    payload.title() == null ? "" : payload.title(),
                    IssueMapper.UNKNOWN,
                    payload.issueType() == null ? IssueMapper.UNKNOWN : payload.issueType()
            );
        }
        return full.toSummary();
    }

    @Override
    public boolean updateIssue(String key, IssuePayload payload) {
        ObjectNode body = Jsons.compact().createObjectNode();
        body.set("fields", IssueMapper.toFields(payload, true));
        return execute("updateIssue", "PUT", "/issue/" + encodePath(requireKey(key)), body.toString()).found();
    }

    @Override
    public boolean transitionIssue(String key, String idOrName) {
        String issueKey = requireKey(key);
        if (idOrName == null || idOrName.isBlank()) {
            throw new IllegalArgumentException("transition id or name is required");
        }
        String requested = idOrName.trim();
        String transitionId = requested;
        if (!requested.chars().allMatch(Character::isDigit)) {
            String wanted = requested.toLowerCase(Locale.ROOT);
            transitionId = getTransitions(issueKey).stream()
                    .filter(t -> t.name().toLowerCase(Locale.ROOT).equals(wanted))
                    .map(Transition::id)
                    .findFirst()
                    .orElseThrow(() -> new TransitionNotFoundException(issueKey, requested));
        }
        ObjectNode body = Jsons.compact().createObjectNode();
        body.putObject("transition").put("id", transitionId);
        return execute("transitionIssue", "POST", "/issue/" + encodePath(issueKey) + "/transitions", body.toString()).found();
    }

    @Override
    public Comment addComment(String key, Document body) {
        ObjectNode request = Jsons.compact().createObjectNode();
        request.set("body", Jsons.compact().valueToTree(body == null ? Document.empty() : body));
        Reply reply = execute("addComment", "POST", "/issue/" + encodePath(requireKey(key)) + "/comment", request.toString());
        if (!reply.found()) {
            return null;
        }
        return IssueMapper.toComment(requireBody("addComment", reply));
    }

    @Override
    public Project getProject(String key) {
        Reply reply = execute("getProject", "GET", "/project/" + encodePath(requireKey(key)), null);
        if (!reply.found()) {
            return null;
        }
        return IssueMapper.toProject(requireBody("getProject", reply));
    }

    @Override
    public List<Transition> getTransitions(String key) {
        Reply reply = execute("getTransitions", "GET", "/issue/" + encodePath(requireKey(key)) + "/transitions", null);
        if (!reply.found() || reply.body() == null) {
            return List.of();
        }
        return IssueMapper.transitions(reply.body().path("transitions"));
    }

    private Reply execute(String operation, String method, String path, String body) {
        HttpRequest request = buildRequest(method, path, body);
        int maxRetries = config.maxRetries();
        for (int attempt = 0; ; attempt++) {
            log.debug("{} {} {} attempt={}", operation, method, path, attempt);
            HttpResponse<String> response;
            try {
                response = http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            } catch (HttpTimeoutException e) {
                TrackerException failure = new TrackerException(
                        TrackerException.Kind.TIMEOUT,
                        operation + " timed out after " + config.timeoutMs() + "ms",
                        null,
                        null,
                        true,
                        e
                );
                retryOrThrow(operation, attempt, maxRetries, failure);
                continue;
            } catch (IOException e) {
                TrackerException failure = new TrackerException(
                        TrackerException.Kind.NETWORK,
                        operation + " network failure: " + e.getMessage(),
                        null,
                        null,
                        true,
                        e
                );
                retryOrThrow(operation, attempt, maxRetries, failure);
                continue;
            } catch (InterruptedException e) {
                throw interrupted(operation, e);
            }

            int status = response.statusCode();
            if (status / 100 == 2) {
                return new Reply(true, parseBody(operation, status, response.body()));
            }
            if (status == 404) {
                log.debug("{} {} -> not found", operation, path);
                return new Reply(false, null);
            }
            if (status == 429) {
                RateLimitInfo info = RateLimitInfo.fromHeaders(
                        response.headers(),
                        backoff.baseDelayMs() * 2,
                        clock.millis()
                );
                if (attempt >= maxRetries) {
                    throw new TrackerException(
                            TrackerException.Kind.RATE_LIMITED,
                            operation + " rate limited; retry after " + info.retryAfterMs() + "ms",
                            status,
                            info,
                            false,
                            null
                    );
                }
                pause(operation, attempt, backoff.delay(attempt, TrackerException.Kind.RATE_LIMITED, info), "rate limited");
                continue;
            }
            if (status >= 500) {
                if (attempt >= maxRetries) {
                    throw new TrackerException(
                            TrackerException.Kind.SERVER_FAULT,
                            operation + " failed with server error " + status,
                            status,
                            false
                    );
                }
                pause(operation, attempt, backoff.delay(attempt, TrackerException.Kind.SERVER_FAULT, null), "status " + status);
                continue;
            }
            throw new TrackerException(
                    TrackerException.Kind.CLIENT_FAULT,
                    operation + " rejected with status " + status + ": " + errorBody(response.body()),
                    status,
                    false
            );
        }
    }

    private void retryOrThrow(String operation, int attempt, int maxRetries, TrackerException failure) {
        if (attempt >= maxRetries) {
            throw failure;
        }
        pause(operation, attempt, backoff.delay(attempt, failure.kind(), null), failure.kind().name().toLowerCase(Locale.ROOT));
    }

    private void pause(String operation, int attempt, long delayMs, String reason) {
        log.warn("{} retry attempt={} delayMs={} reason={}", operation, attempt + 1, delayMs, reason);
        try {
            sleeper.sleep(delayMs);
        } catch (InterruptedException e) {
            throw interrupted(operation, e);
        }
    }

    private static TrackerException interrupted(String operation, InterruptedException e) {
        Thread.currentThread().interrupt();
        return new TrackerException(
                TrackerException.Kind.INTERRUPTED,
                operation + " interrupted",
                null,
                null,
                false,
                e
        );
    }

    private HttpRequest buildRequest(String method, String path, String body) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(apiBase + path))
                .timeout(Duration.ofMillis(config.timeoutMs()))
                .header("Authorization", authorization)
                .header("Accept", "application/json")
                .header("Content-Type", "application/json");
        HttpRequest.BodyPublisher publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8);
        return builder.method(method, publisher).build();
    }

    private static JsonNode parseBody(String operation, int status, String body) {
        if (status == 204 || body == null || body.isBlank()) {
            return null;
        }
        try {
            return Jsons.compact().readTree(body);
        } catch (JsonProcessingException e) {
            throw new TrackerException(
                    TrackerException.Kind.INVALID_RESPONSE,
                    operation + " returned a non-JSON body",
                    status,
                    null,
                    false,
                    e
            );
        }
    }

    private static JsonNode requireBody(String operation, Reply reply) {
        if (reply.body() == null) {
            throw new TrackerException(TrackerException.Kind.INVALID_RESPONSE, operation + " returned no content", null, false);
        }
        return reply.body();
    }

    private String errorBody(String body) {
        if (body == null) {
            return "";
        }
        String trimmed = body.length() > MAX_ERROR_BODY_CHARS ? body.substring(0, MAX_ERROR_BODY_CHARS) + "..." : body;
        return SensitiveDataMasker.redact(trimmed, config.apiToken());
    }

    private static String requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key is required");
        }
        return key.trim();
    }

    private static String encodePath(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private record Reply(boolean found, JsonNode body) {
    }
}
