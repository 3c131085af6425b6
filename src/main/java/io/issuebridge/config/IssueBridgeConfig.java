package io.issuebridge.config;

import com.fasterxml.jackson.databind.JsonNode;
import io.issuebridge.security.SensitiveDataMasker;
import io.issuebridge.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

public final class IssueBridgeConfig {
    public static final String SETTINGS_FILE = "issuebridge-settings.json";
    public static final String CACHE_FILE = "issuebridge-cache.db";
    public static final String ENV_BASE_URL = "ISSUEBRIDGE_BASE_URL";
    public static final String ENV_EMAIL = "ISSUEBRIDGE_EMAIL";
    public static final String ENV_API_TOKEN = "ISSUEBRIDGE_API_TOKEN";

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_RETRY_DELAY_MS = 1_000L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 30_000L;
    public static final long DEFAULT_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_SYNC_INTERVAL_MS = 5L * 60L * 1000L;
    public static final long DEFAULT_CACHE_EXPIRY_MS = 24L * 60L * 60L * 1000L;
    public static final int DEFAULT_SEARCH_PAGE_SIZE = 50;
    public static final int FETCH_ALL_PAGE_SIZE = 100;

    private final Path rootDir;
    private final String baseUrl;
    private final String email;
    private final String apiToken;
    private final int maxRetries;
    private final long retryDelayMs;
    private final long maxBackoffMs;
    private final long timeoutMs;
    private final Path cacheFile;
    private final long syncIntervalMs;
    private final long cacheExpiryMs;
    private final int searchPageSize;

    private IssueBridgeConfig(Builder b) {
        this.rootDir = b.rootDir;
        this.baseUrl = normalizeBaseUrl(b.baseUrl);
        this.email = b.email == null ? "" : b.email.trim();
        this.apiToken = b.apiToken == null ? "" : b.apiToken.trim();
        this.maxRetries = Math.max(0, b.maxRetries);
        this.retryDelayMs = Math.max(1L, b.retryDelayMs);
        this.maxBackoffMs = Math.max(this.retryDelayMs, b.maxBackoffMs);
        this.timeoutMs = Math.max(1L, b.timeoutMs);
        this.cacheFile = b.cacheFile == null ? b.rootDir.resolve(CACHE_FILE) : b.cacheFile;
        this.syncIntervalMs = Math.max(1L, b.syncIntervalMs);
        this.cacheExpiryMs = Math.max(1L, b.cacheExpiryMs);
        this.searchPageSize = Math.max(1, b.searchPageSize);
    }

    public static Builder builder(Path rootDir) {
        return new Builder(rootDir);
    }

    public static IssueBridgeConfig fromRoot(String root) {
        return fromRoot(root, System.getenv());
    }

    public static IssueBridgeConfig fromRoot(String root, Map<String, String> env) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        Builder builder = new Builder(base);
        applySettingsFile(builder, base.resolve(SETTINGS_FILE));
        if (env != null) {
            builder.baseUrl(firstNonBlank(env.get(ENV_BASE_URL), builder.baseUrl));
            builder.email(firstNonBlank(env.get(ENV_EMAIL), builder.email));
            builder.apiToken(firstNonBlank(env.get(ENV_API_TOKEN), builder.apiToken));
        }
        return builder.build();
    }

    private static void applySettingsFile(Builder builder, Path file) {
        if (!Files.exists(file)) {
            return;
        }
        SettingsFile settings;
        try {
            settings = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load settings: " + file, e);
        }
        if (settings == null) {
            return;
        }
        builder.baseUrl(firstNonBlank(settings.baseUrl(), builder.baseUrl));
        builder.email(firstNonBlank(settings.email(), builder.email));
        builder.apiToken(firstNonBlank(settings.apiToken(), builder.apiToken));
        builder.maxRetries(sanitizeInt(settings.maxRetries(), builder.maxRetries, 0));
        builder.retryDelayMs(sanitizeLong(settings.retryDelayMs(), builder.retryDelayMs, 1L));
        builder.maxBackoffMs(sanitizeLong(settings.maxBackoffMs(), builder.maxBackoffMs, builder.retryDelayMs));
        builder.timeoutMs(sanitizeLong(settings.timeoutMs(), builder.timeoutMs, 100L));
        builder.syncIntervalMs(sanitizeLong(settings.syncIntervalMs(), builder.syncIntervalMs, 1_000L));
        builder.cacheExpiryMs(sanitizeLong(settings.cacheExpiryMs(), builder.cacheExpiryMs, 1_000L));
        builder.searchPageSize(sanitizeInt(settings.searchPageSize(), builder.searchPageSize, 1));
        if (settings.cacheFile() != null && !settings.cacheFile().isBlank()) {
            Path cache = Paths.get(settings.cacheFile().trim());
            builder.cacheFile(cache.isAbsolute() ? cache : builder.rootDir.resolve(cache));
        }
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static String firstNonBlank(String preferred, String fallback) {
        return preferred == null || preferred.isBlank() ? fallback : preferred.trim();
    }

    private static String normalizeBaseUrl(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        String value = raw.trim();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }

    public Builder toBuilder() {
        return new Builder(rootDir)
                .baseUrl(baseUrl)
                .email(email)
                .apiToken(apiToken)
                .maxRetries(maxRetries)
                .retryDelayMs(retryDelayMs)
                .maxBackoffMs(maxBackoffMs)
                .timeoutMs(timeoutMs)
                .cacheFile(cacheFile)
                .syncIntervalMs(syncIntervalMs)
                .cacheExpiryMs(cacheExpiryMs)
                .searchPageSize(searchPageSize);
    }

    public boolean hasCredentials() {
        return !baseUrl.isBlank() && !email.isBlank() && !apiToken.isBlank();
    }

    public Path rootDir() {
        return rootDir;
    }

    public String baseUrl() {
        return baseUrl;
    }

    public String apiBaseUrl() {
        return baseUrl + "/rest/api/3";
    }

    public String email() {
        return email;
    }

    public String apiToken() {
        return apiToken;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public long retryDelayMs() {
        return retryDelayMs;
    }

    public long maxBackoffMs() {
        return maxBackoffMs;
    }

    public long timeoutMs() {
        return timeoutMs;
    }

    public Path cacheFile() {
        return cacheFile;
    }

    public long syncIntervalMs() {
        return syncIntervalMs;
    }

    public long cacheExpiryMs() {
        return cacheExpiryMs;
    }

    public int searchPageSize() {
        return searchPageSize;
    }

    public JsonNode view() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("root_dir", rootDir.toString());
        out.put("base_url", baseUrl);
        out.put("email", email);
        out.put("api_token", apiToken);
        out.put("max_retries", maxRetries);
        out.put("retry_delay_ms", retryDelayMs);
        out.put("max_backoff_ms", maxBackoffMs);
        out.put("timeout_ms", timeoutMs);
        out.put("cache_file", cacheFile.toString());
        out.put("sync_interval_ms", syncIntervalMs);
        out.put("cache_expiry_ms", cacheExpiryMs);
        out.put("search_page_size", searchPageSize);
        return SensitiveDataMasker.masked(Jsons.mapper().valueToTree(out));
    }

    private record SettingsFile(
            String baseUrl,
            String email,
            String apiToken,
            Integer maxRetries,
            Long retryDelayMs,
            Long maxBackoffMs,
            Long timeoutMs,
            String cacheFile,
            Long syncIntervalMs,
            Long cacheExpiryMs,
            Integer searchPageSize
    ) {
    }

    public static final class Builder {
        private final Path rootDir;
        private String baseUrl = "";
        private String email = "";
        private String apiToken = "";
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private long retryDelayMs = DEFAULT_RETRY_DELAY_MS;
        private long maxBackoffMs = DEFAULT_MAX_BACKOFF_MS;
        private long timeoutMs = DEFAULT_TIMEOUT_MS;
        private Path cacheFile;
        private long syncIntervalMs = DEFAULT_SYNC_INTERVAL_MS;
        private long cacheExpiryMs = DEFAULT_CACHE_EXPIRY_MS;
        private int searchPageSize = DEFAULT_SEARCH_PAGE_SIZE;

        private Builder(Path rootDir) {
            this.rootDir = rootDir == null ? Paths.get("data").toAbsolutePath().normalize() : rootDir;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder apiToken(String apiToken) {
            this.apiToken = apiToken;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryDelayMs(long retryDelayMs) {
            this.retryDelayMs = retryDelayMs;
            return this;
        }

        public Builder maxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
            return this;
        }

        public Builder timeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Builder cacheFile(Path cacheFile) {
            this.cacheFile = cacheFile;
            return this;
        }

        public Builder syncIntervalMs(long syncIntervalMs) {
            this.syncIntervalMs = syncIntervalMs;
            return this;
        }

        public Builder cacheExpiryMs(long cacheExpiryMs) {
            this.cacheExpiryMs = cacheExpiryMs;
            return this;
        }

        public Builder searchPageSize(int searchPageSize) {
            this.searchPageSize = searchPageSize;
            return this;
        }

        public IssueBridgeConfig build() {
            return new IssueBridgeConfig(this);
        }
    }
}
