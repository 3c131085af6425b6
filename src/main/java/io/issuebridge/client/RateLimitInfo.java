package io.issuebridge.client;

import java.net.http.HttpHeaders;
import java.util.Optional;

public record RateLimitInfo(long retryAfterMs, int remaining, long resetAtMs) {
    public static final String RETRY_AFTER = "Retry-After";
    public static final String REMAINING = "X-RateLimit-Remaining";
    public static final String RESET = "X-RateLimit-Reset";

    public static RateLimitInfo fromHeaders(HttpHeaders headers, long defaultRetryAfterMs, long nowMs) {
        long retryAfterMs = parseLong(headers.firstValue(RETRY_AFTER))
                .map(seconds -> Math.max(0L, seconds) * 1000L)
                .orElse(defaultRetryAfterMs);
        int remaining = parseLong(headers.firstValue(REMAINING))
                .map(value -> (int) Math.max(0L, Math.min(Integer.MAX_VALUE, value)))
                .orElse(0);
        long resetAtMs = parseLong(headers.firstValue(RESET))
                .map(seconds -> seconds * 1000L)
                .orElse(nowMs + retryAfterMs);
        return new RateLimitInfo(retryAfterMs, remaining, resetAtMs);
    }

    private static Optional<Long> parseLong(Optional<String> raw) {
        if (raw.isEmpty() || raw.get().isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(raw.get().trim()));
        } catch (NumberFormatException e) {
            // HTTP-date form of Retry-After is not used by the tracker; fall back to the default.
            return Optional.empty();
        }
    }
}
