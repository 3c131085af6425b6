package io.issuebridge.client;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongSupplier;

public final class BackoffPolicy {
    public static final long MAX_JITTER_MS = 1000L;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final LongSupplier jitterMs;

    public BackoffPolicy(long baseDelayMs, long maxDelayMs) {
        this(baseDelayMs, maxDelayMs, () -> ThreadLocalRandom.current().nextLong(MAX_JITTER_MS));
    }

    public BackoffPolicy(long baseDelayMs, long maxDelayMs, LongSupplier jitterMs) {
        this.baseDelayMs = Math.max(1L, baseDelayMs);
        this.maxDelayMs = Math.max(this.baseDelayMs, maxDelayMs);
        this.jitterMs = jitterMs;
    }

    public long delay(int attempt, TrackerException.Kind kind, RateLimitInfo rateLimit) {
        if (kind == TrackerException.Kind.RATE_LIMITED && rateLimit != null && rateLimit.retryAfterMs() > 0) {
            return rateLimit.retryAfterMs();
        }
        return exponential(attempt);
    }

    long exponential(int attempt) {
        int exp = Math.max(0, Math.min(attempt, 30));
        long raw = baseDelayMs * (1L << exp);
        if (raw <= 0 || raw > maxDelayMs) {
            raw = maxDelayMs;
        }
        long jitter = Math.max(0L, Math.min(MAX_JITTER_MS - 1, jitterMs.getAsLong()));
        return Math.min(raw + jitter, maxDelayMs);
    }

    public long baseDelayMs() {
        return baseDelayMs;
    }
}
