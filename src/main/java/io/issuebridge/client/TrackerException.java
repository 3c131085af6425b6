package io.issuebridge.client;

public class TrackerException extends RuntimeException {
    public enum Kind {
        RATE_LIMITED,
        SERVER_FAULT,
        CLIENT_FAULT,
        TIMEOUT,
        NETWORK,
        TRANSITION_NOT_FOUND,
        INVALID_RESPONSE,
        INTERRUPTED,
        OFFLINE_QUEUED
    }

    private final Kind kind;
    private final Integer statusCode;
    private final RateLimitInfo rateLimitInfo;
    private final boolean retryable;

    public TrackerException(Kind kind, String message, Integer statusCode, boolean retryable) {
        this(kind, message, statusCode, null, retryable, null);
    }

    public TrackerException(
            Kind kind,
            String message,
            Integer statusCode,
            RateLimitInfo rateLimitInfo,
            boolean retryable,
            Throwable cause
    ) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
        this.rateLimitInfo = rateLimitInfo;
        this.retryable = retryable;
    }

    public Kind kind() {
        return kind;
    }

    public Integer statusCode() {
        return statusCode;
    }

    public RateLimitInfo rateLimitInfo() {
        return rateLimitInfo;
    }

    public boolean retryable() {
        return retryable;
    }
}
