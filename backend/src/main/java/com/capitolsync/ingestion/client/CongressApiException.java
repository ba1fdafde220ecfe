package com.capitolsync.ingestion.client;

import java.util.Set;

/**
 * Thrown when a Congress.gov request fails (HTTP error, network error, timeout or unreadable body).
 * A status code of 0 means no HTTP response was received.
 */
public class CongressApiException extends RuntimeException {

    private static final Set<Integer> RETRYABLE_STATUS = Set.of(408, 429, 500, 502, 503, 504);

    private final int statusCode;
    private final long retryAfterMs;

    public CongressApiException(String message, int statusCode, long retryAfterMs, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.retryAfterMs = retryAfterMs;
    }

    public CongressApiException(String message, Throwable cause) {
        this(message, -1, 0L, cause);
    }

    public CongressApiException(String message) {
        this(message, -1, 0L, null);
    }

    /** Connection failure or timeout before any response. */
    public static CongressApiException network(String message, Throwable cause) {
        return new CongressApiException(message, 0, 0L, cause);
    }

    public int getStatusCode() {
        return statusCode;
    }

    /** Server-requested wait from a Retry-After header, 0 if none. */
    public long getRetryAfterMs() {
        return retryAfterMs;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }

    /** Network errors and 408/429/5xx gateway statuses are worth retrying; everything else fails fast. */
    public boolean isRetryable() {
        return statusCode == 0 || RETRYABLE_STATUS.contains(statusCode);
    }
}
