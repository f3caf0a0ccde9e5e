package com.causescore.ingestion.adapter;

/**
 * Thrown when a social platform call fails (HTTP error, timeout, unparseable payload).
 * Non-retryable failures (unknown handle, rejected credentials) skip the remaining retries.
 */
public class SocialApiException extends RuntimeException {

    private final boolean retryable;
    private final int statusCode;

    public SocialApiException(String message) {
        this(message, null, true, 0);
    }

    public SocialApiException(String message, Throwable cause) {
        this(message, cause, true, 0);
    }

    public SocialApiException(String message, Throwable cause, boolean retryable, int statusCode) {
        super(message, cause);
        this.retryable = retryable;
        this.statusCode = statusCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /** HTTP status when known, else 0. */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isUnauthorized() {
        return statusCode == 401 || statusCode == 403;
    }
}
