package com.bko.coachbot.shared;

/**
 * Failure classification shared by every component. The HTTP status is what the trigger surface answers
 * with when an error of this kind is left unresolved.
 */
public enum ErrorKind {
    AUTH_EXPIRED(false, 424),
    RATE_LIMITED(true, 429),
    UPSTREAM_UNAVAILABLE(true, 503),
    VALIDATION_FAILED(false, 403),
    DEADLINE_EXCEEDED(true, 504),
    DELIVERY_REJECTED(false, 424);

    private final boolean retryable;
    private final int httpStatus;

    ErrorKind(boolean retryable, int httpStatus) {
        this.retryable = retryable;
        this.httpStatus = httpStatus;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
