package com.bko.coachbot.shared;

import java.time.Duration;

public class CoachException extends RuntimeException {
    private final ErrorKind kind;
    private final Duration retryAfter;
    private final Integer httpStatus;

    public CoachException(ErrorKind kind, String message) {
        this(kind, message, null, null, null);
    }

    public CoachException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, null, null, cause);
    }

    private CoachException(ErrorKind kind, String message, Duration retryAfter, Integer httpStatus, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.retryAfter = retryAfter;
        this.httpStatus = httpStatus;
    }

    public static CoachException rateLimited(String message, Duration retryAfter) {
        return new CoachException(ErrorKind.RATE_LIMITED, message, retryAfter, null, null);
    }

    /**
     * Missing or unverifiable credentials; answered with 401 rather than the kind's default 403.
     */
    public static CoachException unauthenticated(String message) {
        return new CoachException(ErrorKind.VALIDATION_FAILED, message, null, 401, null);
    }

    public static CoachException unauthenticated(String message, Throwable cause) {
        return new CoachException(ErrorKind.VALIDATION_FAILED, message, null, 401, cause);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }

    public int getHttpStatus() {
        return httpStatus != null ? httpStatus : kind.httpStatus();
    }
}
