package com.bko.coachbot.shared;

import java.time.Duration;

/**
 * Buffered outcome of one outbound HTTP call.
 */
public record HttpResult(int statusCode, String body, String retryAfterHeader) {
    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean isServerError() {
        return statusCode >= 500;
    }

    public Duration retryAfter() {
        if (retryAfterHeader == null || retryAfterHeader.isBlank()) {
            return null;
        }
        try {
            return Duration.ofSeconds(Long.parseLong(retryAfterHeader.trim()));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
