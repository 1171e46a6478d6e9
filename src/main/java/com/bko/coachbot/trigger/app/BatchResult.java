package com.bko.coachbot.trigger.app;

import com.bko.coachbot.shared.CoachException;

/**
 * Summary of one scheduled fan-out. {@code retryableFailure} is the first per-user error a later run may
 * fix; when present the whole trigger is answered with its status so the scheduler retries.
 */
public record BatchResult(String triggerId, int attempted, int succeeded, int skipped, int permanentFailures,
                          CoachException retryableFailure) {
    public boolean hasRetryableFailure() {
        return retryableFailure != null;
    }
}
