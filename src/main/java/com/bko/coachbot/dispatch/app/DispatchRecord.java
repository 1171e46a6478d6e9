package com.bko.coachbot.dispatch.app;

import com.bko.coachbot.dispatch.DispatchOutcome;
import com.bko.coachbot.dispatch.DispatchStatus;

import java.time.Instant;

/**
 * Ledger entry of one delivery attempt, keyed by trigger id. {@code detail} holds the refusal reason of a
 * rejected send.
 */
public record DispatchRecord(
        String triggerId,
        String userId,
        DispatchStatus status,
        Instant recordedAt,
        long platformMessageId,
        String detail
) {
    public boolean isSent() {
        return status == DispatchStatus.SENT;
    }

    public DispatchOutcome toOutcome() {
        return new DispatchOutcome(triggerId, userId, status, recordedAt, platformMessageId);
    }
}
