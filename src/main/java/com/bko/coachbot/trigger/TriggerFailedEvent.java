package com.bko.coachbot.trigger;

import com.bko.coachbot.shared.ErrorKind;

import java.time.Instant;

/**
 * Published when a trigger, or one user of a scheduled batch, failed with an error that no retry will fix.
 *
 * @param userId {@code null} when the whole trigger was refused before any user was touched
 */
public record TriggerFailedEvent(
        String endpoint,
        String triggerId,
        String userId,
        ErrorKind kind,
        String reason,
        Instant occurredAt
) {
}
