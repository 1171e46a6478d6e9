package com.bko.coachbot.dispatch;

import java.time.Instant;

public record DispatchOutcome(String triggerId, String userId, DispatchStatus status, Instant sentAt, long platformMessageId) {
}
