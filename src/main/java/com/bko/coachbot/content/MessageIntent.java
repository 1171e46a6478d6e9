package com.bko.coachbot.content;

/**
 * What to say to whom, and the idempotency key of the trigger that asked for it.
 */
public record MessageIntent(String userId, IntentKind kind, String triggerId) {
}
