package com.bko.coachbot.trigger.app;

import com.bko.coachbot.content.MessageBody;
import com.bko.coachbot.dispatch.DispatchOutcome;

/**
 * Result of one per-user message. {@code body} is {@code null} when the trigger had already been delivered and
 * nothing was generated.
 */
public record Engagement(DispatchOutcome outcome, MessageBody body) {
    public boolean isReplay() {
        return body == null;
    }
}
