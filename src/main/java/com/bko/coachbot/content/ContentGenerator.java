package com.bko.coachbot.content;

import com.bko.coachbot.shared.Deadline;

public interface ContentGenerator {

    /**
     * Produces a message for {@code intent}. Never fails: when the generative API errors, times out or is
     * not configured, a static template is returned instead and tagged {@link MessageBody.Source#TEMPLATE}.
     */
    MessageBody generate(MessageIntent intent, UserContext context, Deadline deadline);
}
