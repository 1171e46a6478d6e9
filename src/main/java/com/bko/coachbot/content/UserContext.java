package com.bko.coachbot.content;

import java.util.List;

/**
 * What the generator may know about the user.
 *
 * @param healthSummary      latest metrics, one per line, or {@code null} when nothing is stored
 * @param recentConversation latest chat lines rendered as {@code role: text}, oldest first
 * @param incomingMessage    the message being answered, only for chat replies
 */
public record UserContext(String userName, String healthSummary, List<String> recentConversation, String incomingMessage) {
    public UserContext {
        recentConversation = recentConversation == null ? List.of() : List.copyOf(recentConversation);
    }

    public static UserContext of(String userName) {
        return new UserContext(userName, null, List.of(), null);
    }
}
