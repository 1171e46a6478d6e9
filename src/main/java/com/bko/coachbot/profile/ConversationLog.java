package com.bko.coachbot.profile;

import java.util.List;

public interface ConversationLog {
    /**
     * Appends a line once per {@code lineId}; a redelivered line with the same id keeps the first copy.
     */
    void append(String userId, String lineId, ChatLine.Role role, String content);

    /**
     * Latest {@code limit} lines, oldest first.
     */
    List<ChatLine> recent(String userId, int limit);
}
