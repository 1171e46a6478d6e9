package com.bko.coachbot.profile.infrastructure;

import com.bko.coachbot.profile.ChatLine;
import com.bko.coachbot.profile.ConversationLog;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryConversationLog implements ConversationLog {
    private final ConcurrentMap<String, Map<String, ChatLine>> lines = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryConversationLog(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void append(String userId, String lineId, ChatLine.Role role, String content) {
        Map<String, ChatLine> userLines = lines.computeIfAbsent(userId, id -> new LinkedHashMap<>());
        synchronized (userLines) {
            userLines.putIfAbsent(lineId, new ChatLine(role, content, clock.instant()));
        }
    }

    @Override
    public List<ChatLine> recent(String userId, int limit) {
        Map<String, ChatLine> userLines = lines.get(userId);
        if (userLines == null) {
            return List.of();
        }
        synchronized (userLines) {
            List<ChatLine> all = new ArrayList<>(userLines.values());
            return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
        }
    }
}
