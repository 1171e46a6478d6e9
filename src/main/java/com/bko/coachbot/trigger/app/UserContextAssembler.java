package com.bko.coachbot.trigger.app;

import com.bko.coachbot.content.UserContext;
import com.bko.coachbot.healthsync.HealthDataQuery;
import com.bko.coachbot.healthsync.HealthSnapshot;
import com.bko.coachbot.profile.ChatLine;
import com.bko.coachbot.profile.ConversationLog;
import com.bko.coachbot.profile.UserProfile;
import com.bko.coachbot.shared.CoachException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Gathers what the generator may know about a user. Every lookup is optional: a store failure leaves that
 * part of the context empty instead of failing the trigger.
 */
@Component
public class UserContextAssembler {
    private static final Logger logger = LoggerFactory.getLogger(UserContextAssembler.class);
    static final int HISTORY_LINES = 3;

    private final HealthDataQuery healthDataQuery;
    private final ConversationLog conversationLog;

    public UserContextAssembler(HealthDataQuery healthDataQuery, ConversationLog conversationLog) {
        this.healthDataQuery = healthDataQuery;
        this.conversationLog = conversationLog;
    }

    public UserContext assemble(UserProfile user, boolean withHistory, String incomingMessage) {
        return new UserContext(user.displayName(), healthSummary(user.userId()),
                withHistory ? history(user.userId()) : List.of(), incomingMessage);
    }

    private String healthSummary(String userId) {
        try {
            HealthSnapshot snapshot = healthDataQuery.latestSnapshot(userId);
            return snapshot.isEmpty() ? null : snapshot.describe();
        } catch (CoachException e) {
            logger.warn("Could not load health data of user {}: {}", userId, e.getMessage());
            return null;
        }
    }

    private List<String> history(String userId) {
        try {
            return conversationLog.recent(userId, HISTORY_LINES).stream()
                    .map(UserContextAssembler::render)
                    .collect(Collectors.toList());
        } catch (CoachException e) {
            logger.warn("Could not load chat history of user {}: {}", userId, e.getMessage());
            return List.of();
        }
    }

    static String render(ChatLine line) {
        return line.role().name().toLowerCase(Locale.ROOT) + ": " + line.content();
    }
}
