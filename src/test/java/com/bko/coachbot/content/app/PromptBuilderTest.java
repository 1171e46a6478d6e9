package com.bko.coachbot.content.app;

import com.bko.coachbot.content.IntentKind;
import com.bko.coachbot.content.UserContext;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PromptBuilderTest {
    private final PromptBuilder builder = new PromptBuilder();

    @Test
    void chatReplyCarriesHealthHistoryAndMessage() {
        UserContext context = new UserContext("Ana", "Recovery: 64%",
                List.of("user: slept badly", "assistant: try an earlier bedtime"), "what should I train today?");

        String prompt = builder.build(IntentKind.CHAT_REPLY, context);

        assertTrue(prompt.contains("User's name: Ana"));
        assertTrue(prompt.contains("Recovery: 64%"));
        assertTrue(prompt.contains("user: slept badly\nassistant: try an earlier bedtime"));
        assertTrue(prompt.contains("what should I train today?"));
    }

    @Test
    void missingDataIsSpelledOut() {
        String prompt = builder.build(IntentKind.CHECK_IN, UserContext.of("Ana"));

        assertTrue(prompt.contains("User's health data: No data"));
        assertTrue(prompt.contains("Recent chat history: No history"));
        assertTrue(prompt.contains("proactive check-in"));
    }

    @Test
    void reportPromptListsMetrics() {
        String prompt = builder.build(IntentKind.HEALTH_UPDATE,
                new UserContext("Ana", "Sleep performance: 91%\nHRV: 55.2 ms", List.of("user: hi"), null));

        assertTrue(prompt.contains("Ana asked for a health report"));
        assertTrue(prompt.contains("HRV: 55.2 ms"));
        assertFalse(prompt.contains("user: hi"));
    }

    @Test
    void motivationPromptIsShort() {
        String prompt = builder.build(IntentKind.MORNING_MOTIVATION, UserContext.of("Ana"));

        assertTrue(prompt.contains("battle cry"));
        assertTrue(prompt.contains("User's name: Ana"));
    }
}
