package com.bko.coachbot.trigger.app;

import com.bko.coachbot.content.UserContext;
import com.bko.coachbot.healthsync.HealthDataQuery;
import com.bko.coachbot.healthsync.HealthRecord;
import com.bko.coachbot.healthsync.HealthSnapshot;
import com.bko.coachbot.healthsync.MetricType;
import com.bko.coachbot.profile.ChatLine;
import com.bko.coachbot.profile.UserProfile;
import com.bko.coachbot.profile.infrastructure.InMemoryConversationLog;
import com.bko.coachbot.shared.CoachException;
import com.bko.coachbot.shared.ErrorKind;
import com.bko.coachbot.shared.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class UserContextAssemblerTest {
    private static final Instant NOW = Instant.parse("2025-01-10T07:00:00Z");

    private final MutableClock clock = new MutableClock(NOW);
    private final HealthDataQuery healthDataQuery = mock(HealthDataQuery.class);
    private final InMemoryConversationLog conversationLog = new InMemoryConversationLog(clock);
    private final UserContextAssembler assembler = new UserContextAssembler(healthDataQuery, conversationLog);

    @Test
    void keepsTheLastThreeLinesOldestFirst() {
        when(healthDataQuery.latestSnapshot("1001")).thenReturn(new HealthSnapshot(List.of(
                new HealthRecord("1001", MetricType.RESTING_HEART_RATE, 52.0, NOW.minus(Duration.ofHours(3)), NOW))));
        append(ChatLine.Role.USER, "one");
        append(ChatLine.Role.ASSISTANT, "two");
        append(ChatLine.Role.USER, "three");
        append(ChatLine.Role.ASSISTANT, "four");

        UserContext context = assembler.assemble(new UserProfile("1001", "Ana", NOW), true, "five");

        assertEquals("Ana", context.userName());
        assertEquals(List.of("assistant: two", "user: three", "assistant: four"), context.recentConversation());
        assertTrue(context.healthSummary().startsWith("Resting heart rate: 52 bpm"));
        assertEquals("five", context.incomingMessage());
    }

    @Test
    void storeFailureLeavesHealthEmpty() {
        when(healthDataQuery.latestSnapshot("1001"))
                .thenThrow(new CoachException(ErrorKind.UPSTREAM_UNAVAILABLE, "Firestore unavailable"));

        UserContext context = assembler.assemble(new UserProfile("1001", null, NOW), false, null);

        assertNull(context.healthSummary());
        assertEquals("there", context.userName());
        assertTrue(context.recentConversation().isEmpty());
    }

    private void append(ChatLine.Role role, String content) {
        conversationLog.append("1001", "line-" + content, role, content);
        clock.advance(Duration.ofSeconds(1));
    }
}
