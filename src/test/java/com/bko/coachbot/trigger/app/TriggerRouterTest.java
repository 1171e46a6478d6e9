package com.bko.coachbot.trigger.app;

import com.bko.coachbot.shared.CoachException;
import com.bko.coachbot.shared.ErrorKind;
import com.bko.coachbot.shared.MutableClock;
import com.bko.coachbot.shared.TestSettings;
import com.bko.coachbot.telegram.TelegramChat;
import com.bko.coachbot.telegram.TelegramMessage;
import com.bko.coachbot.telegram.TelegramUpdate;
import com.bko.coachbot.telegram.TelegramUser;
import com.bko.coachbot.trigger.TriggerFailedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class TriggerRouterTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2025-01-10T07:00:12Z"));
    private CallerAuthenticator callerAuthenticator;
    private ScheduledTriggerService scheduledTriggerService;
    private WebhookUpdateHandler webhookUpdateHandler;
    private ApplicationEventPublisher events;
    private TriggerRouter router;

    @BeforeEach
    void setUp() {
        callerAuthenticator = mock(CallerAuthenticator.class);
        scheduledTriggerService = mock(ScheduledTriggerService.class);
        webhookUpdateHandler = mock(WebhookUpdateHandler.class);
        events = mock(ApplicationEventPublisher.class);
        router = new TriggerRouter(callerAuthenticator, new WebhookSecretVerifier(TestSettings.configured()),
                scheduledTriggerService, webhookUpdateHandler, events, TestSettings.configured(), clock);
    }

    @Test
    void runsAuthenticatedScheduledTrigger() {
        BatchResult batch = new BatchResult("sched:check-in:2025-01-10T07:00:00Z", 2, 2, 0, 0, null);
        when(scheduledTriggerService.run(eq(ScheduledJob.CHECK_IN), eq("sched:check-in:2025-01-10T07:00:00Z"), any()))
                .thenReturn(batch);

        BatchResult result = router.handleScheduled(ScheduledJob.CHECK_IN, "Bearer t", "check-in",
                "2025-01-10T07:00:00Z");

        assertSame(batch, result);
        verify(callerAuthenticator).verifyScheduler("Bearer t");
    }

    @Test
    void rejectedCallerReachesNothingDownstream() {
        doThrow(new CoachException(ErrorKind.VALIDATION_FAILED, "Identity token audience mismatch"))
                .when(callerAuthenticator).verifyScheduler("Bearer t");

        CoachException thrown = assertThrows(CoachException.class,
                () -> router.handleScheduled(ScheduledJob.MORNING_MOTIVATION, "Bearer t", null, null));

        assertEquals(ErrorKind.VALIDATION_FAILED, thrown.getKind());
        verifyNoInteractions(scheduledTriggerService);
        ArgumentCaptor<TriggerFailedEvent> event = ArgumentCaptor.forClass(TriggerFailedEvent.class);
        verify(events).publishEvent(event.capture());
        assertEquals("morning_motivation", event.getValue().endpoint());
        assertNull(event.getValue().userId());
    }

    @Test
    void retryableBatchFailureIsRaisedForTheScheduler() {
        CoachException throttled = CoachException.rateLimited("Telegram 429", null);
        when(scheduledTriggerService.run(any(), any(), any()))
                .thenReturn(new BatchResult("sched:update-health-data:2025-01-10T07:00:00Z", 3, 2, 0, 0, throttled));

        CoachException thrown = assertThrows(CoachException.class,
                () -> router.handleScheduled(ScheduledJob.HEALTH_SYNC, "Bearer t", null, null));

        assertSame(throttled, thrown);
        verify(events, never()).publishEvent(any(Object.class));
    }

    @Test
    void webhookWithWrongSecretIsRefused() {
        CoachException thrown = assertThrows(CoachException.class,
                () -> router.handleWebhook("wrong", update("hi", "private")));

        assertEquals(403, thrown.getHttpStatus());
        verifyNoInteractions(webhookUpdateHandler);
    }

    @Test
    void webhookWithoutSecretIsUnauthenticated() {
        CoachException thrown = assertThrows(CoachException.class,
                () -> router.handleWebhook(null, update("hi", "private")));

        assertEquals(401, thrown.getHttpStatus());
    }

    @Test
    void privateTextMessageIsHandledUnderItsMessageKey() {
        TelegramUpdate update = update("hi", "private");

        router.handleWebhook("hook-secret", update);

        verify(webhookUpdateHandler).handle(eq("tg:1001:55"), eq(update.message()), any());
    }

    @Test
    void groupAndNonTextUpdatesAreIgnored() {
        router.handleWebhook("hook-secret", update("hi", "group"));
        router.handleWebhook("hook-secret", update(null, "private"));
        router.handlePolled(new TelegramUpdate(901, null));

        verifyNoInteractions(webhookUpdateHandler);
    }

    private TelegramUpdate update(String text, String chatType) {
        return new TelegramUpdate(900, new TelegramMessage(55, new TelegramUser(1001, "Ana", null),
                new TelegramChat(1001, chatType), 1736492400L, text));
    }
}
