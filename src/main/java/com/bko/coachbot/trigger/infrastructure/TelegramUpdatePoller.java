package com.bko.coachbot.trigger.infrastructure;

import com.bko.coachbot.shared.AppSettings;
import com.bko.coachbot.shared.CoachException;
import com.bko.coachbot.shared.Deadline;
import com.bko.coachbot.shared.ServiceSettings;
import com.bko.coachbot.telegram.TelegramClient;
import com.bko.coachbot.telegram.TelegramUpdate;
import com.bko.coachbot.trigger.app.TriggerRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Polling ingress: feeds {@code getUpdates} results through the same handler as the webhook. An update that
 * failed retryably is fetched again on the next poll.
 */
@Component
public class TelegramUpdatePoller {
    private static final Logger logger = LoggerFactory.getLogger(TelegramUpdatePoller.class);
    private static final Duration LONG_POLL = Duration.ofSeconds(25);

    private final TelegramClient telegramClient;
    private final TriggerRouter triggerRouter;
    private final AppSettings settings;
    private final Clock clock;
    private long offset;

    public TelegramUpdatePoller(TelegramClient telegramClient, TriggerRouter triggerRouter, AppSettings settings, Clock clock) {
        this.telegramClient = telegramClient;
        this.triggerRouter = triggerRouter;
        this.settings = settings;
        this.clock = clock;
    }

    @Scheduled(fixedDelay = 1000, initialDelay = 2000)
    public void poll() {
        if (settings.service().botMode() != ServiceSettings.BotMode.POLLING || !settings.isTelegramConfigured()) {
            return;
        }
        List<TelegramUpdate> updates;
        try {
            Deadline deadline = Deadline.after(LONG_POLL.plus(settings.service().httpTimeout()).plusSeconds(5), clock);
            updates = telegramClient.getUpdates(offset, LONG_POLL, deadline);
        } catch (CoachException e) {
            logger.warn("Polling Telegram failed ({}): {}", e.getKind(), e.getMessage());
            return;
        }
        for (TelegramUpdate update : updates) {
            try {
                triggerRouter.handlePolled(update);
            } catch (CoachException e) {
                logger.warn("Update {} failed with {}, polling it again", update.updateId(), e.getKind());
                return;
            }
            offset = update.updateId() + 1;
        }
    }

    long offset() {
        return offset;
    }
}
