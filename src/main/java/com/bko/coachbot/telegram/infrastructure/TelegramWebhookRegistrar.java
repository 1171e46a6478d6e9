package com.bko.coachbot.telegram.infrastructure;

import com.bko.coachbot.shared.AppSettings;
import com.bko.coachbot.shared.CoachException;
import com.bko.coachbot.shared.Deadline;
import com.bko.coachbot.shared.ServiceSettings;
import com.bko.coachbot.telegram.TelegramClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Points the platform at this instance on start-up: webhook mode registers {@code {URL}/webhook}, polling
 * mode removes any webhook so {@code getUpdates} is allowed.
 */
@Component
public class TelegramWebhookRegistrar implements ApplicationRunner {
    private static final Logger logger = LoggerFactory.getLogger(TelegramWebhookRegistrar.class);
    private static final Duration REGISTRATION_BUDGET = Duration.ofSeconds(30);

    private final TelegramClient telegramClient;
    private final AppSettings settings;
    private final Clock clock;

    public TelegramWebhookRegistrar(TelegramClient telegramClient, AppSettings settings, Clock clock) {
        this.telegramClient = telegramClient;
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!settings.isTelegramConfigured()) {
            logger.warn("TELEGRAM_TOKEN missing, the bot will neither receive nor send messages.");
            return;
        }
        Deadline deadline = Deadline.after(REGISTRATION_BUDGET, clock);
        try {
            if (settings.service().botMode() == ServiceSettings.BotMode.POLLING) {
                telegramClient.deleteWebhook(deadline);
                logger.info("Bot running in polling mode");
                return;
            }
            if (!settings.service().hasPublicUrl()) {
                logger.error("BOT_MODE is webhook but URL is not set; Telegram cannot reach this service.");
                return;
            }
            if (!settings.telegram().hasWebhookSecret()) {
                logger.warn("TELEGRAM_WEBHOOK_SECRET missing, webhook requests will be rejected.");
            }
            telegramClient.setWebhook(settings.service().baseUrl() + TelegramClient.WEBHOOK_PATH,
                    settings.telegram().webhookSecret(), deadline);
        } catch (CoachException e) {
            logger.error("Failed to configure Telegram ingress ({}): {}", e.getKind(), e.getMessage());
        }
    }
}
