package com.bko.coachbot.trigger.app;

import com.bko.coachbot.content.IntentKind;
import com.bko.coachbot.content.MessageTemplates;
import com.bko.coachbot.healthsync.HealthSync;
import com.bko.coachbot.profile.ChatLine;
import com.bko.coachbot.profile.ConversationLog;
import com.bko.coachbot.profile.UserDirectory;
import com.bko.coachbot.profile.UserProfile;
import com.bko.coachbot.shared.CoachException;
import com.bko.coachbot.shared.Deadline;
import com.bko.coachbot.shared.ErrorKind;
import com.bko.coachbot.telegram.TelegramMessage;
import com.bko.coachbot.trigger.TriggerFailedEvent;
import com.bko.coachbot.vault.AuthorizationLink;
import com.bko.coachbot.vault.TokenVault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * Bot commands and free-text chat. Each incoming message is answered with exactly one message keyed by the
 * message's trigger id, so a redelivered update is recognised and ignored.
 */
@Service
public class WebhookUpdateHandler {
    private static final Logger logger = LoggerFactory.getLogger(WebhookUpdateHandler.class);
    static final String ENDPOINT = "webhook";

    private final UserDirectory userDirectory;
    private final ConversationLog conversationLog;
    private final TokenVault tokenVault;
    private final HealthSync healthSync;
    private final EngagementService engagementService;
    private final ApplicationEventPublisher events;
    private final Clock clock;

    public WebhookUpdateHandler(UserDirectory userDirectory,
                                ConversationLog conversationLog,
                                TokenVault tokenVault,
                                HealthSync healthSync,
                                EngagementService engagementService,
                                ApplicationEventPublisher events,
                                Clock clock) {
        this.userDirectory = userDirectory;
        this.conversationLog = conversationLog;
        this.tokenVault = tokenVault;
        this.healthSync = healthSync;
        this.engagementService = engagementService;
        this.events = events;
        this.clock = clock;
    }

    /**
     * Handles one message. Permanent failures are answered with the generic fallback text and reported;
     * only retryable failures propagate, so the platform redelivers the update.
     */
    public void handle(String triggerId, TelegramMessage message, Deadline deadline) {
        String userId = String.valueOf(message.chat().id());
        if (engagementService.isDelivered(triggerId)) {
            logger.info("Update {} already answered, ignoring redelivery", triggerId);
            return;
        }
        try {
            route(triggerId, userId, message, deadline);
        } catch (CoachException e) {
            if (e.isRetryable()) {
                throw e;
            }
            fail(triggerId, userId, e.getKind(), e.getMessage(), deadline);
        } catch (RuntimeException e) {
            logger.error("Unexpected error handling update {}", triggerId, e);
            fail(triggerId, userId, null, e.toString(), deadline);
        }
    }

    private void route(String triggerId, String userId, TelegramMessage message, Deadline deadline) {
        String command = message.command();
        if ("/start".equals(command)) {
            String firstName = message.from() != null ? message.from().firstName() : null;
            UserProfile profile = userDirectory.register(userId, firstName);
            engagementService.reply(triggerId, userId, MessageTemplates.welcome(profile.displayName()), deadline);
            return;
        }

        Optional<UserProfile> user = userDirectory.find(userId);
        if (user.isEmpty()) {
            engagementService.reply(triggerId, userId, MessageTemplates.START_FIRST, deadline);
            return;
        }
        UserProfile profile = user.get();

        if (command == null) {
            chat(triggerId, profile, message.text(), deadline);
            return;
        }
        switch (command) {
            case "/linkwhoop" -> {
                AuthorizationLink link = tokenVault.beginAuthorization(userId);
                engagementService.reply(triggerId, userId, MessageTemplates.linkInvitation(link.url().toString()), deadline);
            }
            case "/unlinkwhoop" -> {
                tokenVault.revoke(userId);
                engagementService.reply(triggerId, userId, MessageTemplates.UNLINKED, deadline);
            }
            case "/motivateme" -> engagementService.engage(triggerId, profile, IntentKind.MORNING_MOTIVATION, null, deadline);
            case "/report" -> report(triggerId, profile, deadline);
            default -> chat(triggerId, profile, message.text(), deadline);
        }
    }

    private void chat(String triggerId, UserProfile profile, String text, Deadline deadline) {
        try {
            conversationLog.append(profile.userId(), triggerId + "/user", ChatLine.Role.USER, text);
        } catch (CoachException e) {
            logger.warn("Could not store message of user {}: {}", profile.userId(), e.getMessage());
        }
        engagementService.engage(triggerId, profile, IntentKind.CHAT_REPLY, text, deadline);
    }

    private void report(String triggerId, UserProfile profile, Deadline deadline) {
        if (!tokenVault.isLinked(profile.userId())) {
            engagementService.reply(triggerId, profile.userId(), MessageTemplates.NOT_LINKED, deadline);
            return;
        }
        try {
            healthSync.sync(profile.userId(), deadline);
        } catch (CoachException e) {
            if (e.getKind() == ErrorKind.AUTH_EXPIRED) {
                engagementService.reply(triggerId, profile.userId(), MessageTemplates.RELINK_REQUIRED, deadline);
                return;
            }
            logger.warn("Sync before report of user {} failed ({}), reporting stored data", profile.userId(), e.getKind());
        }
        engagementService.engage(triggerId, profile, IntentKind.HEALTH_UPDATE, null, deadline);
    }

    private void fail(String triggerId, String userId, ErrorKind kind, String reason, Deadline deadline) {
        events.publishEvent(new TriggerFailedEvent(ENDPOINT, triggerId, userId, kind, reason, clock.instant()));
        if (kind == ErrorKind.DELIVERY_REJECTED) {
            return;
        }
        try {
            engagementService.reply(triggerId, userId, MessageTemplates.TRY_AGAIN_LATER, deadline);
        } catch (CoachException e) {
            logger.warn("Could not send fallback message for {}: {}", triggerId, e.getMessage());
        }
    }
}
