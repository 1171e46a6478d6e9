package com.bko.coachbot.telegram;

import com.bko.coachbot.shared.Deadline;

import java.time.Duration;
import java.util.List;

/**
 * Bot API operations used by the service. Every call is bounded by the given deadline.
 */
public interface TelegramClient {
    String WEBHOOK_PATH = "/webhook";

    /**
     * @return the platform's id of the delivered message
     * @throws com.bko.coachbot.shared.CoachException {@code DELIVERY_REJECTED} when the platform refuses the
     *         message for good (blocked bot, unknown chat), {@code RATE_LIMITED} or {@code UPSTREAM_UNAVAILABLE}
     *         when a later attempt may succeed
     */
    long sendMessage(String chatId, String text, Deadline deadline);

    void setWebhook(String url, String secretToken, Deadline deadline);

    void deleteWebhook(Deadline deadline);

    /**
     * Long-polls for updates with an id of at least {@code offset}.
     */
    List<TelegramUpdate> getUpdates(long offset, Duration longPoll, Deadline deadline);
}
