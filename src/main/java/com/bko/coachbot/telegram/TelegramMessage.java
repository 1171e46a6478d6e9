package com.bko.coachbot.telegram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TelegramMessage(
        @JsonProperty("message_id") long messageId,
        TelegramUser from,
        TelegramChat chat,
        long date,
        String text
) {
    public boolean hasText() {
        return text != null && !text.isBlank();
    }

    /**
     * Bot command without its {@code @botname} suffix and arguments, or {@code null} for plain text.
     */
    public String command() {
        if (!hasText() || !text.startsWith("/")) {
            return null;
        }
        String head = text.trim().split("\\s+", 2)[0];
        int at = head.indexOf('@');
        return at > 0 ? head.substring(0, at) : head;
    }
}
