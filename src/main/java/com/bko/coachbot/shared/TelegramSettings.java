package com.bko.coachbot.shared;

public record TelegramSettings(String botToken, String webhookSecret) {
    public boolean isConfigured() {
        return hasText(botToken);
    }

    public boolean hasWebhookSecret() {
        return hasText(webhookSecret);
    }

    private boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
