package com.bko.coachbot.shared;

public record ConfigStatus(boolean telegramConfigured,
                           boolean whoopConfigured,
                           boolean geminiConfigured,
                           String botMode,
                           String store) {
    public static ConfigStatus from(AppSettings settings) {
        return new ConfigStatus(
                settings.isTelegramConfigured(),
                settings.isWhoopConfigured(),
                settings.isGeminiConfigured(),
                settings.service().botMode().name().toLowerCase(),
                settings.service().storeType().name().toLowerCase()
        );
    }
}
