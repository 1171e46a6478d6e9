package com.bko.coachbot.shared;

public record AppSettings(TelegramSettings telegram,
                          WhoopSettings whoop,
                          GeminiSettings gemini,
                          ServiceSettings service) {
    public boolean isTelegramConfigured() {
        return telegram != null && telegram.isConfigured();
    }

    public boolean isWhoopConfigured() {
        return whoop != null && whoop.isConfigured();
    }

    public boolean isGeminiConfigured() {
        return gemini != null && gemini.isConfigured();
    }
}
