package com.bko.coachbot.shared;

import java.time.Duration;

public record GeminiSettings(String apiKey, String model, Duration timeout) {
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }
}
