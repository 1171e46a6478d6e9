package com.bko.coachbot.shared;

import io.github.cdimascio.dotenv.Dotenv;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class EnvConfig {
    private final Dotenv dotenv;

    public EnvConfig() {
        this.dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();
    }

    public String get(String key) {
        String envKey = key.toUpperCase()
                .replace(".", "_")
                .replace("-", "_");
        String value = dotenv.get(envKey);
        if (value == null) {
            value = System.getenv(envKey);
        }
        return value == null ? null : value.trim();
    }

    public String get(String key, String fallback) {
        String value = get(key);
        return value == null || value.isEmpty() ? fallback : value;
    }

    public Duration getSeconds(String key, long fallbackSeconds) {
        String value = get(key);
        if (value == null || value.isEmpty()) {
            return Duration.ofSeconds(fallbackSeconds);
        }
        try {
            return Duration.ofSeconds(Long.parseLong(value));
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Expected a number of seconds for " + key + " but got '" + value + "'", e);
        }
    }
}
