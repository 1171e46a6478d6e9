package com.bko.coachbot.shared;

import java.time.Duration;

/**
 * Process-level settings: where the service lives, how it receives updates and how long it may work.
 */
public record ServiceSettings(
        String projectId,
        String publicUrl,
        BotMode botMode,
        StoreType storeType,
        String schedulerInvokerEmail,
        Duration triggerBudget,
        Duration tokenRefreshMargin,
        Duration httpTimeout
) {
    public enum BotMode {
        WEBHOOK, POLLING;

        public static BotMode parse(String value) {
            return "polling".equalsIgnoreCase(value == null ? "" : value.trim()) ? POLLING : WEBHOOK;
        }
    }

    public enum StoreType {
        FIRESTORE, MEMORY;

        public static StoreType parse(String value) {
            return "memory".equalsIgnoreCase(value == null ? "" : value.trim()) ? MEMORY : FIRESTORE;
        }
    }

    public boolean hasPublicUrl() {
        return publicUrl != null && !publicUrl.isBlank();
    }

    /**
     * Public URL without a trailing slash, suitable for joining paths.
     */
    public String baseUrl() {
        if (!hasPublicUrl()) {
            return "";
        }
        return publicUrl.endsWith("/") ? publicUrl.substring(0, publicUrl.length() - 1) : publicUrl;
    }
}
