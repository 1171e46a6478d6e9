package com.bko.coachbot.shared;

public record WhoopSettings(String clientId, String clientSecret) {
    public static final String SCOPES = "offline read:profile read:recovery read:sleep read:workout";

    public boolean isConfigured() {
        return hasText(clientId) && hasText(clientSecret);
    }

    private boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
