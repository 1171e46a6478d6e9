package com.bko.coachbot.vault.app;

public record TokenGrant(String accessToken, String refreshToken, long expiresInSeconds, String scope) {
    @Override
    public String toString() {
        return "TokenGrant[expiresInSeconds=" + expiresInSeconds + ", scope=" + scope + "]";
    }
}
