package com.bko.coachbot.vault.app;

import java.time.Duration;
import java.time.Instant;

/**
 * Stored token pair. {@code version} grows by one on every refresh and guards compare-and-swap replacement.
 */
public record TokenRecord(
        String userId,
        String accessToken,
        String refreshToken,
        Instant expiresAt,
        String scope,
        long version
) {
    public boolean isValidAt(Instant now, Duration margin) {
        return accessToken != null && expiresAt != null && now.plus(margin).isBefore(expiresAt);
    }

    public TokenRecord refreshedWith(TokenGrant grant, Instant now) {
        return new TokenRecord(
                userId,
                grant.accessToken(),
                grant.refreshToken() != null ? grant.refreshToken() : refreshToken,
                now.plusSeconds(grant.expiresInSeconds()),
                grant.scope() != null ? grant.scope() : scope,
                version + 1);
    }

    public static TokenRecord linked(String userId, TokenGrant grant, Instant now) {
        return new TokenRecord(userId, grant.accessToken(), grant.refreshToken(),
                now.plusSeconds(grant.expiresInSeconds()), grant.scope(), 1);
    }

    @Override
    public String toString() {
        return "TokenRecord[userId=" + userId + ", expiresAt=" + expiresAt + ", scope=" + scope + ", version=" + version + "]";
    }
}
