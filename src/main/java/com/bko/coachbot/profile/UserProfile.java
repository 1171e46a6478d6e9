package com.bko.coachbot.profile;

import java.time.Instant;

/**
 * A registered bot user. The user id doubles as the private chat id on the messaging platform.
 */
public record UserProfile(String userId, String name, Instant joinedAt) {
    public String displayName() {
        return name == null || name.isBlank() ? "there" : name;
    }
}
