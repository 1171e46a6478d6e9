package com.bko.coachbot.profile;

import java.time.Instant;

public record ChatLine(Role role, String content, Instant timestamp) {
    public enum Role { USER, ASSISTANT }
}
