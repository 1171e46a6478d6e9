package com.bko.coachbot.vault.app;

import java.time.Instant;
import java.util.Optional;

public interface OAuthStateStore {
    void save(String state, String userId, Instant createdAt);

    /**
     * Removes the state and returns what it pointed at; a state can be consumed once.
     */
    Optional<PendingAuthorization> consume(String state);

    record PendingAuthorization(String userId, Instant createdAt) {}
}
