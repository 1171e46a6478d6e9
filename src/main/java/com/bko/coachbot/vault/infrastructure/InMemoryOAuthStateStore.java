package com.bko.coachbot.vault.infrastructure;

import com.bko.coachbot.vault.app.OAuthStateStore;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryOAuthStateStore implements OAuthStateStore {
    private final ConcurrentMap<String, PendingAuthorization> states = new ConcurrentHashMap<>();

    @Override
    public void save(String state, String userId, Instant createdAt) {
        states.put(state, new PendingAuthorization(userId, createdAt));
    }

    @Override
    public Optional<PendingAuthorization> consume(String state) {
        return Optional.ofNullable(states.remove(state));
    }
}
