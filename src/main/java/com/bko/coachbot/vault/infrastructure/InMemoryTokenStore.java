package com.bko.coachbot.vault.infrastructure;

import com.bko.coachbot.vault.app.TokenRecord;
import com.bko.coachbot.vault.app.TokenStore;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryTokenStore implements TokenStore {
    private final ConcurrentMap<String, TokenRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<TokenRecord> find(String userId) {
        return Optional.ofNullable(records.get(userId));
    }

    @Override
    public void save(TokenRecord record) {
        records.put(record.userId(), record);
    }

    @Override
    public boolean replace(String userId, long expectedVersion, TokenRecord updated) {
        boolean[] replaced = {false};
        records.computeIfPresent(userId, (id, current) -> {
            if (current.version() != expectedVersion) {
                return current;
            }
            replaced[0] = true;
            return updated;
        });
        return replaced[0];
    }

    @Override
    public void delete(String userId) {
        records.remove(userId);
    }
}
