package com.bko.coachbot.vault.app;

import java.util.Optional;

public interface TokenStore {
    Optional<TokenRecord> find(String userId);

    void save(TokenRecord record);

    /**
     * Stores {@code updated} only if the stored record still has {@code expectedVersion}.
     *
     * @return false when another writer replaced the record first
     */
    boolean replace(String userId, long expectedVersion, TokenRecord updated);

    void delete(String userId);
}
