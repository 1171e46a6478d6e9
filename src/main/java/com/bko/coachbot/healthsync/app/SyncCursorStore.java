package com.bko.coachbot.healthsync.app;

import java.util.Optional;

public interface SyncCursorStore {
    Optional<SyncCursor> find(String userId);

    /**
     * Stores {@code cursor} unless the stored one is already further ahead.
     *
     * @return whether the stored cursor moved
     */
    boolean advance(SyncCursor cursor);
}
