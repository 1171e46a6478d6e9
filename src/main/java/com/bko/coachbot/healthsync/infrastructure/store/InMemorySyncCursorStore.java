package com.bko.coachbot.healthsync.infrastructure.store;

import com.bko.coachbot.healthsync.app.SyncCursor;
import com.bko.coachbot.healthsync.app.SyncCursorStore;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemorySyncCursorStore implements SyncCursorStore {
    private final ConcurrentMap<String, SyncCursor> cursors = new ConcurrentHashMap<>();

    @Override
    public Optional<SyncCursor> find(String userId) {
        return Optional.ofNullable(cursors.get(userId));
    }

    @Override
    public boolean advance(SyncCursor cursor) {
        SyncCursor stored = cursors.merge(cursor.userId(), cursor,
                (current, candidate) -> candidate.lastSyncedAt().isAfter(current.lastSyncedAt()) ? candidate : current);
        return stored == cursor;
    }
}
