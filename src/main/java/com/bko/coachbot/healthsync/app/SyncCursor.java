package com.bko.coachbot.healthsync.app;

import java.time.Instant;

/**
 * Sync progress of one user. {@code lastSyncedAt} never decreases.
 */
public record SyncCursor(String userId, Instant lastSyncedAt, String lastRecordId) {
    public SyncCursor advancedTo(Instant candidate, String recordId) {
        if (candidate == null || !candidate.isAfter(lastSyncedAt)) {
            return this;
        }
        return new SyncCursor(userId, candidate, recordId);
    }
}
