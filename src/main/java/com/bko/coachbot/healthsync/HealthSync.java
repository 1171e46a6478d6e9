package com.bko.coachbot.healthsync;

import com.bko.coachbot.shared.Deadline;

public interface HealthSync {

    /**
     * Pulls wearable records newer than the user's cursor, stores them and then advances the cursor.
     * Safe to repeat: records already stored are skipped, and the cursor only moves once every page of
     * the run has been persisted.
     *
     * @throws com.bko.coachbot.shared.CoachException {@code AUTH_EXPIRED} when the wearable keeps rejecting
     *         the user's token; retryable kinds when the vendor is unavailable or the deadline ran out
     */
    SyncResult sync(String userId, Deadline deadline);
}
