package com.bko.coachbot.dispatch.app;

import java.util.Optional;

public interface DispatchLedger {
    Optional<DispatchRecord> find(String triggerId);

    /**
     * Writes the record unless a sent record already exists for the same trigger.
     */
    void save(DispatchRecord record);
}
