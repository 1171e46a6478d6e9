package com.bko.coachbot.dispatch.infrastructure;

import com.bko.coachbot.dispatch.app.DispatchLedger;
import com.bko.coachbot.dispatch.app.DispatchRecord;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryDispatchLedger implements DispatchLedger {
    private final ConcurrentMap<String, DispatchRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<DispatchRecord> find(String triggerId) {
        return Optional.ofNullable(records.get(triggerId));
    }

    @Override
    public void save(DispatchRecord record) {
        records.merge(record.triggerId(), record, (current, candidate) -> current.isSent() ? current : candidate);
    }

    public int size() {
        return records.size();
    }
}
