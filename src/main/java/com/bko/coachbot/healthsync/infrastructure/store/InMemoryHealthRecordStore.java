package com.bko.coachbot.healthsync.infrastructure.store;

import com.bko.coachbot.healthsync.HealthRecord;
import com.bko.coachbot.healthsync.MetricType;
import com.bko.coachbot.healthsync.app.HealthRecordStore;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryHealthRecordStore implements HealthRecordStore {
    private final ConcurrentMap<String, ConcurrentMap<String, HealthRecord>> recordsByUser = new ConcurrentHashMap<>();

    @Override
    public int insertIfAbsent(List<HealthRecord> records) {
        int inserted = 0;
        for (HealthRecord record : records) {
            ConcurrentMap<String, HealthRecord> userRecords =
                    recordsByUser.computeIfAbsent(record.userId(), id -> new ConcurrentHashMap<>());
            if (userRecords.putIfAbsent(record.dedupKey(), record) == null) {
                inserted++;
            }
        }
        return inserted;
    }

    @Override
    public List<HealthRecord> latestPerMetric(String userId) {
        Map<MetricType, HealthRecord> latest = new EnumMap<>(MetricType.class);
        for (HealthRecord record : recordsByUser.getOrDefault(userId, new ConcurrentHashMap<>()).values()) {
            latest.merge(record.metricType(), record,
                    (a, b) -> b.recordedAt().isAfter(a.recordedAt()) ? b : a);
        }
        return new ArrayList<>(latest.values());
    }

    public int count(String userId) {
        return recordsByUser.getOrDefault(userId, new ConcurrentHashMap<>()).size();
    }
}
