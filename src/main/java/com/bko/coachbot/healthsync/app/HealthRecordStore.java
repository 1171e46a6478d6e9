package com.bko.coachbot.healthsync.app;

import com.bko.coachbot.healthsync.HealthRecord;

import java.util.List;

public interface HealthRecordStore {

    /**
     * Creates every record whose dedup key is not stored yet; existing records are left untouched.
     *
     * @return number of records actually created
     */
    int insertIfAbsent(List<HealthRecord> records);

    /**
     * Newest record of every metric the user has.
     */
    List<HealthRecord> latestPerMetric(String userId);
}
