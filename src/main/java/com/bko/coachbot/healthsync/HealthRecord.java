package com.bko.coachbot.healthsync;

import java.time.Instant;

/**
 * Immutable biometric sample. Records are deduplicated by {@code (userId, metricType, recordedAt)}.
 */
public record HealthRecord(String userId, MetricType metricType, double value, Instant recordedAt, Instant ingestedAt) {

    /**
     * Key unique per user; stores use it as the record identity so repeated ingestion is a no-op.
     */
    public String dedupKey() {
        return metricType.key() + "_" + recordedAt.toEpochMilli();
    }
}
