package com.bko.coachbot.healthsync.app;

import com.bko.coachbot.healthsync.MetricType;

import java.time.Instant;
import java.util.Map;

/**
 * One vendor record reduced to the metrics we keep. Unscored records carry no metrics yet; the vendor
 * fills them in later, so the cursor must not move past them.
 */
public record WearableRecord(String id, Instant recordedAt, boolean scored, Map<MetricType, Double> metrics) {
    public WearableRecord {
        metrics = Map.copyOf(metrics);
    }
}
