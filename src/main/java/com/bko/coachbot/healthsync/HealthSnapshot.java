package com.bko.coachbot.healthsync;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Newest stored value of every metric of a user.
 */
public record HealthSnapshot(List<HealthRecord> latest) {
    public HealthSnapshot {
        latest = List.copyOf(latest);
    }

    public boolean isEmpty() {
        return latest.isEmpty();
    }

    public Optional<Instant> newestIngestedAt() {
        return latest.stream().map(HealthRecord::ingestedAt).max(Instant::compareTo);
    }

    public String describe() {
        if (latest.isEmpty()) {
            return "No data";
        }
        return latest.stream()
                .map(record -> record.metricType().label() + ": " + record.metricType().format(record.value())
                        + " (" + record.recordedAt() + ")")
                .collect(Collectors.joining("\n"));
    }
}
