package com.bko.coachbot.healthsync.infrastructure.whoop;

import com.bko.coachbot.healthsync.MetricType;
import com.bko.coachbot.healthsync.app.WearableRecord;
import com.bko.coachbot.healthsync.app.WearableStream;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.EnumMap;
import java.util.Map;

/**
 * Maps Whoop v1 collection records to the metrics kept by the sync.
 */
class WhoopRecordMapper {
    private static final String SCORED = "SCORED";

    WearableRecord map(WearableStream stream, JsonNode node) {
        return switch (stream) {
            case SLEEP -> sleep(node);
            case RECOVERY -> recovery(node);
            case WORKOUT -> workout(node);
        };
    }

    private WearableRecord sleep(JsonNode node) {
        JsonNode score = node.path("score");
        JsonNode stages = score.path("stage_summary");
        Map<MetricType, Double> metrics = new EnumMap<>(MetricType.class);
        put(metrics, MetricType.SLEEP_PERFORMANCE, score.path("sleep_performance_percentage"));
        put(metrics, MetricType.SLEEP_EFFICIENCY, score.path("sleep_efficiency_percentage"));
        put(metrics, MetricType.SLEEP_SLOW_WAVE, stages.path("total_slow_wave_sleep_time_milli"));
        put(metrics, MetricType.SLEEP_REM, stages.path("total_rem_sleep_time_milli"));
        put(metrics, MetricType.SLEEP_IN_BED, stages.path("total_in_bed_time_milli"));
        return new WearableRecord("sleep-" + node.path("id").asText(), instant(node, "start"), isScored(node), metrics);
    }

    private WearableRecord recovery(JsonNode node) {
        JsonNode score = node.path("score");
        Map<MetricType, Double> metrics = new EnumMap<>(MetricType.class);
        put(metrics, MetricType.RECOVERY_SCORE, score.path("recovery_score"));
        put(metrics, MetricType.RESTING_HEART_RATE, score.path("resting_heart_rate"));
        put(metrics, MetricType.HRV_RMSSD, score.path("hrv_rmssd_milli"));
        return new WearableRecord("recovery-" + node.path("cycle_id").asText(), instant(node, "created_at"),
                isScored(node), metrics);
    }

    private WearableRecord workout(JsonNode node) {
        JsonNode score = node.path("score");
        Map<MetricType, Double> metrics = new EnumMap<>(MetricType.class);
        put(metrics, MetricType.WORKOUT_STRAIN, score.path("strain"));
        put(metrics, MetricType.WORKOUT_KILOJOULE, score.path("kilojoule"));
        put(metrics, MetricType.WORKOUT_AVERAGE_HEART_RATE, score.path("average_heart_rate"));
        return new WearableRecord("workout-" + node.path("id").asText(), instant(node, "start"), isScored(node), metrics);
    }

    private boolean isScored(JsonNode node) {
        return SCORED.equals(node.path("score_state").asText());
    }

    private void put(Map<MetricType, Double> metrics, MetricType type, JsonNode value) {
        if (value.isNumber()) {
            metrics.put(type, value.asDouble());
        }
    }

    private Instant instant(JsonNode node, String field) {
        String text = node.path(field).asText(null);
        if (text == null) {
            throw new IllegalArgumentException("Whoop record without " + field);
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Whoop record with malformed " + field + ": " + text, e);
        }
    }
}
