package com.bko.coachbot.healthsync;

import java.util.Locale;

public enum MetricType {
    SLEEP_PERFORMANCE("sleep_performance", "Sleep performance", Unit.PERCENT),
    SLEEP_EFFICIENCY("sleep_efficiency", "Sleep efficiency", Unit.PERCENT),
    SLEEP_SLOW_WAVE("sleep_slow_wave_ms", "Deep sleep", Unit.DURATION),
    SLEEP_REM("sleep_rem_ms", "REM sleep", Unit.DURATION),
    SLEEP_IN_BED("sleep_in_bed_ms", "Time in bed", Unit.DURATION),
    RECOVERY_SCORE("recovery_score", "Recovery score", Unit.PERCENT),
    RESTING_HEART_RATE("resting_heart_rate", "Resting heart rate", Unit.BPM),
    HRV_RMSSD("hrv_rmssd_milli", "HRV (RMSSD)", Unit.MILLIS),
    WORKOUT_STRAIN("workout_strain", "Workout strain", Unit.PLAIN),
    WORKOUT_KILOJOULE("workout_kilojoule", "Workout energy (kJ)", Unit.PLAIN),
    WORKOUT_AVERAGE_HEART_RATE("workout_average_heart_rate", "Workout average heart rate", Unit.BPM);

    private enum Unit { PERCENT, DURATION, BPM, MILLIS, PLAIN }

    private final String key;
    private final String label;
    private final Unit unit;

    MetricType(String key, String label, Unit unit) {
        this.key = key;
        this.label = label;
        this.unit = unit;
    }

    public String key() {
        return key;
    }

    public String label() {
        return label;
    }

    public String format(double value) {
        return switch (unit) {
            case PERCENT -> String.format(Locale.ROOT, "%.0f%%", value);
            case DURATION -> {
                long minutes = Math.round(value / 60_000d);
                yield String.format(Locale.ROOT, "%02d:%02d", minutes / 60, minutes % 60);
            }
            case BPM -> String.format(Locale.ROOT, "%.0f bpm", value);
            case MILLIS -> String.format(Locale.ROOT, "%.1f ms", value);
            case PLAIN -> String.format(Locale.ROOT, "%.1f", value);
        };
    }

    public static MetricType fromKey(String key) {
        for (MetricType type : values()) {
            if (type.key.equals(key)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown metric: " + key);
    }
}
