package com.bko.coachbot.trigger.app;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Idempotency keys. A retried delivery of the same trigger maps to the same id.
 */
public final class TriggerIds {

    private TriggerIds() {
    }

    /**
     * {@code sched:{job}:{bucket}}: the scheduler's job name and planned fire time to the minute. Without the
     * scheduler headers the job's own name and the current day or hour are used.
     */
    public static String scheduled(ScheduledJob job, String jobNameHeader, String scheduleTimeHeader, Instant now) {
        String name = jobNameHeader == null || jobNameHeader.isBlank()
                ? job.jobName()
                : jobNameHeader.trim().replaceAll("[\\s/]+", "-");
        Instant bucket = parseScheduleTime(scheduleTimeHeader);
        if (bucket == null) {
            bucket = now.truncatedTo(job.fallbackBucket());
        } else {
            bucket = bucket.truncatedTo(ChronoUnit.MINUTES);
        }
        return "sched:" + name + ":" + bucket;
    }

    public static String forUser(String triggerId, String userId) {
        return triggerId + "/" + userId;
    }

    public static String webhook(long chatId, long messageId) {
        return "tg:" + chatId + ":" + messageId;
    }

    private static Instant parseScheduleTime(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(header.trim()).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
