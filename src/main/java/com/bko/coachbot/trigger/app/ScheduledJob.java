package com.bko.coachbot.trigger.app;

import java.time.temporal.ChronoUnit;

public enum ScheduledJob {
    MORNING_MOTIVATION("morning_motivation", ChronoUnit.DAYS),
    CHECK_IN("check-in", ChronoUnit.HOURS),
    HEALTH_SYNC("update-health-data", ChronoUnit.HOURS);

    private final String jobName;
    private final ChronoUnit fallbackBucket;

    ScheduledJob(String jobName, ChronoUnit fallbackBucket) {
        this.jobName = jobName;
        this.fallbackBucket = fallbackBucket;
    }

    public String jobName() {
        return jobName;
    }

    /**
     * Granularity of the idempotency bucket when the scheduler did not send its schedule time; one run per
     * bucket at most.
     */
    public ChronoUnit fallbackBucket() {
        return fallbackBucket;
    }
}
