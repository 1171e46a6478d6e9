package com.bko.coachbot.trigger.web;

import com.bko.coachbot.trigger.app.BatchResult;
import com.bko.coachbot.trigger.app.ScheduledJob;
import com.bko.coachbot.trigger.app.TriggerRouter;
import com.bko.coachbot.trigger.web.dto.TriggerResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

/**
 * Cron-style entry points. Any non-2xx answer makes the scheduler retry within its own attempt deadline.
 */
@RestController
public class SchedulerController {
    static final String JOB_NAME_HEADER = "X-CloudScheduler-JobName";
    static final String SCHEDULE_TIME_HEADER = "X-CloudScheduler-ScheduleTime";

    private final TriggerRouter triggerRouter;

    public SchedulerController(TriggerRouter triggerRouter) {
        this.triggerRouter = triggerRouter;
    }

    @GetMapping(value = "/morning_motivation", produces = MediaType.APPLICATION_JSON_VALUE)
    public TriggerResponse morningMotivation(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                             @RequestHeader(value = JOB_NAME_HEADER, required = false) String jobName,
                                             @RequestHeader(value = SCHEDULE_TIME_HEADER, required = false) String scheduleTime) {
        return run(ScheduledJob.MORNING_MOTIVATION, authorization, jobName, scheduleTime);
    }

    @PostMapping(value = "/scheduled/check-in", produces = MediaType.APPLICATION_JSON_VALUE)
    public TriggerResponse checkIn(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                   @RequestHeader(value = JOB_NAME_HEADER, required = false) String jobName,
                                   @RequestHeader(value = SCHEDULE_TIME_HEADER, required = false) String scheduleTime) {
        return run(ScheduledJob.CHECK_IN, authorization, jobName, scheduleTime);
    }

    @PostMapping(value = "/scheduled/update-health-data", produces = MediaType.APPLICATION_JSON_VALUE)
    public TriggerResponse updateHealthData(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                            @RequestHeader(value = JOB_NAME_HEADER, required = false) String jobName,
                                            @RequestHeader(value = SCHEDULE_TIME_HEADER, required = false) String scheduleTime) {
        return run(ScheduledJob.HEALTH_SYNC, authorization, jobName, scheduleTime);
    }

    private TriggerResponse run(ScheduledJob job, String authorization, String jobName, String scheduleTime) {
        BatchResult result = triggerRouter.handleScheduled(job, authorization, jobName, scheduleTime);
        return TriggerResponse.from(result);
    }
}
