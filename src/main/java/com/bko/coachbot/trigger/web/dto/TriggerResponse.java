package com.bko.coachbot.trigger.web.dto;

import com.bko.coachbot.trigger.app.BatchResult;

public record TriggerResponse(String status, String triggerId, int users, int succeeded, int skipped, int failed) {
    public static TriggerResponse from(BatchResult result) {
        return new TriggerResponse("success", result.triggerId(), result.attempted(), result.succeeded(),
                result.skipped(), result.permanentFailures());
    }
}
