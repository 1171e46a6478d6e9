package com.bko.coachbot.trigger.web.dto;

public record ErrorResponse(String status, String kind, String message) {
    public static ErrorResponse of(String kind, String message) {
        return new ErrorResponse("error", kind, message);
    }
}
