package com.bko.coachbot.trigger.web.dto;

import com.bko.coachbot.shared.ConfigStatus;

public record StatusResponse(String message, ConfigStatus config) {
}
