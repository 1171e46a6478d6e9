package com.bko.coachbot.trigger.web;

import com.bko.coachbot.shared.AppSettings;
import com.bko.coachbot.shared.ConfigStatus;
import com.bko.coachbot.trigger.web.dto.StatusResponse;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {
    private final AppSettings settings;

    public StatusController(AppSettings settings) {
        this.settings = settings;
    }

    @GetMapping(value = "/", produces = MediaType.APPLICATION_JSON_VALUE)
    public StatusResponse index() {
        return new StatusResponse("Health coach bot up and running.", ConfigStatus.from(settings));
    }
}
