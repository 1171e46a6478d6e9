package com.bko.coachbot.trigger.web;

import com.bko.coachbot.content.MessageTemplates;
import com.bko.coachbot.dispatch.Dispatcher;
import com.bko.coachbot.shared.AppSettings;
import com.bko.coachbot.shared.CoachException;
import com.bko.coachbot.shared.Deadline;
import com.bko.coachbot.shared.ErrorKind;
import com.bko.coachbot.trigger.web.dto.ErrorResponse;
import com.bko.coachbot.vault.TokenVault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.Map;

/**
 * Landing page of the wearable's OAuth redirect. The one-time state identifies the user.
 */
@RestController
public class WhoopCallbackController {
    private static final Logger logger = LoggerFactory.getLogger(WhoopCallbackController.class);

    private final TokenVault tokenVault;
    private final Dispatcher dispatcher;
    private final AppSettings settings;
    private final Clock clock;

    public WhoopCallbackController(TokenVault tokenVault, Dispatcher dispatcher, AppSettings settings, Clock clock) {
        this.tokenVault = tokenVault;
        this.dispatcher = dispatcher;
        this.settings = settings;
        this.clock = clock;
    }

    @GetMapping(value = TokenVault.CALLBACK_PATH, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> callback(@RequestParam(value = "code", required = false) String code,
                                      @RequestParam(value = "state", required = false) String state) {
        if (code == null || code.isBlank() || state == null || state.isBlank()) {
            return ResponseEntity.badRequest()
                    .body(ErrorResponse.of(ErrorKind.VALIDATION_FAILED.name(), "Missing code or state in the Whoop callback."));
        }
        Deadline deadline = Deadline.after(settings.service().triggerBudget(), clock);
        String userId;
        try {
            userId = tokenVault.completeAuthorization(state, code, deadline);
        } catch (CoachException e) {
            if (e.getKind() != ErrorKind.VALIDATION_FAILED) {
                throw e;
            }
            return ResponseEntity.badRequest().body(ErrorResponse.of(e.getKind().name(), e.getMessage()));
        }

        try {
            dispatcher.dispatch("oauth:" + state, userId, MessageTemplates.LINKED, deadline);
        } catch (CoachException e) {
            logger.warn("Linked user {} but could not notify them: {}", userId, e.getMessage());
        }
        return ResponseEntity.ok(Map.of("message", "Whoop authorization successful! You can close this page."));
    }
}
