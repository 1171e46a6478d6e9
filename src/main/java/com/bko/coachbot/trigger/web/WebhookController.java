package com.bko.coachbot.trigger.web;

import com.bko.coachbot.telegram.TelegramClient;
import com.bko.coachbot.telegram.TelegramUpdate;
import com.bko.coachbot.trigger.app.TriggerRouter;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class WebhookController {
    static final String SECRET_HEADER = "X-Telegram-Bot-Api-Secret-Token";

    private final TriggerRouter triggerRouter;

    public WebhookController(TriggerRouter triggerRouter) {
        this.triggerRouter = triggerRouter;
    }

    @PostMapping(value = TelegramClient.WEBHOOK_PATH, consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> webhook(@RequestHeader(value = SECRET_HEADER, required = false) String secretToken,
                                       @RequestBody TelegramUpdate update) {
        triggerRouter.handleWebhook(secretToken, update);
        return Map.of("status", "ok");
    }
}
