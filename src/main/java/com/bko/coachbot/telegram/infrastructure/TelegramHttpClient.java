package com.bko.coachbot.telegram.infrastructure;

import com.bko.coachbot.shared.AppSettings;
import com.bko.coachbot.shared.CoachException;
import com.bko.coachbot.shared.Deadline;
import com.bko.coachbot.shared.ErrorKind;
import com.bko.coachbot.shared.HttpCalls;
import com.bko.coachbot.shared.HttpResult;
import com.bko.coachbot.telegram.TelegramClient;
import com.bko.coachbot.telegram.TelegramUpdate;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.hc.client5.http.fluent.Request;
import org.apache.hc.core5.http.ContentType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
public class TelegramHttpClient implements TelegramClient {
    private static final Logger logger = LoggerFactory.getLogger(TelegramHttpClient.class);
    private static final String TELEGRAM_API_BASE = "https://api.telegram.org/bot";

    private final AppSettings settings;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public TelegramHttpClient(AppSettings settings) {
        this.settings = settings;
    }

    @Override
    public long sendMessage(String chatId, String text, Deadline deadline) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("chat_id", chatId);
        payload.put("text", TelegramFormatting.toHtml(text));
        payload.put("parse_mode", "HTML");
        JsonNode result = call("sendMessage", payload, deadline, settings.service().httpTimeout());
        return result.path("message_id").asLong();
    }

    @Override
    public void setWebhook(String url, String secretToken, Deadline deadline) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("url", url);
        payload.put("allowed_updates", List.of("message"));
        if (secretToken != null && !secretToken.isBlank()) {
            payload.put("secret_token", secretToken);
        }
        call("setWebhook", payload, deadline, settings.service().httpTimeout());
        logger.info("Telegram webhook set to {}", url);
    }

    @Override
    public void deleteWebhook(Deadline deadline) {
        call("deleteWebhook", Map.of(), deadline, settings.service().httpTimeout());
        logger.info("Removed Telegram webhook");
    }

    @Override
    public List<TelegramUpdate> getUpdates(long offset, Duration longPoll, Deadline deadline) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("offset", offset);
        payload.put("timeout", longPoll.toSeconds());
        payload.put("allowed_updates", List.of("message"));
        JsonNode result = call("getUpdates", payload, deadline,
                longPoll.plus(settings.service().httpTimeout()));
        List<TelegramUpdate> updates = new ArrayList<>();
        for (JsonNode node : result) {
            try {
                updates.add(objectMapper.treeToValue(node, TelegramUpdate.class));
            } catch (JsonProcessingException e) {
                logger.warn("Skipping unreadable Telegram update: {}", e.getOriginalMessage());
            }
        }
        return updates;
    }

    private JsonNode call(String method, Map<String, Object> payload, Deadline deadline, Duration timeoutCap) {
        if (!settings.isTelegramConfigured()) {
            throw new CoachException(ErrorKind.DELIVERY_REJECTED, "TELEGRAM_TOKEN is not configured");
        }
        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode Telegram " + method + " payload", e);
        }
        Request request = Request.post(TELEGRAM_API_BASE + settings.telegram().botToken() + "/" + method)
                .bodyString(body, ContentType.APPLICATION_JSON);
        HttpResult result = HttpCalls.execute("Telegram " + method, request, deadline, timeoutCap);
        JsonNode node = readTree(result.body());

        int status = result.statusCode();
        if (status == 429) {
            long retryAfter = node.path("parameters").path("retry_after").asLong(0);
            throw CoachException.rateLimited("Telegram " + method + " rate limited",
                    retryAfter > 0 ? Duration.ofSeconds(retryAfter) : result.retryAfter());
        }
        if (result.isServerError()) {
            throw new CoachException(ErrorKind.UPSTREAM_UNAVAILABLE, "Telegram API error: HTTP " + status);
        }
        if (!result.isSuccess() || !node.path("ok").asBoolean(false)) {
            String description = node.path("description").asText("");
            logger.error("Telegram {} refused: HTTP {} {}", method, status, description);
            throw new CoachException(ErrorKind.DELIVERY_REJECTED,
                    "Telegram " + method + " refused: HTTP " + status + " " + description);
        }
        return node.path("result");
    }

    private JsonNode readTree(String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return objectMapper.createObjectNode();
        }
    }
}
