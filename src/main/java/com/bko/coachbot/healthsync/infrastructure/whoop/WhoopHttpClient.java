package com.bko.coachbot.healthsync.infrastructure.whoop;

import com.bko.coachbot.healthsync.app.TokenRejectedException;
import com.bko.coachbot.healthsync.app.WearableClientPort;
import com.bko.coachbot.healthsync.app.WearablePage;
import com.bko.coachbot.healthsync.app.WearableRecord;
import com.bko.coachbot.healthsync.app.WearableStream;
import com.bko.coachbot.shared.AppSettings;
import com.bko.coachbot.shared.CoachException;
import com.bko.coachbot.shared.Deadline;
import com.bko.coachbot.shared.ErrorKind;
import com.bko.coachbot.shared.HttpCalls;
import com.bko.coachbot.shared.HttpResult;
import com.bko.coachbot.vault.AccessToken;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.hc.client5.http.fluent.Request;
import org.apache.hc.core5.net.URIBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Component
public class WhoopHttpClient implements WearableClientPort {
    private static final Logger logger = LoggerFactory.getLogger(WhoopHttpClient.class);
    static final String WHOOP_API_BASE = "https://api.prod.whoop.com/developer/v1/";
    static final int PAGE_SIZE = 25;

    private final AppSettings settings;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final WhoopRecordMapper mapper = new WhoopRecordMapper();

    public WhoopHttpClient(AppSettings settings) {
        this.settings = settings;
    }

    @Override
    public WearablePage fetchPage(WearableStream stream, AccessToken token, Instant since, String nextToken, Deadline deadline) {
        Request request = Request.get(buildUri(stream, since, nextToken))
                .addHeader("Authorization", "Bearer " + token.value())
                .addHeader("Accept", "application/json");
        HttpResult result = HttpCalls.execute("Whoop " + stream.path(), request, deadline, settings.service().httpTimeout());

        int status = result.statusCode();
        if (status == 401 || status == 403) {
            logger.warn("Whoop {}: Unauthorized. Access token may be expired or missing scopes.", status);
            throw new TokenRejectedException(status);
        }
        if (status == 429) {
            throw CoachException.rateLimited("Whoop API rate limited", result.retryAfter());
        }
        if (!result.isSuccess()) {
            throw new CoachException(ErrorKind.UPSTREAM_UNAVAILABLE, "Whoop API error: HTTP " + status);
        }
        return parsePage(stream, result.body());
    }

    private WearablePage parsePage(WearableStream stream, String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new CoachException(ErrorKind.UPSTREAM_UNAVAILABLE, "Unreadable Whoop " + stream.path() + " page", e);
        }
        List<WearableRecord> records = new ArrayList<>();
        for (JsonNode node : root.path("records")) {
            try {
                records.add(mapper.map(stream, node));
            } catch (IllegalArgumentException e) {
                logger.warn("Skipping Whoop {} record: {}", stream.path(), e.getMessage());
            }
        }
        JsonNode next = root.path("next_token");
        return new WearablePage(records, next.isTextual() ? next.asText() : null);
    }

    private URI buildUri(WearableStream stream, Instant since, String nextToken) {
        try {
            URIBuilder builder = new URIBuilder(WHOOP_API_BASE + stream.path())
                    .addParameter("limit", String.valueOf(PAGE_SIZE));
            if (since != null) {
                builder.addParameter("start", since.toString());
            }
            if (nextToken != null) {
                builder.addParameter("nextToken", nextToken);
            }
            return builder.build();
        } catch (URISyntaxException e) {
            throw new IllegalStateException("Failed to build Whoop URI for " + stream.path(), e);
        }
    }
}
