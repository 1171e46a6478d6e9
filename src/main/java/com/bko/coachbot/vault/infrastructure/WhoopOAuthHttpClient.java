package com.bko.coachbot.vault.infrastructure;

import com.bko.coachbot.shared.AppSettings;
import com.bko.coachbot.shared.CoachException;
import com.bko.coachbot.shared.Deadline;
import com.bko.coachbot.shared.ErrorKind;
import com.bko.coachbot.shared.HttpCalls;
import com.bko.coachbot.shared.HttpResult;
import com.bko.coachbot.shared.WhoopSettings;
import com.bko.coachbot.vault.app.OAuthTokenClient;
import com.bko.coachbot.vault.app.TokenGrant;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.hc.client5.http.fluent.Form;
import org.apache.hc.client5.http.fluent.Request;
import org.apache.hc.core5.net.URIBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;

@Component
public class WhoopOAuthHttpClient implements OAuthTokenClient {
    private static final Logger logger = LoggerFactory.getLogger(WhoopOAuthHttpClient.class);
    static final String AUTH_URL = "https://api.prod.whoop.com/oauth/oauth2/auth";
    static final String TOKEN_URL = "https://api.prod.whoop.com/oauth/oauth2/token";

    private final AppSettings settings;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public WhoopOAuthHttpClient(AppSettings settings) {
        this.settings = settings;
    }

    @Override
    public TokenGrant refresh(String refreshToken, Deadline deadline) {
        requireConfigured();
        logger.info("Refreshing Whoop access token...");
        Request request = Request.post(TOKEN_URL)
                .bodyForm(Form.form()
                        .add("grant_type", "refresh_token")
                        .add("refresh_token", refreshToken)
                        .add("client_id", settings.whoop().clientId())
                        .add("client_secret", settings.whoop().clientSecret())
                        .add("scope", "offline")
                        .build());
        return parseGrant(HttpCalls.execute("Whoop token refresh", request, deadline, settings.service().httpTimeout()));
    }

    @Override
    public TokenGrant exchangeCode(String code, String redirectUri, Deadline deadline) {
        requireConfigured();
        Request request = Request.post(TOKEN_URL)
                .bodyForm(Form.form()
                        .add("grant_type", "authorization_code")
                        .add("code", code)
                        .add("client_id", settings.whoop().clientId())
                        .add("client_secret", settings.whoop().clientSecret())
                        .add("redirect_uri", redirectUri)
                        .build());
        return parseGrant(HttpCalls.execute("Whoop code exchange", request, deadline, settings.service().httpTimeout()));
    }

    @Override
    public URI authorizationUrl(String state, String redirectUri) {
        requireConfigured();
        try {
            return new URIBuilder(AUTH_URL)
                    .addParameter("response_type", "code")
                    .addParameter("client_id", settings.whoop().clientId())
                    .addParameter("redirect_uri", redirectUri)
                    .addParameter("scope", WhoopSettings.SCOPES)
                    .addParameter("state", state)
                    .build();
        } catch (URISyntaxException e) {
            throw new IllegalStateException("Failed to build Whoop authorization URI", e);
        }
    }

    private TokenGrant parseGrant(HttpResult result) {
        if (result.statusCode() == 429) {
            throw CoachException.rateLimited("Whoop token endpoint rate limited", result.retryAfter());
        }
        if (result.isServerError()) {
            throw new CoachException(ErrorKind.UPSTREAM_UNAVAILABLE, "Whoop auth error: HTTP " + result.statusCode());
        }
        JsonNode node = readTree(result.body());
        if (!result.isSuccess()) {
            String error = node.path("error").asText("");
            logger.error("Whoop token endpoint refused the grant: HTTP {} {}", result.statusCode(), error);
            if (!"invalid_grant".equals(error)) {
                logger.error("Check WHOOP_CLIENT_ID and WHOOP_CLIENT_SECRET.");
            }
            throw new CoachException(ErrorKind.AUTH_EXPIRED,
                    "Whoop auth error: HTTP " + result.statusCode() + (error.isEmpty() ? "" : " " + error));
        }
        String accessToken = node.path("access_token").asText(null);
        if (accessToken == null || accessToken.isBlank()) {
            throw new CoachException(ErrorKind.UPSTREAM_UNAVAILABLE, "No access token returned from Whoop");
        }
        return new TokenGrant(
                accessToken,
                node.path("refresh_token").asText(null),
                node.path("expires_in").asLong(3600),
                node.path("scope").asText(null));
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

    private void requireConfigured() {
        if (!settings.isWhoopConfigured()) {
            throw new CoachException(ErrorKind.AUTH_EXPIRED, "Whoop OAuth client is not configured");
        }
    }
}
