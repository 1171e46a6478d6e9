package com.bko.coachbot.trigger.infrastructure;

import com.bko.coachbot.shared.AppSettings;
import com.bko.coachbot.shared.CoachException;
import com.bko.coachbot.shared.ErrorKind;
import com.bko.coachbot.trigger.app.CallerAuthenticator;
import com.google.api.client.json.webtoken.JsonWebSignature;
import com.google.api.client.json.webtoken.JsonWebToken;
import com.google.auth.oauth2.TokenVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Verifies Google-signed OIDC identity tokens sent by the scheduler. The signature and expiry are checked by
 * {@link TokenVerifier}; issuer, audience and the optional invoker email are checked here so a mismatch can be
 * told apart from a token that is not valid at all.
 */
@Component
public class GoogleIdentityTokenAuthenticator implements CallerAuthenticator {
    private static final Logger logger = LoggerFactory.getLogger(GoogleIdentityTokenAuthenticator.class);
    private static final String BEARER = "Bearer ";
    private static final Set<String> GOOGLE_ISSUERS = Set.of("https://accounts.google.com", "accounts.google.com");

    private final TokenVerifier tokenVerifier;
    private final AppSettings settings;

    public GoogleIdentityTokenAuthenticator(TokenVerifier tokenVerifier, AppSettings settings) {
        this.tokenVerifier = tokenVerifier;
        this.settings = settings;
    }

    @Override
    public void verifyScheduler(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.regionMatches(true, 0, BEARER, 0, BEARER.length())) {
            throw CoachException.unauthenticated("Missing bearer identity token");
        }
        if (!settings.service().hasPublicUrl()) {
            throw new CoachException(ErrorKind.VALIDATION_FAILED, "URL is not configured; cannot check token audience");
        }

        JsonWebSignature token;
        try {
            token = tokenVerifier.verify(authorizationHeader.substring(BEARER.length()).trim());
        } catch (TokenVerifier.VerificationException e) {
            logger.warn("Rejected identity token: {}", e.getMessage());
            throw CoachException.unauthenticated("Identity token could not be verified", e);
        }

        JsonWebToken.Payload payload = token.getPayload();
        if (payload.getIssuer() == null || !GOOGLE_ISSUERS.contains(payload.getIssuer())) {
            throw new CoachException(ErrorKind.VALIDATION_FAILED, "Identity token from unexpected issuer " + payload.getIssuer());
        }
        List<String> audiences = payload.getAudienceAsList();
        String expectedAudience = settings.service().baseUrl();
        if (audiences == null || audiences.stream().noneMatch(aud -> matchesServiceUrl(aud, expectedAudience))) {
            logger.warn("Identity token audience {} does not match {}", audiences, expectedAudience);
            throw new CoachException(ErrorKind.VALIDATION_FAILED, "Identity token audience mismatch");
        }
        String expectedEmail = settings.service().schedulerInvokerEmail();
        if (expectedEmail != null && !expectedEmail.isBlank()) {
            Object email = payload.get("email");
            if (email == null || !expectedEmail.equalsIgnoreCase(email.toString())) {
                logger.warn("Identity token email {} is not the scheduler invoker", email);
                throw new CoachException(ErrorKind.VALIDATION_FAILED, "Identity token caller mismatch");
            }
        }
    }

    private boolean matchesServiceUrl(String audience, String serviceUrl) {
        String trimmed = audience.endsWith("/") ? audience.substring(0, audience.length() - 1) : audience;
        return trimmed.equals(serviceUrl);
    }
}
