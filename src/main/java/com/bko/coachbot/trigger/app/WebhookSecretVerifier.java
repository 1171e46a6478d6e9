package com.bko.coachbot.trigger.app;

import com.bko.coachbot.shared.AppSettings;
import com.bko.coachbot.shared.CoachException;
import com.bko.coachbot.shared.ErrorKind;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * The messaging platform cannot present identity tokens; it echoes the secret registered with the webhook in
 * {@code X-Telegram-Bot-Api-Secret-Token} instead.
 */
@Component
public class WebhookSecretVerifier {
    private final AppSettings settings;

    public WebhookSecretVerifier(AppSettings settings) {
        this.settings = settings;
    }

    public void verify(String secretHeader) {
        if (!settings.isTelegramConfigured() || !settings.telegram().hasWebhookSecret()) {
            throw new CoachException(ErrorKind.VALIDATION_FAILED, "Webhook secret is not configured");
        }
        if (secretHeader == null || secretHeader.isBlank()) {
            throw CoachException.unauthenticated("Missing webhook secret token");
        }
        byte[] expected = settings.telegram().webhookSecret().getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(expected, secretHeader.getBytes(StandardCharsets.UTF_8))) {
            throw new CoachException(ErrorKind.VALIDATION_FAILED, "Webhook secret token mismatch");
        }
    }
}
