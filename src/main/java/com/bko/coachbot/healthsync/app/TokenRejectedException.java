package com.bko.coachbot.healthsync.app;

import com.bko.coachbot.shared.CoachException;
import com.bko.coachbot.shared.ErrorKind;

/**
 * The wearable API answered 401/403 for an access token. Recoverable once by refreshing the token.
 */
public class TokenRejectedException extends CoachException {
    private final int statusCode;

    public TokenRejectedException(int statusCode) {
        super(ErrorKind.AUTH_EXPIRED, "Wearable API rejected the access token: HTTP " + statusCode);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
