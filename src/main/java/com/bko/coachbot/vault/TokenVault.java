package com.bko.coachbot.vault;

import com.bko.coachbot.shared.Deadline;

/**
 * Owns the wearable OAuth token pair of every user.
 *
 * <p>Refreshes are single-flight per user: concurrent callers for the same user share one refresh exchange,
 * callers for different users never wait on each other.
 */
public interface TokenVault {
    String CALLBACK_PATH = "/whoop/callback";

    /**
     * A token that stays valid for at least the configured safety margin, refreshing first when needed.
     *
     * @throws com.bko.coachbot.shared.CoachException {@code AUTH_EXPIRED} when the user never linked an account
     *         or the refresh grant was rejected; {@code UPSTREAM_UNAVAILABLE} or {@code RATE_LIMITED} when the
     *         provider could not be reached
     */
    AccessToken getValidToken(String userId, Deadline deadline);

    /**
     * Called after the wearable API refused {@code rejected}. Reuses a newer stored token when another caller
     * already refreshed, otherwise performs one refresh exchange.
     */
    AccessToken refreshAfterRejection(String userId, AccessToken rejected, Deadline deadline);

    boolean isLinked(String userId);

    AuthorizationLink beginAuthorization(String userId);

    /**
     * Exchanges an authorization code for a token pair and stores it.
     *
     * @return the user the consumed state belonged to
     */
    String completeAuthorization(String state, String code, Deadline deadline);

    /**
     * Explicit de-authorization; the only way a stored token pair is removed.
     */
    void revoke(String userId);
}
