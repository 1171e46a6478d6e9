package com.bko.coachbot.trigger.app;

public interface CallerAuthenticator {

    /**
     * Accepts the request only if it carries a valid identity token issued for this service.
     *
     * @param authorizationHeader raw {@code Authorization} header, may be {@code null}
     * @throws com.bko.coachbot.shared.CoachException {@code VALIDATION_FAILED}: 401 when the token is missing
     *         or cannot be verified, 403 when it was issued for another audience or caller
     */
    void verifyScheduler(String authorizationHeader);
}
