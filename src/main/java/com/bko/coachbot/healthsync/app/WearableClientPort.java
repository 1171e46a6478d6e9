package com.bko.coachbot.healthsync.app;

import com.bko.coachbot.shared.Deadline;
import com.bko.coachbot.vault.AccessToken;

import java.time.Instant;

public interface WearableClientPort {

    /**
     * Fetches one page of {@code stream} with records starting at or after {@code since}.
     *
     * @param nextToken continuation token of the previous page, {@code null} for the first page
     * @throws TokenRejectedException when the wearable refuses the access token
     */
    WearablePage fetchPage(WearableStream stream, AccessToken token, Instant since, String nextToken, Deadline deadline);
}
