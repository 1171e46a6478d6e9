package com.bko.coachbot.dispatch;

import com.bko.coachbot.shared.Deadline;

import java.util.Optional;

public interface Dispatcher {

    /**
     * Sends {@code text} to the user's chat unless a message was already delivered for {@code triggerId}, in
     * which case the stored outcome is returned and nothing is sent.
     *
     * @throws com.bko.coachbot.shared.CoachException {@code DELIVERY_REJECTED} when the platform refused the
     *         message for good; retryable kinds when delivery may succeed later
     */
    DispatchOutcome dispatch(String triggerId, String userId, String text, Deadline deadline);

    /**
     * Outcome of an earlier successful delivery for {@code triggerId}, if any.
     */
    Optional<DispatchOutcome> findDelivered(String triggerId);
}
