package com.bko.coachbot.trigger.app;

import com.bko.coachbot.shared.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Lifecycle of one inbound trigger: {@code RECEIVED -> VALIDATED -> PROCESSING -> COMPLETED | FAILED}.
 * A trigger may fail from any non-terminal state.
 */
public class TriggerExecution {
    private static final Logger logger = LoggerFactory.getLogger(TriggerExecution.class);

    public enum State { RECEIVED, VALIDATED, PROCESSING, COMPLETED, FAILED }

    private final String endpoint;
    private final Clock clock;
    private final Instant receivedAt;
    private State state = State.RECEIVED;
    private String triggerId;
    private ErrorKind failure;

    public TriggerExecution(String endpoint, Clock clock) {
        this.endpoint = endpoint;
        this.clock = clock;
        this.receivedAt = clock.instant();
    }

    public void validated(String triggerId) {
        move(State.RECEIVED, State.VALIDATED);
        this.triggerId = triggerId;
    }

    public void processing() {
        move(State.VALIDATED, State.PROCESSING);
    }

    public void completed() {
        move(State.PROCESSING, State.COMPLETED);
        logger.info("{} {} completed in {} ms", endpoint, triggerId, elapsed().toMillis());
    }

    public void failed(ErrorKind kind) {
        if (isTerminal()) {
            throw new IllegalStateException(endpoint + " already " + state);
        }
        State from = state;
        state = State.FAILED;
        failure = kind;
        logger.warn("{} {} failed with {} while {} after {} ms", endpoint, triggerId, kind, from, elapsed().toMillis());
    }

    public State state() {
        return state;
    }

    public String endpoint() {
        return endpoint;
    }

    public String triggerId() {
        return triggerId;
    }

    public ErrorKind failure() {
        return failure;
    }

    public boolean isTerminal() {
        return state == State.COMPLETED || state == State.FAILED;
    }

    private void move(State expected, State next) {
        if (state != expected) {
            throw new IllegalStateException(endpoint + " cannot move from " + state + " to " + next);
        }
        state = next;
        logger.debug("{} {} -> {}", endpoint, triggerId != null ? triggerId : "(unidentified)", next);
    }

    private Duration elapsed() {
        return Duration.between(receivedAt, clock.instant());
    }
}
