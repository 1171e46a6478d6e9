package com.bko.coachbot.shared;

import io.github.resilience4j.core.IntervalBiFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Bounded retry with exponential backoff for calls that fail with a retryable {@link CoachException}.
 *
 * <p>Attempt 1 runs immediately, later attempts wait {@code baseDelay * 2^(attempt-2)}; rate limits start
 * from {@code rateLimitDelay} instead and a {@code Retry-After} hint from the upstream wins when present.
 * A wait that would not finish before the deadline is not started: the last error is rethrown as is, so the
 * caller still sees a retryable kind and the outer scheduler retries later.
 */
public class RetryExecutor {
    private static final Logger logger = LoggerFactory.getLogger(RetryExecutor.class);
    private static final Duration MAX_DELAY = Duration.ofSeconds(30);

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration rateLimitDelay;

    public RetryExecutor(int maxAttempts, Duration baseDelay, Duration rateLimitDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.rateLimitDelay = rateLimitDelay;
    }

    public static RetryExecutor defaults() {
        return new RetryExecutor(4, Duration.ofSeconds(1), Duration.ofSeconds(5));
    }

    public <T> T execute(String operation, Deadline deadline, Supplier<T> call) {
        AtomicInteger attempts = new AtomicInteger();
        IntervalBiFunction<T> backoff = (attempt, outcome) ->
                delayFor(attempt, (CoachException) outcome.getLeft()).toMillis();
        RetryConfig config = RetryConfig.<T>custom()
                .maxAttempts(maxAttempts)
                .retryOnException(error -> worthRetrying(operation, error, attempts.get(), deadline))
                .intervalBiFunction(backoff)
                .build();

        Retry retry = Retry.of(operation, config);
        retry.getEventPublisher()
                .onRetry(event -> logger.warn("{} failed (attempt {}/{}), retrying in {} ms: {}",
                        operation, event.getNumberOfRetryAttempts(), maxAttempts,
                        event.getWaitInterval().toMillis(), event.getLastThrowable().getMessage()))
                .onSuccess(event -> logger.info("{} succeeded after {} attempts",
                        operation, event.getNumberOfRetryAttempts() + 1))
                .onError(event -> logger.warn("{} exhausted {} attempts: {}",
                        operation, maxAttempts, event.getLastThrowable().getMessage()));

        return Retry.decorateSupplier(retry, () -> {
            deadline.check(operation);
            attempts.incrementAndGet();
            return call.get();
        }).get();
    }

    private boolean worthRetrying(String operation, Throwable error, int attempt, Deadline deadline) {
        if (!(error instanceof CoachException)) {
            return false;
        }
        CoachException e = (CoachException) error;
        if (!e.isRetryable() || e.getKind() == ErrorKind.DEADLINE_EXCEEDED) {
            return false;
        }
        if (attempt >= maxAttempts) {
            return true;
        }
        Duration delay = delayFor(attempt, e);
        if (deadline.remaining().compareTo(delay) <= 0) {
            logger.warn("{} not retried, {} backoff would overrun the request deadline", operation, delay);
            return false;
        }
        return true;
    }

    Duration delayFor(int attempt, CoachException e) {
        if (e.getRetryAfter() != null && !e.getRetryAfter().isNegative()) {
            return e.getRetryAfter();
        }
        Duration base = e.getKind() == ErrorKind.RATE_LIMITED ? rateLimitDelay : baseDelay;
        Duration delay = base.multipliedBy(1L << Math.min(attempt - 1, 10));
        return delay.compareTo(MAX_DELAY) > 0 ? MAX_DELAY : delay;
    }
}
