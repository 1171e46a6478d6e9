package com.bko.coachbot.trigger.app;

import com.bko.coachbot.shared.AppSettings;
import com.bko.coachbot.shared.CoachException;
import com.bko.coachbot.shared.Deadline;
import com.bko.coachbot.telegram.TelegramMessage;
import com.bko.coachbot.telegram.TelegramUpdate;
import com.bko.coachbot.trigger.TriggerFailedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Drives every inbound trigger through its {@link TriggerExecution} lifecycle within the request budget.
 * Errors left unresolved are rethrown for the HTTP layer to map; permanent ones are reported first.
 */
@Service
public class TriggerRouter {
    private static final Logger logger = LoggerFactory.getLogger(TriggerRouter.class);

    private final CallerAuthenticator callerAuthenticator;
    private final WebhookSecretVerifier webhookSecretVerifier;
    private final ScheduledTriggerService scheduledTriggerService;
    private final WebhookUpdateHandler webhookUpdateHandler;
    private final ApplicationEventPublisher events;
    private final AppSettings settings;
    private final Clock clock;

    public TriggerRouter(CallerAuthenticator callerAuthenticator,
                         WebhookSecretVerifier webhookSecretVerifier,
                         ScheduledTriggerService scheduledTriggerService,
                         WebhookUpdateHandler webhookUpdateHandler,
                         ApplicationEventPublisher events,
                         AppSettings settings,
                         Clock clock) {
        this.callerAuthenticator = callerAuthenticator;
        this.webhookSecretVerifier = webhookSecretVerifier;
        this.scheduledTriggerService = scheduledTriggerService;
        this.webhookUpdateHandler = webhookUpdateHandler;
        this.events = events;
        this.settings = settings;
        this.clock = clock;
    }

    public BatchResult handleScheduled(ScheduledJob job, String authorization, String jobNameHeader, String scheduleTimeHeader) {
        Deadline deadline = newDeadline();
        TriggerExecution execution = new TriggerExecution(job.jobName(), clock);
        try {
            callerAuthenticator.verifyScheduler(authorization);
            execution.validated(TriggerIds.scheduled(job, jobNameHeader, scheduleTimeHeader, clock.instant()));
            execution.processing();
            BatchResult result = scheduledTriggerService.run(job, execution.triggerId(), deadline);
            if (result.hasRetryableFailure()) {
                throw result.retryableFailure();
            }
            execution.completed();
            return result;
        } catch (CoachException e) {
            fail(execution, e);
            throw e;
        }
    }

    public void handleWebhook(String secretToken, TelegramUpdate update) {
        TriggerExecution execution = new TriggerExecution(WebhookUpdateHandler.ENDPOINT, clock);
        try {
            webhookSecretVerifier.verify(secretToken);
        } catch (CoachException e) {
            fail(execution, e);
            throw e;
        }
        process(execution, update);
    }

    /**
     * Updates fetched by long polling come from the platform itself and skip the secret check.
     */
    public void handlePolled(TelegramUpdate update) {
        process(new TriggerExecution("polling", clock), update);
    }

    private void process(TriggerExecution execution, TelegramUpdate update) {
        TelegramMessage message = update == null ? null : update.message();
        if (message == null || message.chat() == null || !message.hasText() || !"private".equals(message.chat().type())) {
            logger.debug("Ignoring update {} without a private text message", update == null ? null : update.updateId());
            return;
        }
        Deadline deadline = newDeadline();
        try {
            execution.validated(TriggerIds.webhook(message.chat().id(), message.messageId()));
            execution.processing();
            webhookUpdateHandler.handle(execution.triggerId(), message, deadline);
            execution.completed();
        } catch (CoachException e) {
            execution.failed(e.getKind());
            throw e;
        }
    }

    private void fail(TriggerExecution execution, CoachException e) {
        execution.failed(e.getKind());
        if (!e.isRetryable()) {
            events.publishEvent(new TriggerFailedEvent(execution.endpoint(), execution.triggerId(), null,
                    e.getKind(), e.getMessage(), clock.instant()));
        }
    }

    private Deadline newDeadline() {
        return Deadline.after(settings.service().triggerBudget(), clock);
    }
}
