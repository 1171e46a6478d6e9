package com.bko.coachbot.content.app;

import com.bko.coachbot.content.ContentGenerator;
import com.bko.coachbot.content.IntentKind;
import com.bko.coachbot.content.MessageBody;
import com.bko.coachbot.content.MessageIntent;
import com.bko.coachbot.content.MessageTemplates;
import com.bko.coachbot.content.UserContext;
import com.bko.coachbot.content.domain.ChatPort;
import com.bko.coachbot.shared.AppSettings;
import com.bko.coachbot.shared.CoachException;
import com.bko.coachbot.shared.Deadline;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

@Service
public class ContentGenerationService implements ContentGenerator {
    private static final Logger logger = LoggerFactory.getLogger(ContentGenerationService.class);
    private static final float MOTIVATION_TEMPERATURE = 1.5f;

    private final ChatPort chatPort;
    private final PromptBuilder promptBuilder;
    private final AppSettings settings;
    private final ExecutorService executor;

    public ContentGenerationService(ChatPort chatPort, PromptBuilder promptBuilder, AppSettings settings) {
        this.chatPort = chatPort;
        this.promptBuilder = promptBuilder;
        this.settings = settings;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "content-generation-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public MessageBody generate(MessageIntent intent, UserContext context, Deadline deadline) {
        String fallback = MessageTemplates.fallback(intent.kind(), context.userName());
        if (!settings.isGeminiConfigured()) {
            logger.warn("Gemini is not configured, using the {} template for user {}", intent.kind(), intent.userId());
            return MessageBody.template(fallback);
        }

        Duration timeout;
        try {
            timeout = deadline.bound(settings.gemini().timeout());
        } catch (CoachException e) {
            logger.warn("No budget left to generate {} for user {}, using template", intent.kind(), intent.userId());
            return MessageBody.template(fallback);
        }

        ChatPort.ChatCommand command = new ChatPort.ChatCommand(
                settings.gemini().model(),
                promptBuilder.build(intent.kind(), context),
                intent.kind() == IntentKind.MORNING_MOTIVATION ? MOTIVATION_TEMPERATURE : null);
        // the Gemini client carries its own request timeout; cancelling also interrupts the worker
        Future<ChatPort.ChatResult> call = executor.submit(() -> chatPort.chat(command));
        try {
            ChatPort.ChatResult result = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            String text = result == null || result.text() == null ? "" : result.text().strip();
            if (text.isEmpty()) {
                logger.warn("Gemini returned an empty {} message for user {}, using template", intent.kind(), intent.userId());
                return MessageBody.template(fallback);
            }
            return MessageBody.generated(text);
        } catch (TimeoutException e) {
            call.cancel(true);
            logger.warn("Gemini did not answer within {} ms for {} of user {}, using template",
                    timeout.toMillis(), intent.kind(), intent.userId());
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while generating {} for user {}, using template", intent.kind(), intent.userId());
        } catch (ExecutionException e) {
            logger.error("Error generating {} message for user {}: {}", intent.kind(), intent.userId(),
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        }
        return MessageBody.template(fallback);
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }
}
