package com.bko.coachbot.trigger.app;

import com.bko.coachbot.content.ContentGenerator;
import com.bko.coachbot.content.IntentKind;
import com.bko.coachbot.content.MessageBody;
import com.bko.coachbot.content.MessageIntent;
import com.bko.coachbot.content.UserContext;
import com.bko.coachbot.dispatch.DispatchOutcome;
import com.bko.coachbot.dispatch.Dispatcher;
import com.bko.coachbot.profile.ChatLine;
import com.bko.coachbot.profile.ConversationLog;
import com.bko.coachbot.profile.UserProfile;
import com.bko.coachbot.shared.CoachException;
import com.bko.coachbot.shared.Deadline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Generate-then-dispatch for one user and one idempotency key.
 */
@Service
public class EngagementService {
    private static final Logger logger = LoggerFactory.getLogger(EngagementService.class);

    private final ContentGenerator contentGenerator;
    private final Dispatcher dispatcher;
    private final UserContextAssembler contextAssembler;
    private final ConversationLog conversationLog;

    public EngagementService(ContentGenerator contentGenerator,
                             Dispatcher dispatcher,
                             UserContextAssembler contextAssembler,
                             ConversationLog conversationLog) {
        this.contentGenerator = contentGenerator;
        this.dispatcher = dispatcher;
        this.contextAssembler = contextAssembler;
        this.conversationLog = conversationLog;
    }

    public Engagement engage(String key, UserProfile user, IntentKind kind, String incomingMessage, Deadline deadline) {
        Optional<DispatchOutcome> delivered = dispatcher.findDelivered(key);
        if (delivered.isPresent()) {
            logger.info("{} for user {} already delivered under {}, skipping", kind, user.userId(), key);
            return new Engagement(delivered.get(), null);
        }

        boolean withHistory = kind == IntentKind.CHECK_IN || kind == IntentKind.CHAT_REPLY;
        UserContext context = contextAssembler.assemble(user, withHistory, incomingMessage);
        MessageBody body = contentGenerator.generate(new MessageIntent(user.userId(), kind, key), context, deadline);
        DispatchOutcome outcome = dispatcher.dispatch(key, user.userId(), body.text(), deadline);
        logger.info("Sent {} message ({}) to user {}", kind, body.source(), user.userId());
        remember(key, user.userId(), body.text());
        return new Engagement(outcome, body);
    }

    /**
     * Fixed bot reply; not part of the conversation the generator sees.
     */
    public DispatchOutcome reply(String key, String userId, String text, Deadline deadline) {
        return dispatcher.dispatch(key, userId, text, deadline);
    }

    public boolean isDelivered(String key) {
        return dispatcher.findDelivered(key).isPresent();
    }

    private void remember(String key, String userId, String text) {
        try {
            conversationLog.append(userId, key + "/assistant", ChatLine.Role.ASSISTANT, text);
        } catch (CoachException e) {
            logger.warn("Could not store assistant message for user {}: {}", userId, e.getMessage());
        }
    }
}
