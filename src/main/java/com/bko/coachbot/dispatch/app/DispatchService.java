package com.bko.coachbot.dispatch.app;

import com.bko.coachbot.dispatch.DispatchOutcome;
import com.bko.coachbot.dispatch.DispatchStatus;
import com.bko.coachbot.dispatch.Dispatcher;
import com.bko.coachbot.shared.CoachException;
import com.bko.coachbot.shared.Deadline;
import com.bko.coachbot.shared.ErrorKind;
import com.bko.coachbot.shared.RetryExecutor;
import com.bko.coachbot.telegram.TelegramClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

@Service
public class DispatchService implements Dispatcher {
    private static final Logger logger = LoggerFactory.getLogger(DispatchService.class);

    private final DispatchLedger ledger;
    private final TelegramClient telegramClient;
    private final RetryExecutor retryExecutor;
    private final Clock clock;

    public DispatchService(DispatchLedger ledger, TelegramClient telegramClient, RetryExecutor retryExecutor, Clock clock) {
        this.ledger = ledger;
        this.telegramClient = telegramClient;
        this.retryExecutor = retryExecutor;
        this.clock = clock;
    }

    @Override
    public DispatchOutcome dispatch(String triggerId, String userId, String text, Deadline deadline) {
        Optional<DispatchOutcome> prior = findDelivered(triggerId);
        if (prior.isPresent()) {
            logger.info("Trigger {} already delivered to user {} as message {}, not sending again",
                    triggerId, userId, prior.get().platformMessageId());
            return prior.get();
        }

        long messageId;
        try {
            messageId = retryExecutor.execute("Telegram sendMessage", deadline,
                    () -> telegramClient.sendMessage(userId, text, deadline));
        } catch (CoachException e) {
            if (e.getKind() == ErrorKind.DELIVERY_REJECTED) {
                ledger.save(new DispatchRecord(triggerId, userId, DispatchStatus.REJECTED, clock.instant(), 0,
                        e.getMessage()));
            }
            throw e;
        }

        // the send is acknowledged; from here a crash before the write means a duplicate on retry
        DispatchRecord record = new DispatchRecord(triggerId, userId, DispatchStatus.SENT, clock.instant(), messageId, null);
        retryExecutor.execute("record dispatch " + triggerId, deadline, () -> {
            ledger.save(record);
            return record;
        });
        logger.info("Delivered trigger {} to user {} as message {}", triggerId, userId, messageId);
        return record.toOutcome();
    }

    @Override
    public Optional<DispatchOutcome> findDelivered(String triggerId) {
        return ledger.find(triggerId).filter(DispatchRecord::isSent).map(DispatchRecord::toOutcome);
    }
}
