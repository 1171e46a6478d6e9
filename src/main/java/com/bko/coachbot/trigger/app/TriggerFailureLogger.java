package com.bko.coachbot.trigger.app;

import com.bko.coachbot.trigger.TriggerFailedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class TriggerFailureLogger {
    private static final Logger logger = LoggerFactory.getLogger(TriggerFailureLogger.class);

    @EventListener
    public void on(TriggerFailedEvent event) {
        logger.error("Trigger failed permanently: endpoint={} trigger={} user={} kind={} reason={}",
                event.endpoint(), event.triggerId(), event.userId(), event.kind(), event.reason());
    }
}
