package com.bko.coachbot.trigger.app;

import com.bko.coachbot.content.IntentKind;
import com.bko.coachbot.healthsync.HealthDataQuery;
import com.bko.coachbot.healthsync.HealthSync;
import com.bko.coachbot.healthsync.SyncResult;
import com.bko.coachbot.profile.UserDirectory;
import com.bko.coachbot.profile.UserProfile;
import com.bko.coachbot.shared.CoachException;
import com.bko.coachbot.shared.Deadline;
import com.bko.coachbot.shared.ErrorKind;
import com.bko.coachbot.trigger.TriggerFailedEvent;
import com.bko.coachbot.vault.TokenVault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Fans a scheduled trigger out over every registered user. Users are handled one after another; a permanent
 * failure of one user is reported and the batch moves on.
 */
@Service
public class ScheduledTriggerService {
    private static final Logger logger = LoggerFactory.getLogger(ScheduledTriggerService.class);
    static final Duration CHECK_IN_FRESHNESS = Duration.ofHours(2);

    private final UserDirectory userDirectory;
    private final TokenVault tokenVault;
    private final HealthSync healthSync;
    private final HealthDataQuery healthDataQuery;
    private final EngagementService engagementService;
    private final ApplicationEventPublisher events;
    private final Clock clock;

    public ScheduledTriggerService(UserDirectory userDirectory,
                                   TokenVault tokenVault,
                                   HealthSync healthSync,
                                   HealthDataQuery healthDataQuery,
                                   EngagementService engagementService,
                                   ApplicationEventPublisher events,
                                   Clock clock) {
        this.userDirectory = userDirectory;
        this.tokenVault = tokenVault;
        this.healthSync = healthSync;
        this.healthDataQuery = healthDataQuery;
        this.engagementService = engagementService;
        this.events = events;
        this.clock = clock;
    }

    public BatchResult run(ScheduledJob job, String triggerId, Deadline deadline) {
        List<UserProfile> users = userDirectory.findAll();
        logger.info("{} {} fanning out over {} users", job.jobName(), triggerId, users.size());

        int succeeded = 0;
        int skipped = 0;
        int permanent = 0;
        CoachException retryable = null;
        for (UserProfile user : users) {
            String key = TriggerIds.forUser(triggerId, user.userId());
            try {
                deadline.check(job.jobName() + " for user " + user.userId());
                if (runForUser(job, key, user, deadline)) {
                    succeeded++;
                } else {
                    skipped++;
                }
            } catch (CoachException e) {
                if (e.isRetryable()) {
                    logger.warn("{} for user {} failed with {}, scheduler will retry: {}",
                            job.jobName(), user.userId(), e.getKind(), e.getMessage());
                    if (retryable == null) {
                        retryable = e;
                    }
                } else {
                    permanent++;
                    events.publishEvent(new TriggerFailedEvent(job.jobName(), key, user.userId(), e.getKind(),
                            e.getMessage(), clock.instant()));
                }
            }
        }
        BatchResult result = new BatchResult(triggerId, users.size(), succeeded, skipped, permanent, retryable);
        logger.info("{} {} finished: {} ok, {} skipped, {} failed permanently{}", job.jobName(), triggerId,
                succeeded, skipped, permanent, retryable != null ? ", retry needed" : "");
        return result;
    }

    private boolean runForUser(ScheduledJob job, String key, UserProfile user, Deadline deadline) {
        return switch (job) {
            case MORNING_MOTIVATION -> {
                engagementService.engage(key, user, IntentKind.MORNING_MOTIVATION, null, deadline);
                yield true;
            }
            case CHECK_IN -> {
                if (!engagementService.isDelivered(key)) {
                    freshen(user.userId(), deadline);
                }
                engagementService.engage(key, user, IntentKind.CHECK_IN, null, deadline);
                yield true;
            }
            case HEALTH_SYNC -> {
                if (!tokenVault.isLinked(user.userId())) {
                    yield false;
                }
                SyncResult result = healthSync.sync(user.userId(), deadline);
                logger.debug("Synced user {}: {}", user.userId(), result);
                yield true;
            }
        };
    }

    /**
     * Best-effort sync before a check-in when the stored data is stale. Failing here only means the check-in
     * works with older data.
     */
    private void freshen(String userId, Deadline deadline) {
        try {
            if (!tokenVault.isLinked(userId)) {
                return;
            }
            Optional<Instant> newest = healthDataQuery.latestSnapshot(userId).newestIngestedAt();
            if (newest.isPresent() && newest.get().isAfter(clock.instant().minus(CHECK_IN_FRESHNESS))) {
                return;
            }
            healthSync.sync(userId, deadline);
        } catch (CoachException e) {
            if (e.getKind() == ErrorKind.DEADLINE_EXCEEDED) {
                logger.warn("Skipped pre-check-in sync of user {}: out of time", userId);
            } else {
                logger.warn("Pre-check-in sync of user {} failed ({}), using stored data: {}",
                        userId, e.getKind(), e.getMessage());
            }
        }
    }
}
