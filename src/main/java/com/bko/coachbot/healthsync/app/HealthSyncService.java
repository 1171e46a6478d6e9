package com.bko.coachbot.healthsync.app;

import com.bko.coachbot.healthsync.HealthDataQuery;
import com.bko.coachbot.healthsync.HealthRecord;
import com.bko.coachbot.healthsync.HealthSnapshot;
import com.bko.coachbot.healthsync.HealthSync;
import com.bko.coachbot.healthsync.MetricType;
import com.bko.coachbot.healthsync.SyncResult;
import com.bko.coachbot.shared.CoachException;
import com.bko.coachbot.shared.Deadline;
import com.bko.coachbot.shared.ErrorKind;
import com.bko.coachbot.shared.RetryExecutor;
import com.bko.coachbot.vault.AccessToken;
import com.bko.coachbot.vault.TokenVault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
public class HealthSyncService implements HealthSync, HealthDataQuery {
    private static final Logger logger = LoggerFactory.getLogger(HealthSyncService.class);
    static final Duration INITIAL_LOOKBACK = Duration.ofDays(7);
    static final int MAX_PAGES_PER_STREAM = 50;

    private final TokenVault tokenVault;
    private final WearableClientPort wearableClient;
    private final HealthRecordStore recordStore;
    private final SyncCursorStore cursorStore;
    private final RetryExecutor retryExecutor;
    private final Clock clock;

    public HealthSyncService(TokenVault tokenVault,
                             WearableClientPort wearableClient,
                             HealthRecordStore recordStore,
                             SyncCursorStore cursorStore,
                             RetryExecutor retryExecutor,
                             Clock clock) {
        this.tokenVault = tokenVault;
        this.wearableClient = wearableClient;
        this.recordStore = recordStore;
        this.cursorStore = cursorStore;
        this.retryExecutor = retryExecutor;
        this.clock = clock;
    }

    @Override
    public SyncResult sync(String userId, Deadline deadline) {
        SyncCursor cursor = cursorStore.find(userId)
                .orElseGet(() -> new SyncCursor(userId, clock.instant().minus(INITIAL_LOOKBACK), null));
        logger.info("Starting health sync for user {} from {}", userId, cursor.lastSyncedAt());

        Session session = new Session(userId, tokenVault.getValidToken(userId, deadline), deadline);
        RunProgress progress = new RunProgress();
        for (WearableStream stream : WearableStream.values()) {
            syncStream(session, stream, cursor.lastSyncedAt(), progress);
        }

        SyncCursor next = cursor.advancedTo(progress.cursorCandidate(), progress.newestRecordId);
        boolean advanced = next != cursor && cursorStore.advance(next);
        logger.info("Health sync for user {} done: {} new records, cursor {}",
                userId, progress.inserted, advanced ? "advanced to " + next.lastSyncedAt() : "unchanged");
        return new SyncResult(progress.inserted, advanced);
    }

    @Override
    public HealthSnapshot latestSnapshot(String userId) {
        return new HealthSnapshot(recordStore.latestPerMetric(userId));
    }

    private void syncStream(Session session, WearableStream stream, Instant since, RunProgress progress) {
        Set<String> seen = new HashSet<>();
        String nextToken = null;
        for (int page = 1; page <= MAX_PAGES_PER_STREAM; page++) {
            session.deadline.check("fetching " + stream + " page " + page);
            String pageToken = nextToken;
            WearablePage fetched = retryExecutor.execute("Whoop " + stream.path(), session.deadline,
                    () -> fetchWithReauthorization(session, stream, since, pageToken));

            List<HealthRecord> batch = new ArrayList<>();
            int newRecords = 0;
            Instant ingestedAt = clock.instant();
            for (WearableRecord record : fetched.records()) {
                if (!seen.add(record.id())) {
                    continue;
                }
                newRecords++;
                if (!record.scored()) {
                    progress.pending(record.recordedAt());
                    continue;
                }
                for (Map.Entry<MetricType, Double> metric : record.metrics().entrySet()) {
                    batch.add(new HealthRecord(session.userId, metric.getKey(), metric.getValue(),
                            record.recordedAt(), ingestedAt));
                }
                progress.scored(record);
            }
            if (newRecords == 0) {
                logger.debug("{} page {} brought nothing new for user {}", stream, page, session.userId);
                return;
            }
            // persist the whole page before looking at the next one
            int inserted = batch.isEmpty() ? 0 : recordStore.insertIfAbsent(batch);
            progress.inserted += inserted;
            logger.debug("{} page {} for user {}: {} records, {} new metric values",
                    stream, page, session.userId, newRecords, inserted);
            if (!fetched.hasMore()) {
                return;
            }
            nextToken = fetched.nextToken();
        }
        logger.warn("Stopped paging {} for user {} after {} pages", stream, session.userId, MAX_PAGES_PER_STREAM);
    }

    private WearablePage fetchWithReauthorization(Session session, WearableStream stream, Instant since, String nextToken) {
        try {
            return wearableClient.fetchPage(stream, session.token, since, nextToken, session.deadline);
        } catch (TokenRejectedException rejected) {
            if (session.refreshed) {
                throw new CoachException(ErrorKind.AUTH_EXPIRED,
                        "Wearable API rejected a freshly refreshed token of user " + session.userId, rejected);
            }
            // marked only once the refresh went through, a failed exchange stays retryable
            session.token = tokenVault.refreshAfterRejection(session.userId, session.token, session.deadline);
            session.refreshed = true;
            try {
                return wearableClient.fetchPage(stream, session.token, since, nextToken, session.deadline);
            } catch (TokenRejectedException again) {
                throw new CoachException(ErrorKind.AUTH_EXPIRED,
                        "Wearable API rejected a freshly refreshed token of user " + session.userId, again);
            }
        }
    }

    private static final class Session {
        private final String userId;
        private final Deadline deadline;
        private AccessToken token;
        private boolean refreshed;

        private Session(String userId, AccessToken token, Deadline deadline) {
            this.userId = userId;
            this.token = token;
            this.deadline = deadline;
        }
    }

    private static final class RunProgress {
        private int inserted;
        private Instant newestScored;
        private String newestRecordId;
        private Instant earliestPending;

        private void scored(WearableRecord record) {
            if (newestScored == null || record.recordedAt().isAfter(newestScored)) {
                newestScored = record.recordedAt();
                newestRecordId = record.id();
            }
        }

        private void pending(Instant recordedAt) {
            if (earliestPending == null || recordedAt.isBefore(earliestPending)) {
                earliestPending = recordedAt;
            }
        }

        /**
         * Newest stored record time, held back to the oldest record the vendor has not scored yet.
         */
        private Instant cursorCandidate() {
            if (newestScored == null) {
                return null;
            }
            if (earliestPending != null && earliestPending.isBefore(newestScored)) {
                return earliestPending;
            }
            return newestScored;
        }
    }
}
