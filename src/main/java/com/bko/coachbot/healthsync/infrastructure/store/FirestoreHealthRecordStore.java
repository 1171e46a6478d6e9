package com.bko.coachbot.healthsync.infrastructure.store;

import com.bko.coachbot.healthsync.HealthRecord;
import com.bko.coachbot.healthsync.MetricType;
import com.bko.coachbot.healthsync.app.HealthRecordStore;
import com.bko.coachbot.shared.CoachException;
import com.google.api.core.ApiFuture;
import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Query;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.WriteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.bko.coachbot.shared.FirestoreCalls.await;
import static com.bko.coachbot.shared.FirestoreCalls.isAlreadyExists;
import static com.bko.coachbot.shared.FirestoreCalls.toInstant;
import static com.bko.coachbot.shared.FirestoreCalls.toTimestamp;

/**
 * Health records live under {@code users/{userId}/health_records/{dedupKey}} and are written with
 * {@code create}, which fails for an existing document; that failure is the dedup.
 */
public class FirestoreHealthRecordStore implements HealthRecordStore {
    private static final Logger logger = LoggerFactory.getLogger(FirestoreHealthRecordStore.class);
    private static final int LATEST_SCAN_LIMIT = 200;

    private final Firestore firestore;

    public FirestoreHealthRecordStore(Firestore firestore) {
        this.firestore = firestore;
    }

    @Override
    public int insertIfAbsent(List<HealthRecord> records) {
        List<ApiFuture<WriteResult>> writes = new ArrayList<>();
        for (HealthRecord record : records) {
            writes.add(collection(record.userId()).document(record.dedupKey()).create(toData(record)));
        }
        int inserted = 0;
        for (ApiFuture<WriteResult> write : writes) {
            try {
                await(write, "store health record");
                inserted++;
            } catch (CoachException e) {
                if (!isAlreadyExists(e.getCause())) {
                    throw e;
                }
            }
        }
        logger.debug("Stored {} of {} health records", inserted, records.size());
        return inserted;
    }

    @Override
    public List<HealthRecord> latestPerMetric(String userId) {
        List<QueryDocumentSnapshot> documents = await(collection(userId)
                .orderBy("recorded_at", Query.Direction.DESCENDING)
                .limit(LATEST_SCAN_LIMIT)
                .get(), "load health records of " + userId).getDocuments();
        Map<MetricType, HealthRecord> latest = new EnumMap<>(MetricType.class);
        for (QueryDocumentSnapshot document : documents) {
            String metric = document.getString("metric");
            Double value = document.getDouble("value");
            if (metric == null || value == null) {
                continue;
            }
            MetricType type;
            try {
                type = MetricType.fromKey(metric);
            } catch (IllegalArgumentException e) {
                logger.debug("Ignoring health record {} of unknown metric {}", document.getId(), metric);
                continue;
            }
            latest.putIfAbsent(type, new HealthRecord(userId, type, value,
                    toInstant(document.getTimestamp("recorded_at")),
                    toInstant(document.getTimestamp("ingested_at"))));
        }
        return new ArrayList<>(latest.values());
    }

    private CollectionReference collection(String userId) {
        return firestore.collection("users").document(userId).collection("health_records");
    }

    private Map<String, Object> toData(HealthRecord record) {
        return Map.of(
                "metric", record.metricType().key(),
                "value", record.value(),
                "recorded_at", toTimestamp(record.recordedAt()),
                "ingested_at", toTimestamp(record.ingestedAt()));
    }
}
