package com.bko.coachbot.healthsync.infrastructure.store;

import com.bko.coachbot.healthsync.app.SyncCursor;
import com.bko.coachbot.healthsync.app.SyncCursorStore;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static com.bko.coachbot.shared.FirestoreCalls.await;
import static com.bko.coachbot.shared.FirestoreCalls.toInstant;
import static com.bko.coachbot.shared.FirestoreCalls.toTimestamp;

public class FirestoreSyncCursorStore implements SyncCursorStore {
    private static final String COLLECTION = "sync_cursors";

    private final Firestore firestore;

    public FirestoreSyncCursorStore(Firestore firestore) {
        this.firestore = firestore;
    }

    @Override
    public Optional<SyncCursor> find(String userId) {
        DocumentSnapshot snapshot = await(document(userId).get(), "load sync cursor of " + userId);
        if (!snapshot.exists() || snapshot.getTimestamp("last_synced_at") == null) {
            return Optional.empty();
        }
        return Optional.of(new SyncCursor(userId,
                toInstant(snapshot.getTimestamp("last_synced_at")),
                snapshot.getString("last_record_id")));
    }

    @Override
    public boolean advance(SyncCursor cursor) {
        DocumentReference ref = document(cursor.userId());
        return await(firestore.runTransaction(tx -> {
            DocumentSnapshot current = tx.get(ref).get();
            Instant stored = current.exists() ? toInstant(current.getTimestamp("last_synced_at")) : null;
            if (stored != null && !cursor.lastSyncedAt().isAfter(stored)) {
                return false;
            }
            Map<String, Object> data = new HashMap<>();
            data.put("last_synced_at", toTimestamp(cursor.lastSyncedAt()));
            data.put("last_record_id", cursor.lastRecordId());
            tx.set(ref, data);
            return true;
        }), "advance sync cursor of " + cursor.userId());
    }

    private DocumentReference document(String userId) {
        return firestore.collection(COLLECTION).document(userId);
    }
}
