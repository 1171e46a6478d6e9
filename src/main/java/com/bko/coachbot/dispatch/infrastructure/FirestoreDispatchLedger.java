package com.bko.coachbot.dispatch.infrastructure;

import com.bko.coachbot.dispatch.DispatchStatus;
import com.bko.coachbot.dispatch.app.DispatchLedger;
import com.bko.coachbot.dispatch.app.DispatchRecord;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static com.bko.coachbot.shared.FirestoreCalls.await;
import static com.bko.coachbot.shared.FirestoreCalls.toInstant;
import static com.bko.coachbot.shared.FirestoreCalls.toTimestamp;

public class FirestoreDispatchLedger implements DispatchLedger {
    private static final String COLLECTION = "dispatches";

    private final Firestore firestore;

    public FirestoreDispatchLedger(Firestore firestore) {
        this.firestore = firestore;
    }

    @Override
    public Optional<DispatchRecord> find(String triggerId) {
        DocumentSnapshot snapshot = await(document(triggerId).get(), "load dispatch " + triggerId);
        if (!snapshot.exists()) {
            return Optional.empty();
        }
        Long messageId = snapshot.getLong("platform_message_id");
        return Optional.of(new DispatchRecord(
                triggerId,
                snapshot.getString("user_id"),
                DispatchStatus.valueOf(snapshot.getString("outcome")),
                toInstant(snapshot.getTimestamp("sent_at")),
                messageId == null ? 0 : messageId,
                snapshot.getString("detail")));
    }

    @Override
    public void save(DispatchRecord record) {
        DocumentReference ref = document(record.triggerId());
        Map<String, Object> data = new HashMap<>();
        data.put("trigger_id", record.triggerId());
        data.put("user_id", record.userId());
        data.put("outcome", record.status().name());
        data.put("sent_at", toTimestamp(record.recordedAt()));
        data.put("platform_message_id", record.platformMessageId());
        data.put("detail", record.detail());
        await(firestore.runTransaction(tx -> {
            DocumentSnapshot current = tx.get(ref).get();
            if (current.exists() && DispatchStatus.SENT.name().equals(current.getString("outcome"))) {
                return false;
            }
            tx.set(ref, data);
            return true;
        }), "record dispatch " + record.triggerId());
    }

    // trigger ids contain '/', which Firestore reads as a path separator
    private DocumentReference document(String triggerId) {
        return firestore.collection(COLLECTION).document(URLEncoder.encode(triggerId, StandardCharsets.UTF_8));
    }
}
