package com.bko.coachbot.vault.infrastructure;

import com.bko.coachbot.vault.app.OAuthStateStore;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static com.bko.coachbot.shared.FirestoreCalls.await;
import static com.bko.coachbot.shared.FirestoreCalls.toInstant;
import static com.bko.coachbot.shared.FirestoreCalls.toTimestamp;

public class FirestoreOAuthStateStore implements OAuthStateStore {
    private static final String COLLECTION = "oauth_states";

    private final Firestore firestore;

    public FirestoreOAuthStateStore(Firestore firestore) {
        this.firestore = firestore;
    }

    @Override
    public void save(String state, String userId, Instant createdAt) {
        await(firestore.collection(COLLECTION).document(state)
                .set(Map.of("telegram_id", userId, "created_at", toTimestamp(createdAt))), "store oauth state");
    }

    @Override
    public Optional<PendingAuthorization> consume(String state) {
        DocumentReference ref = firestore.collection(COLLECTION).document(state);
        return await(firestore.runTransaction(tx -> {
            DocumentSnapshot snapshot = tx.get(ref).get();
            if (!snapshot.exists() || snapshot.getString("telegram_id") == null) {
                return Optional.<PendingAuthorization>empty();
            }
            tx.delete(ref);
            return Optional.of(new PendingAuthorization(
                    snapshot.getString("telegram_id"), toInstant(snapshot.getTimestamp("created_at"))));
        }), "consume oauth state");
    }
}
