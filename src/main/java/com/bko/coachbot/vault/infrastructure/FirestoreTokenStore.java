package com.bko.coachbot.vault.infrastructure;

import com.bko.coachbot.vault.app.TokenRecord;
import com.bko.coachbot.vault.app.TokenStore;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static com.bko.coachbot.shared.FirestoreCalls.await;
import static com.bko.coachbot.shared.FirestoreCalls.toInstant;
import static com.bko.coachbot.shared.FirestoreCalls.toTimestamp;

public class FirestoreTokenStore implements TokenStore {
    private static final String COLLECTION = "whoop_tokens";

    private final Firestore firestore;

    public FirestoreTokenStore(Firestore firestore) {
        this.firestore = firestore;
    }

    @Override
    public Optional<TokenRecord> find(String userId) {
        DocumentSnapshot snapshot = await(document(userId).get(), "load token of " + userId);
        return snapshot.exists() ? Optional.of(toRecord(snapshot)) : Optional.empty();
    }

    @Override
    public void save(TokenRecord record) {
        await(document(record.userId()).set(toData(record)), "store token of " + record.userId());
    }

    @Override
    public boolean replace(String userId, long expectedVersion, TokenRecord updated) {
        DocumentReference ref = document(userId);
        return await(firestore.runTransaction(tx -> {
            DocumentSnapshot current = tx.get(ref).get();
            Long version = current.exists() ? current.getLong("version") : null;
            if (version == null || version != expectedVersion) {
                return false;
            }
            tx.set(ref, toData(updated));
            return true;
        }), "replace token of " + userId);
    }

    @Override
    public void delete(String userId) {
        await(document(userId).delete(), "delete token of " + userId);
    }

    private DocumentReference document(String userId) {
        return firestore.collection(COLLECTION).document(userId);
    }

    private Map<String, Object> toData(TokenRecord record) {
        Map<String, Object> data = new HashMap<>();
        data.put("access_token", record.accessToken());
        data.put("refresh_token", record.refreshToken());
        data.put("expires_at", toTimestamp(record.expiresAt()));
        data.put("scope", record.scope());
        data.put("version", record.version());
        return data;
    }

    private TokenRecord toRecord(DocumentSnapshot snapshot) {
        Long version = snapshot.getLong("version");
        return new TokenRecord(
                snapshot.getId(),
                snapshot.getString("access_token"),
                snapshot.getString("refresh_token"),
                toInstant(snapshot.getTimestamp("expires_at")),
                snapshot.getString("scope"),
                version == null ? 0 : version);
    }
}
