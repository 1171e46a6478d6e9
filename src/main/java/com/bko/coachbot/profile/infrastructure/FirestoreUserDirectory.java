package com.bko.coachbot.profile.infrastructure;

import com.bko.coachbot.profile.UserDirectory;
import com.bko.coachbot.profile.UserProfile;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QueryDocumentSnapshot;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.bko.coachbot.shared.FirestoreCalls.await;
import static com.bko.coachbot.shared.FirestoreCalls.toInstant;
import static com.bko.coachbot.shared.FirestoreCalls.toTimestamp;

public class FirestoreUserDirectory implements UserDirectory {
    static final String USERS = "users";

    private final Firestore firestore;
    private final Clock clock;

    public FirestoreUserDirectory(Firestore firestore, Clock clock) {
        this.firestore = firestore;
        this.clock = clock;
    }

    @Override
    public Optional<UserProfile> find(String userId) {
        DocumentSnapshot snapshot = await(firestore.collection(USERS).document(userId).get(), "load user " + userId);
        return snapshot.exists() ? Optional.of(toProfile(snapshot)) : Optional.empty();
    }

    @Override
    public List<UserProfile> findAll() {
        List<UserProfile> profiles = new ArrayList<>();
        for (QueryDocumentSnapshot snapshot : await(firestore.collection(USERS).get(), "list users").getDocuments()) {
            profiles.add(toProfile(snapshot));
        }
        return profiles;
    }

    @Override
    public UserProfile register(String userId, String name) {
        DocumentReference ref = firestore.collection(USERS).document(userId);
        return await(firestore.runTransaction(tx -> {
            DocumentSnapshot existing = tx.get(ref).get();
            if (existing.exists()) {
                return toProfile(existing);
            }
            UserProfile profile = new UserProfile(userId, name, clock.instant());
            Map<String, Object> data = new HashMap<>();
            data.put("telegram_id", userId);
            data.put("name", name);
            data.put("joined_at", toTimestamp(profile.joinedAt()));
            tx.set(ref, data);
            return profile;
        }), "register user " + userId);
    }

    private UserProfile toProfile(DocumentSnapshot snapshot) {
        return new UserProfile(snapshot.getId(), snapshot.getString("name"), toInstant(snapshot.getTimestamp("joined_at")));
    }
}
