package com.bko.coachbot.profile.infrastructure;

import com.bko.coachbot.profile.ChatLine;
import com.bko.coachbot.profile.ConversationLog;
import com.bko.coachbot.shared.CoachException;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Query;
import com.google.cloud.firestore.QueryDocumentSnapshot;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.bko.coachbot.shared.FirestoreCalls.await;
import static com.bko.coachbot.shared.FirestoreCalls.isAlreadyExists;
import static com.bko.coachbot.shared.FirestoreCalls.toInstant;
import static com.bko.coachbot.shared.FirestoreCalls.toTimestamp;

public class FirestoreConversationLog implements ConversationLog {
    private static final String CHATS = "chats";

    private final Firestore firestore;
    private final Clock clock;

    public FirestoreConversationLog(Firestore firestore, Clock clock) {
        this.firestore = firestore;
        this.clock = clock;
    }

    @Override
    public void append(String userId, String lineId, ChatLine.Role role, String content) {
        Map<String, Object> data = Map.of(
                "role", role.name().toLowerCase(),
                "content", content,
                "timestamp", toTimestamp(clock.instant()));
        // line ids are trigger ids, which contain '/'
        String documentId = URLEncoder.encode(lineId, StandardCharsets.UTF_8);
        try {
            await(firestore.collection(FirestoreUserDirectory.USERS).document(userId).collection(CHATS)
                    .document(documentId).create(data), "append chat line for " + userId);
        } catch (CoachException e) {
            if (!isAlreadyExists(e.getCause())) {
                throw e;
            }
        }
    }

    @Override
    public List<ChatLine> recent(String userId, int limit) {
        List<QueryDocumentSnapshot> documents = await(firestore.collection(FirestoreUserDirectory.USERS)
                .document(userId)
                .collection(CHATS)
                .orderBy("timestamp", Query.Direction.DESCENDING)
                .limit(limit)
                .get(), "load chat history for " + userId).getDocuments();
        List<ChatLine> lines = new ArrayList<>();
        for (QueryDocumentSnapshot document : documents) {
            ChatLine.Role role = "user".equals(document.getString("role")) ? ChatLine.Role.USER : ChatLine.Role.ASSISTANT;
            lines.add(new ChatLine(role, document.getString("content"), toInstant(document.getTimestamp("timestamp"))));
        }
        Collections.reverse(lines);
        return lines;
    }
}
