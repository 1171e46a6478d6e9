package com.bko.coachbot.shared;

import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.FirestoreOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

/**
 * The Firestore client is only created when a store adapter asks for it, so {@code COACHBOT_STORE=memory}
 * runs never touch Google credentials.
 */
@Configuration
public class FirestoreConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(FirestoreConfiguration.class);

    @Bean(destroyMethod = "close")
    @Lazy
    public Firestore firestore(AppSettings settings) {
        FirestoreOptions.Builder builder = FirestoreOptions.getDefaultInstance().toBuilder();
        String projectId = settings.service().projectId();
        if (projectId != null && !projectId.isBlank()) {
            builder.setProjectId(projectId);
        }
        Firestore firestore = builder.build().getService();
        logger.info("Firestore client initialized for project {}", firestore.getOptions().getProjectId());
        return firestore;
    }
}
