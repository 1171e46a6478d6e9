package com.bko.coachbot.profile.infrastructure;

import com.bko.coachbot.profile.ConversationLog;
import com.bko.coachbot.profile.UserDirectory;
import com.bko.coachbot.shared.AppSettings;
import com.bko.coachbot.shared.ServiceSettings;
import com.google.cloud.firestore.Firestore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ProfileStoreConfiguration {

    @Bean
    public UserDirectory userDirectory(AppSettings settings, ObjectProvider<Firestore> firestore, Clock clock) {
        if (settings.service().storeType() == ServiceSettings.StoreType.MEMORY) {
            return new InMemoryUserDirectory(clock);
        }
        return new FirestoreUserDirectory(firestore.getObject(), clock);
    }

    @Bean
    public ConversationLog conversationLog(AppSettings settings, ObjectProvider<Firestore> firestore, Clock clock) {
        if (settings.service().storeType() == ServiceSettings.StoreType.MEMORY) {
            return new InMemoryConversationLog(clock);
        }
        return new FirestoreConversationLog(firestore.getObject(), clock);
    }
}
