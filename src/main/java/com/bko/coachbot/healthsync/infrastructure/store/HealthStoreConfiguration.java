package com.bko.coachbot.healthsync.infrastructure.store;

import com.bko.coachbot.healthsync.app.HealthRecordStore;
import com.bko.coachbot.healthsync.app.SyncCursorStore;
import com.bko.coachbot.shared.AppSettings;
import com.bko.coachbot.shared.ServiceSettings;
import com.google.cloud.firestore.Firestore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class HealthStoreConfiguration {

    @Bean
    public HealthRecordStore healthRecordStore(AppSettings settings, ObjectProvider<Firestore> firestore) {
        if (settings.service().storeType() == ServiceSettings.StoreType.MEMORY) {
            return new InMemoryHealthRecordStore();
        }
        return new FirestoreHealthRecordStore(firestore.getObject());
    }

    @Bean
    public SyncCursorStore syncCursorStore(AppSettings settings, ObjectProvider<Firestore> firestore) {
        if (settings.service().storeType() == ServiceSettings.StoreType.MEMORY) {
            return new InMemorySyncCursorStore();
        }
        return new FirestoreSyncCursorStore(firestore.getObject());
    }
}
