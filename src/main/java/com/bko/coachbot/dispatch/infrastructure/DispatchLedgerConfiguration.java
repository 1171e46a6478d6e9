package com.bko.coachbot.dispatch.infrastructure;

import com.bko.coachbot.dispatch.app.DispatchLedger;
import com.bko.coachbot.shared.AppSettings;
import com.bko.coachbot.shared.ServiceSettings;
import com.google.cloud.firestore.Firestore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DispatchLedgerConfiguration {

    @Bean
    public DispatchLedger dispatchLedger(AppSettings settings, ObjectProvider<Firestore> firestore) {
        if (settings.service().storeType() == ServiceSettings.StoreType.MEMORY) {
            return new InMemoryDispatchLedger();
        }
        return new FirestoreDispatchLedger(firestore.getObject());
    }
}
