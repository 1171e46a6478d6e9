package com.bko.coachbot.vault.infrastructure;

import com.bko.coachbot.shared.AppSettings;
import com.bko.coachbot.shared.ServiceSettings;
import com.bko.coachbot.vault.app.OAuthStateStore;
import com.bko.coachbot.vault.app.TokenStore;
import com.google.cloud.firestore.Firestore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class VaultStoreConfiguration {

    @Bean
    public TokenStore tokenStore(AppSettings settings, ObjectProvider<Firestore> firestore) {
        if (settings.service().storeType() == ServiceSettings.StoreType.MEMORY) {
            return new InMemoryTokenStore();
        }
        return new FirestoreTokenStore(firestore.getObject());
    }

    @Bean
    public OAuthStateStore oauthStateStore(AppSettings settings, ObjectProvider<Firestore> firestore) {
        if (settings.service().storeType() == ServiceSettings.StoreType.MEMORY) {
            return new InMemoryOAuthStateStore();
        }
        return new FirestoreOAuthStateStore(firestore.getObject());
    }
}
