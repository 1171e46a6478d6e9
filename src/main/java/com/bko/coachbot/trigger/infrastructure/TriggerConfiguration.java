package com.bko.coachbot.trigger.infrastructure;

import com.google.auth.oauth2.TokenVerifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TriggerConfiguration {

    // Google's public keys are fetched and cached by the verifier
    @Bean
    public TokenVerifier identityTokenVerifier() {
        return TokenVerifier.newBuilder().build();
    }
}
