package com.bko.coachbot.content.infrastructure.gemini;

import com.bko.coachbot.content.domain.ChatPort;
import com.bko.coachbot.shared.AppSettings;
import com.google.genai.Client;
import com.google.genai.types.HttpOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class GeminiConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(GeminiConfiguration.class);

    @Bean
    public ChatPort chatPort(AppSettings settings) {
        if (!settings.isGeminiConfigured()) {
            logger.warn("GEMINI_API_KEY missing, every message will use its static template.");
            return command -> {
                throw new IllegalStateException("Gemini is not configured");
            };
        }
        HttpOptions httpOptions = HttpOptions.builder()
                .timeout((int) settings.gemini().timeout().toMillis())
                .build();
        Client client = Client.builder()
                .apiKey(settings.gemini().apiKey())
                .httpOptions(httpOptions)
                .build();
        return new GeminiChatAdapter(client);
    }
}
