package com.bko.coachbot.shared;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class SettingsConfiguration {

    @Bean
    public AppSettings appSettings(EnvConfig envConfig) {
        TelegramSettings telegram = new TelegramSettings(
                envConfig.get("telegram.token"),
                envConfig.get("telegram.webhook_secret")
        );
        WhoopSettings whoop = new WhoopSettings(
                envConfig.get("whoop.client_id"),
                envConfig.get("whoop.client_secret")
        );
        GeminiSettings gemini = new GeminiSettings(
                envConfig.get("gemini.api_key"),
                envConfig.get("gemini.model", "gemini-2.0-flash"),
                envConfig.getSeconds("gemini.timeout_seconds", 20)
        );
        ServiceSettings service = new ServiceSettings(
                envConfig.get("gcp.project_id"),
                envConfig.get("url"),
                ServiceSettings.BotMode.parse(envConfig.get("bot.mode")),
                ServiceSettings.StoreType.parse(envConfig.get("coachbot.store")),
                envConfig.get("scheduler.invoker_email"),
                envConfig.getSeconds("trigger.budget_seconds", 280),
                envConfig.getSeconds("token.refresh_margin_seconds", 60),
                envConfig.getSeconds("http.timeout_seconds", 10)
        );
        return new AppSettings(telegram, whoop, gemini, service);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RetryExecutor retryExecutor() {
        return RetryExecutor.defaults();
    }
}
