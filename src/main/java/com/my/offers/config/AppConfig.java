package com.my.offers.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.List;
import java.util.Optional;

@StaticInitSafe
@ConfigMapping(prefix = "app")
public interface AppConfig {

    TelegramConfig telegram();

    RelayConfig relay();

    RulesConfig rules();

    ListenerConfig listener();

    StateConfig state();

    RewriteConfig rewrite();

    OpenAiConfig openai();

    interface TelegramConfig {
        @WithName("bot-token")
        Optional<String> botToken();

        @WithName("api-base-url")
        @WithDefault("https://api.telegram.org")
        String apiBaseUrl();

        @WithName("poll-timeout-seconds")
        @WithDefault("30")
        int pollTimeoutSeconds();

        @WithName("poll-interval-millis")
        @WithDefault("1000")
        long pollIntervalMillis();

        @WithName("buffer-size")
        @WithDefault("1000")
        int bufferSize();
    }

    interface RelayConfig {
        @WithName("source-chats")
        Optional<List<String>> sourceChats();

        @WithName("targets-file")
        @WithDefault("targets.txt")
        String targetsFile();

        @WithName("target-chat")
        Optional<String> targetChat();

        @WithName("dry-run")
        @WithDefault("false")
        boolean dryRun();

        @WithName("queue-capacity")
        @WithDefault("1000")
        int queueCapacity();

        @WithName("poll-interval-millis")
        @WithDefault("1000")
        long pollIntervalMillis();

        @WithName("shutdown-grace-seconds")
        @WithDefault("30")
        int shutdownGraceSeconds();
    }

    interface RulesConfig {
        @WithName("include-keywords")
        Optional<List<String>> includeKeywords();

        @WithName("exclude-keywords")
        Optional<List<String>> excludeKeywords();

        @WithName("min-score")
        @WithDefault("2")
        int minScore();

        @WithName("low-price-threshold")
        @WithDefault("990")
        int lowPriceThreshold();

        @WithName("mid-price-threshold")
        @WithDefault("1490")
        int midPriceThreshold();

        @WithName("high-discount-threshold")
        @WithDefault("40")
        int highDiscountThreshold();

        @WithName("low-discount-threshold")
        @WithDefault("25")
        int lowDiscountThreshold();
    }

    interface ListenerConfig {
        @WithName("initial-backoff-millis")
        @WithDefault("1000")
        long initialBackoffMillis();

        @WithName("max-backoff-millis")
        @WithDefault("60000")
        long maxBackoffMillis();
    }

    interface StateConfig {
        @WithName("backend")
        @WithDefault("sqlite")
        String backend();

        @WithName("sqlite-path")
        @WithDefault("./data/relay-state.db")
        String sqlitePath();

        @WithName("directory")
        @WithDefault("./data/state")
        String directory();
    }

    interface RewriteConfig {
        @WithName("enabled")
        @WithDefault("false")
        boolean enabled();
    }

    interface OpenAiConfig {
        @WithName("api-key")
        Optional<String> apiKey();

        @WithDefault("gpt-4o-mini")
        String model();

        @WithDefault("0.2")
        double temperature();

        @WithName("timeout-seconds")
        @WithDefault("30")
        int timeoutSeconds();
    }
}
