package com.integrationhealth.core.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@ConfigurationProperties(prefix = "integration-health")
@Validated
public record IntegrationHealthProperties(
    @Valid ProbeConfig probe,
    @Valid SchedulerConfig scheduler,
    @Valid HistoryConfig history,
    @Valid AlertConfig alerts,
    @Valid ProviderConfig providers,
    EncryptionConfig encryption,
    StoreConfig store
) {

    public IntegrationHealthProperties {
        probe = probe != null ? probe : new ProbeConfig(null, 0, 0);
        scheduler = scheduler != null ? scheduler : new SchedulerConfig(null, null, null);
        history = history != null ? history : new HistoryConfig(null, 0, null, null, 0);
        alerts = alerts != null ? alerts : new AlertConfig(0, 0, false, null, null);
        providers = providers != null ? providers : new ProviderConfig(null, null, null, null, null);
        encryption = encryption != null ? encryption : new EncryptionConfig(null);
        store = store != null ? store : new StoreConfig(null, null);
    }

    public static IntegrationHealthProperties defaults() {
        return new IntegrationHealthProperties(null, null, null, null, null, null, null);
    }

    public record ProbeConfig(
        Duration timeout,
        @Positive int dispatchThreads,
        @Positive int probeThreads
    ) {
        public ProbeConfig {
            timeout = timeout != null ? timeout : Duration.ofMillis(10_000);
            dispatchThreads = dispatchThreads > 0 ? dispatchThreads : 4;
            probeThreads = probeThreads > 0 ? probeThreads : 16;
        }
    }

    public record SchedulerConfig(
        Boolean enabled,
        Duration interval,
        Duration initialDelay
    ) {
        public SchedulerConfig {
            enabled = enabled != null ? enabled : Boolean.TRUE;
            interval = interval != null ? interval : Duration.ofMinutes(5);
            initialDelay = initialDelay != null ? initialDelay : Duration.ofSeconds(30);
        }
    }

    public record HistoryConfig(
        Duration retention,
        @Positive int maxEntries,
        Duration errorWindow,
        String keyPrefix,
        @Positive @Max(1000) int maxQueryLimit
    ) {
        public HistoryConfig {
            retention = retention != null ? retention : Duration.ofDays(30);
            maxEntries = maxEntries > 0 ? maxEntries : 8640;     // 30 days at one probe per 5 minutes
            errorWindow = errorWindow != null ? errorWindow : Duration.ofHours(24);
            keyPrefix = keyPrefix != null ? keyPrefix : "integration-health:history";
            maxQueryLimit = maxQueryLimit > 0 ? maxQueryLimit : 100;
        }
    }

    public record AlertConfig(
        @Positive int warningThreshold,
        @Positive int criticalThreshold,
        boolean publishEnabled,
        String topic,
        String bootstrapServers
    ) {
        public AlertConfig {
            warningThreshold = warningThreshold > 0 ? warningThreshold : 3;
            criticalThreshold = criticalThreshold > 0 ? criticalThreshold : 12;
            topic = topic != null ? topic : "integration-health-alerts";
            bootstrapServers = bootstrapServers != null ? bootstrapServers : "localhost:9092";
        }
    }

    public record ProviderConfig(
        String slackApiUrl,
        String linearApiUrl,
        String jiraApiUrl,
        Duration staleConnectionThreshold,
        Duration tokenExpiryWarning
    ) {
        public ProviderConfig {
            slackApiUrl = slackApiUrl != null ? slackApiUrl : "https://slack.com/api";
            linearApiUrl = linearApiUrl != null ? linearApiUrl : "https://api.linear.app/graphql";
            jiraApiUrl = jiraApiUrl != null ? jiraApiUrl : "https://api.atlassian.com/ex/jira";
            staleConnectionThreshold = staleConnectionThreshold != null ? staleConnectionThreshold : Duration.ofDays(7);
            tokenExpiryWarning = tokenExpiryWarning != null ? tokenExpiryWarning : Duration.ofHours(24);
        }
    }

    public record EncryptionConfig(
        String masterKey        // 64 hex characters
    ) {
        @Override
        public String toString() {
            return "EncryptionConfig[masterKey=" + (masterKey == null ? "unset" : "******") + "]";
        }
    }

    /**
     * Selects the adapter backing each store when several are on the classpath.
     */
    public record StoreConfig(
        String records,         // postgres | mongo
        String history          // redis | mongo
    ) {
        public StoreConfig {
            records = records != null ? records : "postgres";
            history = history != null ? history : "redis";
        }
    }
}
