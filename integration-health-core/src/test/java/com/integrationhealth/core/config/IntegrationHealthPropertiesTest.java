package com.integrationhealth.core.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.BindResult;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationPropertySource;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IntegrationHealthPropertiesTest {

    @Test
    void testValidPropertiesBinding() {
        Map<String, Object> properties = Map.of(
            "integration-health.probe.timeout", "2500ms",
            "integration-health.probe.probe-threads", "8",
            "integration-health.scheduler.interval", "1m",
            "integration-health.history.max-query-limit", "50",
            "integration-health.alerts.warning-threshold", "2",
            "integration-health.alerts.publish-enabled", "true",
            "integration-health.providers.slack-api-url", "http://localhost:9999/api",
            "integration-health.encryption.master-key", "ab".repeat(32),
            "integration-health.store.records", "mongo"
        );

        ConfigurationPropertySource source = new MapConfigurationPropertySource(properties);
        Binder binder = new Binder(source);
        
        BindResult<IntegrationHealthProperties> result = binder.bind("integration-health", IntegrationHealthProperties.class);
        
        assertTrue(result.isBound());
        IntegrationHealthProperties config = result.get();
        
        assertEquals(Duration.ofMillis(2500), config.probe().timeout());
        assertEquals(8, config.probe().probeThreads());
        assertEquals(4, config.probe().dispatchThreads());
        assertEquals(Duration.ofMinutes(1), config.scheduler().interval());
        assertEquals(50, config.history().maxQueryLimit());
        assertEquals(2, config.alerts().warningThreshold());
        assertEquals(12, config.alerts().criticalThreshold());
        assertTrue(config.alerts().publishEnabled());
        assertEquals("http://localhost:9999/api", config.providers().slackApiUrl());
        assertEquals("mongo", config.store().records());
        assertEquals("redis", config.store().history());
    }

    @Test
    void testRecordDefaults() {
        IntegrationHealthProperties config = IntegrationHealthProperties.defaults();
        
        assertEquals(Duration.ofSeconds(10), config.probe().timeout());
        assertTrue(config.scheduler().enabled());
        assertEquals(Duration.ofMinutes(5), config.scheduler().interval());
        assertEquals(Duration.ofSeconds(30), config.scheduler().initialDelay());
        assertEquals(Duration.ofDays(30), config.history().retention());
        assertEquals(8640, config.history().maxEntries());
        assertEquals(Duration.ofHours(24), config.history().errorWindow());
        assertEquals("integration-health:history", config.history().keyPrefix());
        assertEquals(100, config.history().maxQueryLimit());
        assertEquals("integration-health-alerts", config.alerts().topic());
        assertFalse(config.alerts().publishEnabled());
        assertEquals("https://slack.com/api", config.providers().slackApiUrl());
        assertEquals("https://api.linear.app/graphql", config.providers().linearApiUrl());
        assertEquals("https://api.atlassian.com/ex/jira", config.providers().jiraApiUrl());
        assertEquals(Duration.ofDays(7), config.providers().staleConnectionThreshold());
        assertEquals(Duration.ofHours(24), config.providers().tokenExpiryWarning());
        assertNull(config.encryption().masterKey());
    }

    @Test
    void testPartialSchedulerSectionKeepsSchedulerEnabled() {
        Binder binder = new Binder(new MapConfigurationPropertySource(Map.of(
            "integration-health.scheduler.interval", "30s")));
        
        IntegrationHealthProperties config = binder.bind("integration-health", IntegrationHealthProperties.class).get();
        
        assertTrue(config.scheduler().enabled());
        assertEquals(Duration.ofSeconds(30), config.scheduler().interval());
    }

    @Test
    void testMasterKeyMaskedInToString() {
        IntegrationHealthProperties.EncryptionConfig encryption =
            new IntegrationHealthProperties.EncryptionConfig("cd".repeat(32));
        
        assertFalse(encryption.toString().contains("cdcd"));
    }
}
