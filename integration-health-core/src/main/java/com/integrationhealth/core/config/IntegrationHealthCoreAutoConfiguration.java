package com.integrationhealth.core.config;

import com.integrationhealth.core.alert.AlertPublisherService;
import com.integrationhealth.core.alert.HealthAlertService;
import com.integrationhealth.core.controller.GlobalExceptionHandler;
import com.integrationhealth.core.controller.IntegrationHealthController;
import com.integrationhealth.core.controller.MetricsController;
import com.integrationhealth.core.credential.AesGcmCredentialDecryptor;
import com.integrationhealth.core.credential.ConnectionProvider;
import com.integrationhealth.core.credential.CredentialDecryptor;
import com.integrationhealth.core.credential.IntegrationCredentialStore;
import com.integrationhealth.core.exception.CredentialDecryptionException;
import com.integrationhealth.core.health.SchedulerHealthIndicator;
import com.integrationhealth.core.logging.EcsLogger;
import com.integrationhealth.core.metrics.ProbeMetrics;
import com.integrationhealth.core.probe.ConnectionStatusProber;
import com.integrationhealth.core.probe.DiscordProber;
import com.integrationhealth.core.probe.IntegrationProber;
import com.integrationhealth.core.probe.JiraProber;
import com.integrationhealth.core.probe.LinearProber;
import com.integrationhealth.core.probe.ProberRegistry;
import com.integrationhealth.core.probe.SlackProber;
import com.integrationhealth.core.probe.WebhookAggregateProber;
import com.integrationhealth.core.scheduler.HealthCheckScheduler;
import com.integrationhealth.core.service.HealthRecorderService;
import com.integrationhealth.core.service.IntegrationHealthService;
import com.integrationhealth.core.service.ProbeDispatcherService;
import com.integrationhealth.core.store.HealthHistoryStore;
import com.integrationhealth.core.store.HealthRecordStore;
import com.integrationhealth.core.store.memory.InMemoryHealthHistoryStore;
import com.integrationhealth.core.store.memory.InMemoryHealthRecordStore;
import com.integrationhealth.core.store.memory.InMemoryIntegrationCredentialStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Import;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@AutoConfiguration
@EnableConfigurationProperties(IntegrationHealthProperties.class)
@EnableRetry
@ComponentScan(basePackages = {
    "com.integrationhealth.postgres",
    "com.integrationhealth.redis",
    "com.integrationhealth.mongo"
})
@Import({KafkaConfig.class, HttpClientConfig.class})
public class IntegrationHealthCoreAutoConfiguration {
    
    private static final Logger logger = LoggerFactory.getLogger(IntegrationHealthCoreAutoConfiguration.class);
    
    @Bean
    @ConditionalOnMissingBean
    public Clock integrationHealthClock() {
        return Clock.systemUTC();
    }
    
    @Bean
    public EcsLogger integrationHealthEcsLogger() {
        return new EcsLogger();
    }
    
    @Bean
    public ProbeMetrics probeMetrics(MeterRegistry meterRegistry) {
        return new ProbeMetrics(meterRegistry);
    }
    
    // Fallback stores, replaced by whichever adapter module is on the classpath
    
    @Bean
    @ConditionalOnMissingBean(HealthRecordStore.class)
    public HealthRecordStore inMemoryHealthRecordStore() {
        return new InMemoryHealthRecordStore();
    }
    
    @Bean
    @ConditionalOnMissingBean(HealthHistoryStore.class)
    public HealthHistoryStore inMemoryHealthHistoryStore() {
        logger.warn("No history store adapter found, health history is kept in memory");
        return new InMemoryHealthHistoryStore();
    }
    
    @Bean
    @ConditionalOnMissingBean(IntegrationCredentialStore.class)
    public IntegrationCredentialStore inMemoryIntegrationCredentialStore() {
        logger.warn("No credential store adapter found, no integrations will be discovered");
        return new InMemoryIntegrationCredentialStore();
    }
    
    @Bean
    @ConditionalOnMissingBean
    public CredentialDecryptor credentialDecryptor(IntegrationHealthProperties properties) {
        String masterKey = properties.encryption().masterKey();
        if (masterKey == null || masterKey.isBlank()) {
            logger.warn("integration-health.encryption.master-key not set, credential-based probes will fail");
            return (workspaceId, ciphertext, iv) -> {
                throw new CredentialDecryptionException("No encryption master key configured");
            };
        }
        return new AesGcmCredentialDecryptor(masterKey);
    }
    
    // Executors
    
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService healthDispatchExecutor(IntegrationHealthProperties properties) {
        return Executors.newFixedThreadPool(properties.probe().dispatchThreads(),
            daemonThreads("health-dispatch-"));
    }
    
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService healthProbeExecutor(IntegrationHealthProperties properties) {
        return Executors.newFixedThreadPool(properties.probe().probeThreads(),
            daemonThreads("health-probe-"));
    }
    
    @Bean(destroyMethod = "shutdown")
    public ExecutorService healthAlertExecutor() {
        return Executors.newSingleThreadExecutor(daemonThreads("health-alert-"));
    }
    
    // Probers
    
    @Bean
    public SlackProber slackProber(IntegrationCredentialStore credentialStore, CredentialDecryptor decryptor,
                                   @Qualifier("integrationHealthRestTemplate") RestTemplate restTemplate,
                                   IntegrationHealthProperties properties, Clock clock) {
        return new SlackProber(credentialStore, decryptor, restTemplate, properties.providers().slackApiUrl(), clock);
    }
    
    @Bean
    public DiscordProber discordProber(IntegrationCredentialStore credentialStore, CredentialDecryptor decryptor,
                                       @Qualifier("integrationHealthRestTemplate") RestTemplate restTemplate,
                                       Clock clock) {
        return new DiscordProber(credentialStore, decryptor, restTemplate, clock);
    }
    
    @Bean
    public LinearProber linearProber(IntegrationCredentialStore credentialStore, CredentialDecryptor decryptor,
                                     @Qualifier("integrationHealthRestTemplate") RestTemplate restTemplate,
                                     IntegrationHealthProperties properties, Clock clock) {
        return new LinearProber(credentialStore, decryptor, restTemplate, properties.providers().linearApiUrl(), clock);
    }
    
    @Bean
    public JiraProber jiraProber(IntegrationCredentialStore credentialStore, CredentialDecryptor decryptor,
                                 @Qualifier("integrationHealthRestTemplate") RestTemplate restTemplate,
                                 IntegrationHealthProperties properties, Clock clock) {
        return new JiraProber(credentialStore, decryptor, restTemplate, properties.providers().jiraApiUrl(),
            properties.providers().tokenExpiryWarning(), clock);
    }
    
    @Bean
    public ConnectionStatusProber githubProber(IntegrationCredentialStore credentialStore,
                                               IntegrationHealthProperties properties, Clock clock) {
        return connectionProber(ConnectionProvider.GITHUB, credentialStore, properties, clock);
    }
    
    @Bean
    public ConnectionStatusProber railwayProber(IntegrationCredentialStore credentialStore,
                                                IntegrationHealthProperties properties, Clock clock) {
        return connectionProber(ConnectionProvider.RAILWAY, credentialStore, properties, clock);
    }
    
    @Bean
    public ConnectionStatusProber vercelProber(IntegrationCredentialStore credentialStore,
                                               IntegrationHealthProperties properties, Clock clock) {
        return connectionProber(ConnectionProvider.VERCEL, credentialStore, properties, clock);
    }
    
    @Bean
    public ConnectionStatusProber supabaseProber(IntegrationCredentialStore credentialStore,
                                                 IntegrationHealthProperties properties, Clock clock) {
        return connectionProber(ConnectionProvider.SUPABASE, credentialStore, properties, clock);
    }
    
    @Bean
    public WebhookAggregateProber webhookAggregateProber(IntegrationCredentialStore credentialStore) {
        return new WebhookAggregateProber(credentialStore);
    }
    
    @Bean
    public ProberRegistry proberRegistry(List<IntegrationProber<?>> probers) {
        return new ProberRegistry(probers);
    }
    
    // Services
    
    @Bean
    public HealthAlertService healthAlertService(
            IntegrationHealthProperties properties,
            EcsLogger ecsLogger,
            ObjectProvider<AlertPublisherService> alertPublisher,
            @Qualifier("healthAlertExecutor") ExecutorService healthAlertExecutor,
            Clock clock) {
        return new HealthAlertService(properties.alerts(), ecsLogger, alertPublisher.getIfAvailable(),
            healthAlertExecutor, clock);
    }
    
    @Bean
    public HealthRecorderService healthRecorderService(
            HealthRecordStore recordStore,
            HealthHistoryStore historyStore,
            HealthAlertService alertService,
            IntegrationHealthProperties properties,
            Clock clock) {
        return new HealthRecorderService(recordStore, historyStore, alertService, properties.history(), clock);
    }
    
    @Bean
    public ProbeDispatcherService probeDispatcherService(
            ProberRegistry proberRegistry,
            HealthRecorderService recorder,
            ProbeMetrics probeMetrics,
            EcsLogger ecsLogger,
            @Qualifier("healthDispatchExecutor") ExecutorService healthDispatchExecutor,
            @Qualifier("healthProbeExecutor") ExecutorService healthProbeExecutor,
            IntegrationHealthProperties properties) {
        return new ProbeDispatcherService(proberRegistry, recorder, probeMetrics, ecsLogger,
            healthDispatchExecutor, healthProbeExecutor, properties.probe().timeout());
    }
    
    @Bean
    public IntegrationHealthService integrationHealthService(
            HealthRecordStore recordStore,
            HealthHistoryStore historyStore,
            ProbeDispatcherService dispatcher,
            IntegrationHealthProperties properties,
            Clock clock) {
        return new IntegrationHealthService(recordStore, historyStore, dispatcher,
            properties.history().maxQueryLimit(), clock);
    }
    
    @Bean
    public HealthCheckScheduler healthCheckScheduler(
            IntegrationCredentialStore credentialStore,
            ProbeDispatcherService dispatcher,
            ProbeMetrics probeMetrics,
            EcsLogger ecsLogger,
            IntegrationHealthProperties properties,
            Clock clock) {
        return new HealthCheckScheduler(credentialStore, dispatcher, probeMetrics, ecsLogger,
            properties.scheduler(), clock);
    }
    
    @Bean
    public SchedulerHealthIndicator schedulerHealthIndicator(
            HealthCheckScheduler scheduler,
            IntegrationHealthProperties properties,
            Clock clock) {
        return new SchedulerHealthIndicator(scheduler, properties.scheduler().initialDelay(), clock);
    }
    
    // Web
    
    @Bean
    public IntegrationHealthController integrationHealthController(IntegrationHealthService healthService) {
        return new IntegrationHealthController(healthService);
    }
    
    @Bean
    public MetricsController metricsController(
            ProbeMetrics probeMetrics,
            HealthCheckScheduler scheduler,
            HealthRecordStore recordStore) {
        return new MetricsController(probeMetrics, scheduler, recordStore);
    }
    
    @Bean
    public GlobalExceptionHandler integrationHealthExceptionHandler() {
        return new GlobalExceptionHandler();
    }
    
    private static ConnectionStatusProber connectionProber(ConnectionProvider provider,
                                                           IntegrationCredentialStore credentialStore,
                                                           IntegrationHealthProperties properties, Clock clock) {
        return new ConnectionStatusProber(provider, credentialStore,
            properties.providers().staleConnectionThreshold(), clock);
    }
    
    private static CustomizableThreadFactory daemonThreads(String prefix) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory(prefix);
        factory.setDaemon(true);
        return factory;
    }
}
