package com.integrationhealth.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.integrationhealth.core.alert.AlertPublisherService;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Producer side only: alerts are published, nothing is consumed.
 */
@Configuration
@ConditionalOnProperty(value = "integration-health.alerts.publish-enabled", havingValue = "true")
public class KafkaConfig {
    
    private final IntegrationHealthProperties properties;
    
    public KafkaConfig(IntegrationHealthProperties properties) {
        this.properties = properties;
    }
    
    @Bean
    public ProducerFactory<String, String> alertProducerFactory() {
        Map<String, Object> configProps = new HashMap<>();
        
        configProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, properties.alerts().bootstrapServers());
        configProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        configProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        configProps.put(ProducerConfig.ACKS_CONFIG, "all");
        configProps.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        configProps.put(ProducerConfig.RETRIES_CONFIG, 3);
        configProps.put(ProducerConfig.LINGER_MS_CONFIG, 5);
        
        return new DefaultKafkaProducerFactory<>(configProps);
    }
    
    @Bean
    public KafkaTemplate<String, String> alertKafkaTemplate(
            @Qualifier("alertProducerFactory") ProducerFactory<String, String> alertProducerFactory) {
        return new KafkaTemplate<>(alertProducerFactory);
    }
    
    @Bean
    public AlertPublisherService alertPublisherService(
            @Qualifier("alertKafkaTemplate") KafkaTemplate<String, String> alertKafkaTemplate,
            ObjectMapper objectMapper) {
        return new AlertPublisherService(alertKafkaTemplate, objectMapper, properties.alerts().topic());
    }
}
