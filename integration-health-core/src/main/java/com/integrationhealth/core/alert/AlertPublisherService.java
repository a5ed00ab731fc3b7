package com.integrationhealth.core.alert;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.kafka.support.SendResult;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes health alerts as JSON to a Kafka topic, keyed by workspace so one workspace's alerts stay ordered.
 */
public class AlertPublisherService {
    
    private static final Logger logger = LoggerFactory.getLogger(AlertPublisherService.class);
    
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String topic;
    
    public AlertPublisherService(KafkaTemplate<String, String> kafkaTemplate, ObjectMapper objectMapper, String topic) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.topic = topic;
    }
    
    @Retryable(
        retryFor = {Exception.class},
        maxAttempts = 3,
        backoff = @Backoff(delay = 1000L)
    )
    public CompletableFuture<SendResult<String, String>> publish(HealthAlert alert) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(alert);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize health alert", e);
        }
        
        logger.debug("Publishing {} alert for {} in workspace {} to topic: {}",
            alert.level(), alert.integrationType().value(), alert.workspaceId(), topic);
        
        var message = MessageBuilder
            .withPayload(payload)
            .setHeader(KafkaHeaders.TOPIC, topic)
            .setHeader(KafkaHeaders.KEY, alert.workspaceId())
            .setHeader("alert_level", alert.level().name())
            .build();
        
        return kafkaTemplate.send(message);
    }
}
