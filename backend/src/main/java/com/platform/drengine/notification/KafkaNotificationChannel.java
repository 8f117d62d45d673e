package com.platform.drengine.notification;

import com.platform.drengine.config.DrEngineProperties;
import com.platform.drengine.core.CircuitBreakerManager;
import com.platform.drengine.observability.MetricsRegistry;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes DR events to Kafka, keyed by event type.
 * Delivery is asynchronous; failures are logged and counted, never propagated into the DR flow.
 */
@Slf4j
@Component
public class KafkaNotificationChannel implements NotificationChannel {
    
    private final KafkaTemplate<String, DrEvent> kafkaTemplate;
    private final MetricsRegistry metricsRegistry;
    private final String topic;
    
    public KafkaNotificationChannel(
            KafkaTemplate<String, DrEvent> kafkaTemplate,
            MetricsRegistry metricsRegistry,
            DrEngineProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.metricsRegistry = metricsRegistry;
        this.topic = properties.getNotification().getTopic();
    }
    
    @Override
    @CircuitBreaker(name = CircuitBreakerManager.NOTIFICATION, fallbackMethod = "notifyFallback")
    public void notify(DrEvent event) {
        if (event.requiresIntervention()) {
            log.error("[ALERT] {} {}: {} {}", event.severity(), event.eventType(), event.message(), event.context());
        } else {
            log.info("Notifying {} {}: {}", event.severity(), event.eventType(), event.message());
        }
        
        kafkaTemplate.send(topic, event.eventType().name(), event)
            .whenComplete((result, ex) -> {
                if (ex != null) {
                    log.error("Failed to publish DR event {}: {}", event.eventId(), ex.getMessage());
                    metricsRegistry.incrementCounter("drengine.notifications.failed", "type", event.eventType().name());
                } else {
                    metricsRegistry.incrementCounter("drengine.notifications.published", "type", event.eventType().name());
                }
            });
    }
    
    @SuppressWarnings("unused")
    private void notifyFallback(DrEvent event, Exception e) {
        log.error("Notification channel unavailable, event {} {} not delivered: {} ({})",
            event.eventType(), event.eventId(), event.message(), e.getMessage());
        metricsRegistry.incrementCounter("drengine.notifications.failed", "type", event.eventType().name());
    }
}
