package com.stockalert.monitor.infrastructure.kafka;

import com.stockalert.common.event.AlertTriggered;
import com.stockalert.common.kafka.KafkaTopics;
import com.stockalert.monitor.application.config.MonitorProperties;
import com.stockalert.monitor.domain.notification.DeliveryResult;
import com.stockalert.monitor.domain.notification.NotificationDispatcher;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes AlertTriggered events to the alert-triggers topic, keyed by owner id.
 * Waits for the broker ack so a lost notification is reported to the caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KafkaNotificationDispatcher implements NotificationDispatcher {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final MonitorProperties properties;

    @Override
    public DeliveryResult deliver(AlertTriggered event) {
        var timeout = properties.notification().sendTimeout();
        try {
            var result = kafkaTemplate
                    .send(KafkaTopics.ALERT_TRIGGERS, String.valueOf(event.ownerId()), event)
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("Produced AlertTriggered for alert {} to partition {}",
                    event.alertId(), result.getRecordMetadata().partition());
            return DeliveryResult.DELIVERED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while producing AlertTriggered for alert {}", event.alertId());
            return DeliveryResult.FAILED;
        } catch (ExecutionException e) {
            log.error("Failed to produce AlertTriggered for alert {}: {}",
                    event.alertId(), e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return DeliveryResult.FAILED;
        } catch (TimeoutException e) {
            log.error("Timed out after {} producing AlertTriggered for alert {}", timeout, event.alertId());
            return DeliveryResult.FAILED;
        } catch (RuntimeException e) {
            log.error("Failed to produce AlertTriggered for alert {}: {}", event.alertId(), e.getMessage());
            return DeliveryResult.FAILED;
        }
    }
}
