package com.stockalert.monitor.infrastructure.kafka;

import static com.stockalert.monitor.test.fixtures.MonitorPropertiesFixtures.someProperties;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;

import com.stockalert.common.event.AlertTriggered;
import com.stockalert.common.event.Direction;
import com.stockalert.common.kafka.KafkaTopics;
import com.stockalert.monitor.domain.notification.DeliveryResult;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

@ExtendWith(MockitoExtension.class)
class KafkaNotificationDispatcherTest {

    private static final AlertTriggered EVENT = AlertTriggered.builder()
            .alertId(1L)
            .ownerId(1001L)
            .ticker("AAPL")
            .exchange("NASDAQ")
            .companyName("Apple Inc.")
            .targetPrice(new BigDecimal("100.00"))
            .observedPrice(new BigDecimal("100.50"))
            .currency("USD")
            .direction(Direction.ABOVE)
            .triggeredAt(Instant.parse("2024-06-03T14:00:00Z"))
            .build();

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    private KafkaNotificationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new KafkaNotificationDispatcher(kafkaTemplate, someProperties());
    }

    @Test
    void shouldPublishKeyedByOwnerAndReportDelivered() {
        // given
        var record = new ProducerRecord<String, Object>(KafkaTopics.ALERT_TRIGGERS, "1001", EVENT);
        var metadata = new RecordMetadata(new TopicPartition(KafkaTopics.ALERT_TRIGGERS, 3), 0L, 0, 0L, 4, 100);
        given(kafkaTemplate.send(KafkaTopics.ALERT_TRIGGERS, "1001", EVENT))
                .willReturn(CompletableFuture.completedFuture(new SendResult<>(record, metadata)));

        // when
        var result = dispatcher.deliver(EVENT);

        // then
        assertThat(result).isEqualTo(DeliveryResult.DELIVERED);
        then(kafkaTemplate).should().send(KafkaTopics.ALERT_TRIGGERS, "1001", EVENT);
    }

    @Test
    void shouldReportFailedWhenBrokerRejects() {
        // given
        given(kafkaTemplate.send(eq(KafkaTopics.ALERT_TRIGGERS), anyString(), any()))
                .willReturn(CompletableFuture.failedFuture(new KafkaException("broker unavailable")));

        // then
        assertThat(dispatcher.deliver(EVENT)).isEqualTo(DeliveryResult.FAILED);
    }

    @Test
    void shouldReportFailedWhenSendThrows() {
        // given
        given(kafkaTemplate.send(eq(KafkaTopics.ALERT_TRIGGERS), anyString(), any()))
                .willThrow(new KafkaException("producer closed"));

        // then
        assertThat(dispatcher.deliver(EVENT)).isEqualTo(DeliveryResult.FAILED);
    }
}
