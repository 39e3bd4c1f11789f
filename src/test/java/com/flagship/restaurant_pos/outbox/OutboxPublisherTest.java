package com.flagship.restaurant_pos.outbox;

import com.flagship.restaurant_pos.observability.OutboxMetrics;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Publisher behaviour against a mocked Kafka template.
 */
@ExtendWith(MockitoExtension.class)
class OutboxPublisherTest {

    private static final String TOPIC = "pos-notifications";

    @Mock
    private OutboxService outboxService;

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Mock
    private OutboxMetrics outboxMetrics;

    private OutboxPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new OutboxPublisher(outboxService, kafkaTemplate, outboxMetrics);
        ReflectionTestUtils.setField(publisher, "notificationsTopic", TOPIC);
        ReflectionTestUtils.setField(publisher, "batchSize", 100);
        ReflectionTestUtils.setField(publisher, "maxRetries", 5);
        ReflectionTestUtils.setField(publisher, "sendTimeoutMs", 1000L);
    }

    private OutboxEvent event(int retryCount) {
        return new OutboxEvent(UUID.randomUUID(), "Product", UUID.randomUUID(), "LowStockDetected",
                "{\"condition\":\"LOW_STOCK\"}", Instant.now(), null, retryCount, null, 1L);
    }

    @Test
    @DisplayName("Sent event is keyed by product id, tagged with its type and marked published")
    @SuppressWarnings("unchecked")
    void testPublishesAndMarks() {
        OutboxEvent event = event(0);
        when(outboxService.findUnpublishedEvents(100)).thenReturn(List.of(event));
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 0), 0, 0, 0L, 0, 0);
        when(kafkaTemplate.send(any(ProducerRecord.class)))
                .thenReturn(CompletableFuture.completedFuture(new SendResult<>(null, metadata)));

        publisher.publishPendingEvents();

        ArgumentCaptor<ProducerRecord<String, String>> captor = ArgumentCaptor.forClass(ProducerRecord.class);
        verify(kafkaTemplate).send(captor.capture());
        ProducerRecord<String, String> record = captor.getValue();
        assertEquals(TOPIC, record.topic());
        assertEquals(event.getAggregateId().toString(), record.key());
        assertEquals("LowStockDetected",
                new String(record.headers().lastHeader("event_type").value(), StandardCharsets.UTF_8));
        verify(outboxService).markPublished(event.getId());
        verify(outboxMetrics).recordEventPublished("LowStockDetected");
    }

    @Test
    @DisplayName("Failed send increments the retry count instead of marking published")
    @SuppressWarnings("unchecked")
    void testFailedSend() {
        OutboxEvent event = event(1);
        when(outboxService.findUnpublishedEvents(100)).thenReturn(List.of(event));
        when(kafkaTemplate.send(any(ProducerRecord.class)))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        publisher.publishPendingEvents();

        verify(outboxService).markFailed(eq(event.getId()), anyString());
        verify(outboxService, never()).markPublished(any());
        verify(outboxMetrics).recordEventPublishFailed("LowStockDetected");
    }

    @Test
    @DisplayName("Event past max retries is left as dead letter and not sent")
    void testDeadLetter() {
        OutboxEvent event = event(5);
        when(outboxService.findUnpublishedEvents(100)).thenReturn(List.of(event));

        publisher.publishPendingEvents();

        verify(kafkaTemplate, never()).send(any(ProducerRecord.class));
        verify(outboxMetrics).recordEventDeadLettered("LowStockDetected");
    }
}
