package com.flagship.admissions_payment.outbox;

import com.flagship.admissions_payment.observability.OutboxMetrics;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OutboxPublisherTest {

    private static final String TOPIC = "admissions-payments";

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
        ReflectionTestUtils.setField(publisher, "paymentsTopic", TOPIC);
        ReflectionTestUtils.setField(publisher, "batchSize", 100);
        ReflectionTestUtils.setField(publisher, "maxRetries", 5);
        ReflectionTestUtils.setField(publisher, "sendTimeoutMs", 1000L);
    }

    private static OutboxEvent event(String eventType, int retryCount) {
        return new OutboxEvent(UUID.randomUUID(), OutboxService.PAYMENT_AGGREGATE, UUID.randomUUID(), eventType,
                "{\"reference\":\"PAY-1\"}", Instant.now(), null, retryCount, null);
    }

    private static CompletableFuture<SendResult<String, String>> acknowledged(OutboxEvent event) {
        ProducerRecord<String, String> record =
                new ProducerRecord<>(TOPIC, event.getAggregateId().toString(), event.getPayload());
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 0), 42L, 0, 0L, 36, 24);
        return CompletableFuture.completedFuture(new SendResult<>(record, metadata));
    }

    @Test
    @DisplayName("Publishes keyed by payment id and marks the event published")
    void publishesAndMarks() {
        OutboxEvent event = event("PaymentSucceeded", 0);
        String key = event.getAggregateId().toString();
        when(outboxService.findPublishableEvents(100, 5)).thenReturn(List.of(event));
        when(kafkaTemplate.send(TOPIC, key, event.getPayload())).thenReturn(acknowledged(event));

        publisher.publishPendingEvents();

        verify(outboxService).markPublished(event.getId());
        verify(outboxMetrics).recordEventPublished("PaymentSucceeded");
        verify(outboxService, never()).markFailed(eq(event.getId()), anyString());
    }

    @Test
    @DisplayName("A failed send bumps the retry count and keeps going")
    void failedSendIsRetriedLater() {
        OutboxEvent failing = event("PaymentFailed", 0);
        OutboxEvent next = event("PaymentInitialized", 0);
        when(outboxService.findPublishableEvents(100, 5)).thenReturn(List.of(failing, next));
        when(kafkaTemplate.send(TOPIC, failing.getAggregateId().toString(), failing.getPayload()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker unavailable")));
        when(kafkaTemplate.send(TOPIC, next.getAggregateId().toString(), next.getPayload()))
                .thenReturn(acknowledged(next));

        publisher.publishPendingEvents();

        verify(outboxService).markFailed(eq(failing.getId()), anyString());
        verify(outboxMetrics).recordEventPublishFailed("PaymentFailed");
        verify(outboxMetrics, never()).recordEventDeadLettered("PaymentFailed");
        verify(outboxService).markPublished(next.getId());
    }

    @Test
    @DisplayName("The last allowed failure leaves the event as a dead letter")
    void lastFailureDeadLetters() {
        OutboxEvent exhausted = event("PaymentExpired", 4);
        when(outboxService.findPublishableEvents(100, 5)).thenReturn(List.of(exhausted));
        when(kafkaTemplate.send(TOPIC, exhausted.getAggregateId().toString(), exhausted.getPayload()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker unavailable")));

        publisher.publishPendingEvents();

        verify(outboxMetrics).recordEventDeadLettered("PaymentExpired");
    }

    @Test
    @DisplayName("An empty outbox sends nothing")
    void emptyOutbox() {
        when(outboxService.findPublishableEvents(100, 5)).thenReturn(List.of());

        publisher.publishPendingEvents();

        verifyNoInteractions(kafkaTemplate, outboxMetrics);
    }

    @Test
    @DisplayName("Errors reading the outbox do not escape the scheduler thread")
    void pollingErrorsAreContained() {
        when(outboxService.findPublishableEvents(100, 5)).thenThrow(new IllegalStateException("db down"));

        assertDoesNotThrow(() -> publisher.publishPendingEvents());
        verifyNoInteractions(kafkaTemplate);
    }
}
