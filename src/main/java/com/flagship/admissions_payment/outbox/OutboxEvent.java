package com.flagship.admissions_payment.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A payment lifecycle event waiting in the outbox.
 *
 * Written in the same transaction as the payment change it describes and
 * published to Kafka afterwards by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "Payment"
    UUID aggregateId;          // payment id, also the Kafka key
    String eventType;          // e.g. "PaymentSucceeded"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until published
    int retryCount;
    String lastError;

    public static OutboxEvent create(String aggregateType, UUID aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null
        );
    }
}
