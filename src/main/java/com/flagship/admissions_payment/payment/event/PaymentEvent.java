package com.flagship.admissions_payment.payment.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for payment lifecycle events.
 *
 * All payment events share these common properties:
 * - Event ID for deduplication
 * - Payment ID (aggregate ID) and reference
 * - Timestamp of when the event occurred
 */
public interface PaymentEvent {

    /**
     * Unique identifier for this event instance.
     * Used for deduplication in consumers.
     */
    UUID getEventId();

    UUID getPaymentId();

    String getReference();

    Instant getOccurredAt();

    /**
     * Event type name for routing/filtering.
     */
    String getEventType();
}
