package com.flagship.admissions_payment.payment.event;

import com.flagship.admissions_payment.payment.Payment;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Event published when a pending payment is moved to EXPIRED.
 */
@Value
public class PaymentExpiredEvent implements PaymentEvent {
    UUID eventId;
    UUID paymentId;
    String reference;
    UUID applicationId;
    Instant expiresAt;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentExpired";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PaymentExpiredEvent fromPayment(Payment payment) {
        return new PaymentExpiredEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getReference(),
            payment.getApplicationId(),
            payment.getExpiresAt(),
            Instant.now()
        );
    }
}
