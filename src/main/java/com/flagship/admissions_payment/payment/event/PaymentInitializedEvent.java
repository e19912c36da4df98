package com.flagship.admissions_payment.payment.event;

import com.flagship.admissions_payment.payment.Payment;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Event published when a checkout session has been opened for a new payment.
 */
@Value
public class PaymentInitializedEvent implements PaymentEvent {
    UUID eventId;
    UUID paymentId;
    String reference;
    UUID applicationId;
    UUID userId;
    long amount;
    String currency;
    Instant expiresAt;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentInitialized";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PaymentInitializedEvent fromPayment(Payment payment) {
        return new PaymentInitializedEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getReference(),
            payment.getApplicationId(),
            payment.getUserId(),
            payment.getAmount(),
            payment.getCurrency().name(),
            payment.getExpiresAt(),
            Instant.now()
        );
    }
}
