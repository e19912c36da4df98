package com.flagship.admissions_payment.payment.event;

import com.flagship.admissions_payment.payment.Payment;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Event published when a payment transitions from PENDING to SUCCESS.
 *
 * Written in the same transaction as the transition, so consumers see it
 * exactly when the payment is durably settled.
 */
@Value
public class PaymentSucceededEvent implements PaymentEvent {
    UUID eventId;
    UUID paymentId;
    String reference;
    UUID applicationId;
    UUID userId;
    long amount;
    String currency;
    Instant paidAt;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentSucceeded";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PaymentSucceededEvent fromPayment(Payment payment) {
        return new PaymentSucceededEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getReference(),
            payment.getApplicationId(),
            payment.getUserId(),
            payment.getAmount(),
            payment.getCurrency().name(),
            payment.getPaidAt(),
            Instant.now()
        );
    }
}
