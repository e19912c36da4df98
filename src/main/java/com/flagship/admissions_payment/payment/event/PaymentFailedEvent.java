package com.flagship.admissions_payment.payment.event;

import com.flagship.admissions_payment.payment.Payment;
import com.flagship.admissions_payment.payment.PaymentStatus;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Event published when a payment ends FAILED or CANCELLED.
 * The event type follows the terminal status.
 */
@Value
public class PaymentFailedEvent implements PaymentEvent {
    UUID eventId;
    UUID paymentId;
    String reference;
    UUID applicationId;
    PaymentStatus status;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentFailed";
    public static final String CANCELLED_EVENT_TYPE = "PaymentCancelled";

    @Override
    public String getEventType() {
        return status == PaymentStatus.CANCELLED ? CANCELLED_EVENT_TYPE : EVENT_TYPE;
    }

    public static PaymentFailedEvent fromPayment(Payment payment) {
        return new PaymentFailedEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getReference(),
            payment.getApplicationId(),
            payment.getStatus(),
            Instant.now()
        );
    }
}
