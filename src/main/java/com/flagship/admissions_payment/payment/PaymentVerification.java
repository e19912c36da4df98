package com.flagship.admissions_payment.payment;

import lombok.Value;

/**
 * Result of {@link PaymentOrchestrator#verify}. redirectUrl is only set for
 * a successful payment.
 */
@Value
public class PaymentVerification {
    Payment payment;
    String redirectUrl;

    public boolean isSuccessful() {
        return payment.getStatus() == PaymentStatus.SUCCESS;
    }

    public boolean isPending() {
        return payment.isPending();
    }
}
