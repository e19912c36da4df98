package com.flagship.admissions_payment.payment;

import lombok.Value;

/**
 * Checkout handed back to the applicant by {@link PaymentOrchestrator#initialize}.
 * reused is true when an existing live payment was re-issued instead of a new one created.
 */
@Value
public class PaymentCheckout {
    Payment payment;
    String checkoutUrl;
    String accessCode;
    boolean reused;
}
