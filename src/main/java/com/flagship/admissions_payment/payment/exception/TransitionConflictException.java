package com.flagship.admissions_payment.payment.exception;

import com.flagship.admissions_payment.payment.PaymentStatus;

/**
 * The conditional transition matched no row: another caller already moved
 * the payment out of the expected status. Callers treat this as the other
 * path having won, never as an error for their own caller.
 */
public class TransitionConflictException extends RuntimeException {

    private final String reference;
    private final PaymentStatus expectedStatus;

    public TransitionConflictException(String reference, PaymentStatus expectedStatus) {
        super(String.format("Payment %s is no longer %s and unverified", reference, expectedStatus));
        this.reference = reference;
        this.expectedStatus = expectedStatus;
    }

    public String getReference() {
        return reference;
    }

    public PaymentStatus getExpectedStatus() {
        return expectedStatus;
    }
}
