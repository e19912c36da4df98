package com.flagship.admissions_payment.payment;

/**
 * Payment status enum representing the state of a payment.
 *
 * PENDING is the only non-terminal state. Every other status is final:
 * once a payment leaves PENDING no further transition is permitted.
 */
public enum PaymentStatus {
    /**
     * Checkout has been (or is being) opened at the gateway.
     * Initial state for all payments.
     */
    PENDING,

    /**
     * Gateway confirmed the charge.
     * Terminal state.
     */
    SUCCESS,

    /**
     * Gateway reported the charge as failed or reversed.
     * Terminal state.
     */
    FAILED,

    /**
     * The checkout was cancelled.
     * Terminal state.
     */
    CANCELLED,

    /**
     * Payment stayed pending past its expiry horizon.
     * Terminal state.
     */
    EXPIRED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
