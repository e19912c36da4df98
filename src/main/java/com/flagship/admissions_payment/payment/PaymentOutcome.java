package com.flagship.admissions_payment.payment;

/**
 * A decided gateway outcome, as delivered by the verify call or a webhook.
 */
public enum PaymentOutcome {
    SUCCESS(PaymentStatus.SUCCESS),
    FAILED(PaymentStatus.FAILED),
    CANCELLED(PaymentStatus.CANCELLED);

    private final PaymentStatus terminalStatus;

    PaymentOutcome(PaymentStatus terminalStatus) {
        this.terminalStatus = terminalStatus;
    }

    public PaymentStatus getTerminalStatus() {
        return terminalStatus;
    }

    public boolean isSuccess() {
        return this == SUCCESS;
    }
}
