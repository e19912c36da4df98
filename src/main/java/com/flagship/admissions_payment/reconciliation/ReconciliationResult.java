package com.flagship.admissions_payment.reconciliation;

import com.flagship.admissions_payment.payment.Payment;
import lombok.Value;

/**
 * What the engine did with an outcome.
 *
 * payment is the state after reconciliation, null only for UNKNOWN_REFERENCE.
 */
@Value
public class ReconciliationResult {

    public enum Disposition {
        /** This call performed the terminal transition and ran the cascade. */
        APPLIED,
        /** The payment was already terminal; nothing changed. */
        ALREADY_SETTLED,
        /** No payment carries the reference; the outcome was dropped. */
        UNKNOWN_REFERENCE
    }

    Disposition disposition;
    String reference;
    Payment payment;

    public static ReconciliationResult applied(Payment payment) {
        return new ReconciliationResult(Disposition.APPLIED, payment.getReference(), payment);
    }

    public static ReconciliationResult alreadySettled(Payment payment) {
        return new ReconciliationResult(Disposition.ALREADY_SETTLED, payment.getReference(), payment);
    }

    public static ReconciliationResult unknown(String reference) {
        return new ReconciliationResult(Disposition.UNKNOWN_REFERENCE, reference, null);
    }

    public boolean isApplied() {
        return disposition == Disposition.APPLIED;
    }

    public boolean isKnown() {
        return disposition != Disposition.UNKNOWN_REFERENCE;
    }
}
