package com.flagship.admissions_payment.payment.exception;

/**
 * A payment with this reference already exists.
 */
public class DuplicateReferenceException extends RuntimeException {

    private final String reference;

    public DuplicateReferenceException(String reference, Throwable cause) {
        super("Payment reference already exists: " + reference, cause);
        this.reference = reference;
    }

    public String getReference() {
        return reference;
    }
}
