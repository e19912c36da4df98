package com.flagship.admissions_payment.payment.exception;

public class PaymentNotFoundException extends ResourceNotFoundException {

    public PaymentNotFoundException(String referenceOrId) {
        super("Payment", referenceOrId);
    }
}
