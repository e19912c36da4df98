package com.flagship.admissions_payment.payment.exception;

/**
 * Inbound webhook failed signature verification. Rejected before any
 * state change.
 */
public class WebhookAuthenticationException extends RuntimeException {

    public WebhookAuthenticationException(String message) {
        super(message);
    }
}
