package com.flagship.admissions_payment.payment.exception;

/**
 * Authenticated webhook body that cannot be parsed into an event.
 */
public class MalformedWebhookException extends RuntimeException {

    public MalformedWebhookException(String message, Throwable cause) {
        super(message, cause);
    }
}
