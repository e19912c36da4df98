package com.flagship.admissions_payment.gateway;

/**
 * Thrown when a call to the payment gateway fails.
 * This could be due to network issues, timeouts, an open circuit or a
 * request the gateway rejected.
 */
public class GatewayException extends RuntimeException {

    private final String gatewayName;
    private final String reference;
    private final boolean retryable;

    public GatewayException(String message, String gatewayName, String reference, boolean retryable) {
        super(message);
        this.gatewayName = gatewayName;
        this.reference = reference;
        this.retryable = retryable;
    }

    public GatewayException(String message, String gatewayName, String reference, boolean retryable,
                            Throwable cause) {
        super(message, cause);
        this.gatewayName = gatewayName;
        this.reference = reference;
        this.retryable = retryable;
    }

    public String getGatewayName() {
        return gatewayName;
    }

    public String getReference() {
        return reference;
    }

    /**
     * Indicates if this error is transient and the operation can be retried.
     * Non-retryable errors include unknown references and rejected credentials.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
