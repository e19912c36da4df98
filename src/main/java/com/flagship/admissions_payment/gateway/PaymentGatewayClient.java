package com.flagship.admissions_payment.gateway;

/**
 * Narrow contract with the hosted-checkout payment gateway.
 */
public interface PaymentGatewayClient {

    /**
     * Opens a checkout session. Creates remote state, so it is never retried
     * blindly: a failure is fatal to the current attempt.
     *
     * @throws GatewayException if the gateway is unreachable or rejects the request
     */
    CheckoutSession createCheckout(CheckoutRequest request);

    /**
     * Reads the gateway's view of a transaction. Read-only and safe to retry.
     *
     * @throws GatewayException if the gateway is unreachable or does not know the reference
     */
    GatewayVerification verifyTransaction(String reference);

    /**
     * Name used in logs, metrics and errors.
     */
    String getGatewayName();
}
