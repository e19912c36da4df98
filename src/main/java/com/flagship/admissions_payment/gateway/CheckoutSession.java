package com.flagship.admissions_payment.gateway;

import lombok.Value;

/**
 * Hosted checkout opened at the gateway.
 */
@Value
public class CheckoutSession {
    String checkoutUrl;
    String reference;
    String accessCode;
}
