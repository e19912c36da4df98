package com.flagship.admissions_payment.gateway;

import com.flagship.admissions_payment.payment.CurrencyCode;
import lombok.Value;

import java.util.Map;

/**
 * Input to {@link PaymentGatewayClient#createCheckout}.
 * The reference is proposed by us so a re-issued session keeps the same one.
 */
@Value
public class CheckoutRequest {
    String email;
    long amount;
    CurrencyCode currency;
    String reference;
    Map<String, Object> metadata;
}
