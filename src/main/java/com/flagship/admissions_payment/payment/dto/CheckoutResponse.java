package com.flagship.admissions_payment.payment.dto;

import com.flagship.admissions_payment.payment.PaymentCheckout;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class CheckoutResponse {
    UUID paymentId;
    String reference;
    String authorizationUrl;
    String accessCode;
    long amount;
    String currency;
    Instant expiresAt;
    boolean reused;

    public static CheckoutResponse from(PaymentCheckout checkout) {
        return CheckoutResponse.builder()
            .paymentId(checkout.getPayment().getId())
            .reference(checkout.getPayment().getReference())
            .authorizationUrl(checkout.getCheckoutUrl())
            .accessCode(checkout.getAccessCode())
            .amount(checkout.getPayment().getAmount())
            .currency(checkout.getPayment().getCurrency().name())
            .expiresAt(checkout.getPayment().getExpiresAt())
            .reused(checkout.isReused())
            .build();
    }
}
