package com.flagship.admissions_payment.payment.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flagship.admissions_payment.payment.PaymentVerification;
import lombok.Value;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VerifyPaymentResponse {
    boolean success;
    String message;
    PaymentResponse payment;
    String redirectUrl;

    public static VerifyPaymentResponse from(PaymentVerification verification) {
        String message;
        if (verification.isSuccessful()) {
            message = "Payment verified successfully";
        } else if (verification.isPending()) {
            message = "Payment has not been completed yet";
        } else {
            message = "Payment was not successful";
        }
        return new VerifyPaymentResponse(
            verification.isSuccessful(),
            message,
            PaymentResponse.from(verification.getPayment()),
            verification.getRedirectUrl());
    }
}
