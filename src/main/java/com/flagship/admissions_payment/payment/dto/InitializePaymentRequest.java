package com.flagship.admissions_payment.payment.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import lombok.Value;

import java.util.Map;
import java.util.UUID;

/**
 * Request body of POST /api/payments/initialize.
 *
 * amount is in the currency's minor unit (kobo for NGN).
 */
@Value
public class InitializePaymentRequest {

    @NotNull(message = "Application ID is required")
    UUID applicationId;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be a positive number of minor units")
    Long amount;

    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    String currency;

    @Email(message = "Email must be a valid address")
    String email;

    String program;

    String track;

    Map<String, Object> metadata;
}
