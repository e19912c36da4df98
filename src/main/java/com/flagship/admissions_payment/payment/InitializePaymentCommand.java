package com.flagship.admissions_payment.payment;

import lombok.Value;

import java.util.Map;
import java.util.UUID;

/**
 * Input to {@link PaymentOrchestrator#initialize}.
 *
 * email, program and track are optional and default to the application's own.
 */
@Value
public class InitializePaymentCommand {
    UUID applicationId;
    long amount;
    CurrencyCode currency;
    String email;
    String program;
    String track;
    Map<String, Object> metadata;
}
