package com.flagship.admissions_payment.payment.dto;

import com.flagship.admissions_payment.payment.Payment;
import com.flagship.admissions_payment.payment.PaymentStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Response DTO for payment operations.
 */
@Value
@Builder
public class PaymentResponse {
    UUID id;
    String reference;
    UUID applicationId;
    String program;
    String track;
    long amount;
    String currency;
    PaymentStatus status;
    boolean verified;
    Instant paidAt;
    Instant expiresAt;
    Map<String, Object> metadata;
    Instant createdAt;
    Instant updatedAt;

    public static PaymentResponse from(Payment payment) {
        return PaymentResponse.builder()
            .id(payment.getId())
            .reference(payment.getReference())
            .applicationId(payment.getApplicationId())
            .program(payment.getProgram())
            .track(payment.getTrack())
            .amount(payment.getAmount())
            .currency(payment.getCurrency().name())
            .status(payment.getStatus())
            .verified(payment.isVerified())
            .paidAt(payment.getPaidAt())
            .expiresAt(payment.getExpiresAt())
            .metadata(payment.getMetadata())
            .createdAt(payment.getCreatedAt())
            .updatedAt(payment.getUpdatedAt())
            .build();
    }
}
