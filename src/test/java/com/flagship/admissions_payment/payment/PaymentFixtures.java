package com.flagship.admissions_payment.payment;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Builds {@link Payment} instances in arbitrary states for unit tests.
 */
public final class PaymentFixtures {

    private PaymentFixtures() {
    }

    public static Payment pending(String reference, UUID userId, UUID applicationId) {
        Instant now = Instant.now();
        return new Payment(UUID.randomUUID(), reference, false, userId, applicationId,
                "Software Engineering", "Backend", 2_500_000L, CurrencyCode.NGN,
                PaymentStatus.PENDING, false, null, now.plus(Duration.ofHours(24)),
                Map.of("applicationId", applicationId.toString()),
                "https://checkout.test/" + reference, "access-" + reference, now, now);
    }

    /**
     * A pending payment whose first checkout has not been attached yet.
     */
    public static Payment opening(String reference, UUID userId, UUID applicationId) {
        Payment payment = pending(reference, userId, applicationId);
        return new Payment(payment.getId(), reference, false, userId, applicationId,
                payment.getProgram(), payment.getTrack(), payment.getAmount(), payment.getCurrency(),
                PaymentStatus.PENDING, false, null, payment.getExpiresAt(), payment.getMetadata(),
                null, null, payment.getCreatedAt(), payment.getUpdatedAt());
    }

    public static Payment pending(String reference) {
        return pending(reference, UUID.randomUUID(), UUID.randomUUID());
    }

    /**
     * Same payment, already past its expiry horizon.
     */
    public static Payment overdue(Payment payment) {
        return new Payment(payment.getId(), payment.getReference(), payment.isGatewayReference(),
                payment.getUserId(), payment.getApplicationId(), payment.getProgram(), payment.getTrack(),
                payment.getAmount(), payment.getCurrency(), PaymentStatus.PENDING, false, null,
                Instant.now().minus(Duration.ofMinutes(5)), payment.getMetadata(),
                payment.getCheckoutUrl(), payment.getAccessCode(), payment.getCreatedAt(), Instant.now());
    }

    /**
     * Same payment, settled in the given terminal status.
     */
    public static Payment settled(Payment payment, PaymentStatus status) {
        return new Payment(payment.getId(), payment.getReference(), payment.isGatewayReference(),
                payment.getUserId(), payment.getApplicationId(), payment.getProgram(), payment.getTrack(),
                payment.getAmount(), payment.getCurrency(), status, true,
                status == PaymentStatus.SUCCESS ? Instant.now() : null,
                payment.getExpiresAt(), payment.getMetadata(),
                payment.getCheckoutUrl(), payment.getAccessCode(), payment.getCreatedAt(), Instant.now());
    }
}
