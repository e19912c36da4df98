package com.flagship.admissions_payment.payment;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class PaymentTest {

    private static final Duration HORIZON = Duration.ofHours(24);

    @Test
    @DisplayName("New payment is PENDING, unverified, and expires after the horizon")
    void createPendingPayment() {
        UUID userId = UUID.randomUUID();
        UUID applicationId = UUID.randomUUID();

        Payment payment = Payment.create(userId, applicationId, "Software Engineering", "Backend",
                2_500_000L, CurrencyCode.NGN, Map.of("source", "web"), HORIZON);

        assertEquals(PaymentStatus.PENDING, payment.getStatus());
        assertFalse(payment.isVerified());
        assertFalse(payment.isGatewayReference());
        assertNull(payment.getPaidAt());
        assertEquals(payment.getCreatedAt().plus(HORIZON), payment.getExpiresAt());
        assertEquals("web", payment.getMetadata().get("source"));
        assertTrue(payment.isOwnedBy(userId));
        assertFalse(payment.isOwnedBy(UUID.randomUUID()));
    }

    @Test
    @DisplayName("Placeholder reference is PAY-<epochMillis>-<9 upper-case base36 chars>")
    void placeholderReferenceFormat() {
        Instant now = Instant.ofEpochMilli(1_700_000_000_000L);

        String reference = Payment.generatePlaceholderReference(now);

        assertTrue(reference.matches("PAY-1700000000000-[0-9A-Z]{9}"), reference);
    }

    @Test
    @DisplayName("Placeholder references do not repeat")
    void placeholderReferencesAreDistinct() {
        Instant now = Instant.now();
        Set<String> references = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            references.add(Payment.generatePlaceholderReference(now));
        }
        assertEquals(1000, references.size());
    }

    @Test
    @DisplayName("Amount must be a positive number of minor units")
    void rejectsNonPositiveAmount() {
        UUID userId = UUID.randomUUID();
        UUID applicationId = UUID.randomUUID();

        assertThrows(IllegalArgumentException.class, () ->
                Payment.create(userId, applicationId, null, null, 0L, CurrencyCode.NGN, null, HORIZON));
        assertThrows(IllegalArgumentException.class, () ->
                Payment.create(userId, applicationId, null, null, -100L, CurrencyCode.NGN, null, HORIZON));
    }

    @Test
    @DisplayName("Currency and ownership links are required")
    void rejectsMissingFields() {
        assertThrows(IllegalArgumentException.class, () ->
                Payment.create(UUID.randomUUID(), UUID.randomUUID(), null, null, 100L, null, null, HORIZON));
        assertThrows(IllegalArgumentException.class, () ->
                Payment.create(null, UUID.randomUUID(), null, null, 100L, CurrencyCode.NGN, null, HORIZON));
    }

    @Test
    @DisplayName("Only a pending payment past its horizon is overdue")
    void overdue() {
        Payment payment = Payment.create(UUID.randomUUID(), UUID.randomUUID(), null, null,
                100L, CurrencyCode.NGN, null, Duration.ofMinutes(30));

        assertFalse(payment.isOverdue(Instant.now()));
        assertTrue(payment.isOverdue(Instant.now().plus(Duration.ofHours(1))));
    }

    @Test
    @DisplayName("Every status but PENDING is terminal")
    void terminalStatuses() {
        assertFalse(PaymentStatus.PENDING.isTerminal());
        assertTrue(PaymentStatus.SUCCESS.isTerminal());
        assertTrue(PaymentStatus.FAILED.isTerminal());
        assertTrue(PaymentStatus.CANCELLED.isTerminal());
        assertTrue(PaymentStatus.EXPIRED.isTerminal());
    }

    @Test
    @DisplayName("Success transition defaults paidAt to now; failure transitions carry none")
    void transitions() {
        Instant before = Instant.now();
        PaymentTransition success = PaymentTransition.succeed(null, "gatewayVerification", Map.of("status", "success"));
        assertEquals(PaymentStatus.SUCCESS, success.getTargetStatus());
        assertNotNull(success.getPaidAt());
        assertFalse(success.getPaidAt().isBefore(before));
        assertEquals(Map.of("status", "success"), success.getMetadata().get("gatewayVerification"));

        PaymentTransition cancelled = PaymentTransition.fail(PaymentStatus.CANCELLED, "gatewayWebhook", null);
        assertEquals(PaymentStatus.CANCELLED, cancelled.getTargetStatus());
        assertNull(cancelled.getPaidAt());
        assertTrue(cancelled.getMetadata().isEmpty());

        assertThrows(IllegalArgumentException.class, () ->
                PaymentTransition.fail(PaymentStatus.SUCCESS, "gatewayWebhook", null));
        assertEquals(PaymentStatus.EXPIRED, PaymentTransition.expire().getTargetStatus());
    }

    @Test
    @DisplayName("Metadata is a read-only, ordered copy of what the caller passed in")
    void metadataIsReadOnly() {
        Map<String, Object> source = new LinkedHashMap<>();
        source.put("source", "web");
        source.put("cohort", "2025");

        Payment payment = Payment.create(UUID.randomUUID(), UUID.randomUUID(), null, null,
                2_500_000L, CurrencyCode.NGN, source, HORIZON);
        source.put("cohort", "2026");

        assertEquals("2025", payment.getMetadata().get("cohort"));
        assertEquals(List.of("source", "cohort"), List.copyOf(payment.getMetadata().keySet()));
        assertThrows(UnsupportedOperationException.class, () -> payment.getMetadata().put("source", "api"));

        Payment reloaded = PaymentEntity.fromDomain(payment).toDomain();
        assertEquals(payment.getMetadata(), reloaded.getMetadata());
        assertThrows(UnsupportedOperationException.class, () -> reloaded.getMetadata().remove("source"));
    }
}
