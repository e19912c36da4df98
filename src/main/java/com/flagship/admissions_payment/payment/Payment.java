package com.flagship.admissions_payment.payment;

import lombok.Value;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Payment domain object.
 *
 * Key principles:
 * - Status only moves out of PENDING, never between terminal states
 * - verified flips to true exactly once, together with the terminal status
 * - Amount is an integer in the currency's minor unit
 * - Metadata is an opaque bag, merged but never interpreted
 *
 * Instances are immutable. State changes are applied by the store through
 * {@link PaymentTransition} and read back as a new Payment.
 */
@Value
public class Payment {

    private static final String REFERENCE_PREFIX = "PAY-";
    private static final String REFERENCE_ALPHABET = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    private static final int REFERENCE_SUFFIX_LENGTH = 9;
    private static final SecureRandom RANDOM = new SecureRandom();

    UUID id;
    String reference;
    boolean gatewayReference;
    UUID userId;
    UUID applicationId;
    String program;
    String track;
    long amount;
    CurrencyCode currency;
    PaymentStatus status;
    boolean verified;
    Instant paidAt;
    Instant expiresAt;
    Map<String, Object> metadata;
    String checkoutUrl;
    String accessCode;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new Payment in PENDING status with a locally generated
     * placeholder reference.
     */
    public static Payment create(UUID userId, UUID applicationId, String program, String track,
                                 long amount, CurrencyCode currency, Map<String, Object> metadata,
                                 Duration expiryHorizon) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Payment amount must be a positive number of minor units");
        }
        if (currency == null) {
            throw new IllegalArgumentException("Currency is required");
        }
        if (userId == null || applicationId == null) {
            throw new IllegalArgumentException("User and application are required");
        }

        Instant now = Instant.now();
        return new Payment(
            UUID.randomUUID(),
            generatePlaceholderReference(now),
            false,
            userId,
            applicationId,
            program,
            track,
            amount,
            currency,
            PaymentStatus.PENDING,
            false,
            null,
            now.plus(expiryHorizon),
            readOnlyCopy(metadata),
            null,
            null,
            now,
            now
        );
    }

    /**
     * Insertion-ordered, unmodifiable copy of a metadata bag.
     */
    static Map<String, Object> readOnlyCopy(Map<String, Object> metadata) {
        return Collections.unmodifiableMap(metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata));
    }

    /**
     * Placeholder format: PAY-{epochMillis}-{9 upper-case base36 chars}.
     */
    static String generatePlaceholderReference(Instant now) {
        StringBuilder suffix = new StringBuilder(REFERENCE_SUFFIX_LENGTH);
        for (int i = 0; i < REFERENCE_SUFFIX_LENGTH; i++) {
            suffix.append(REFERENCE_ALPHABET.charAt(RANDOM.nextInt(REFERENCE_ALPHABET.length())));
        }
        return REFERENCE_PREFIX + now.toEpochMilli() + "-" + suffix;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isPending() {
        return status == PaymentStatus.PENDING;
    }

    /**
     * A pending payment observed past its horizon is due to be expired.
     */
    public boolean isOverdue(Instant now) {
        return isPending() && expiresAt != null && expiresAt.isBefore(now);
    }

    public boolean isOwnedBy(UUID candidateUserId) {
        return userId.equals(candidateUserId);
    }
}
