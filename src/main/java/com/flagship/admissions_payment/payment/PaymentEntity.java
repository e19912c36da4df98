package com.flagship.admissions_payment.payment;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * JPA Entity for Payment persistence.
 *
 * Key design principles:
 * - No @Setter: status, verified and paidAt are only written by the
 *   conditional update in {@link PaymentRepository#transitionIfUnverified}
 * - Ownership links, amount and currency are updatable = false
 * - The reference can be replaced once, by the gateway's canonical reference
 * - Lifecycle hooks handle timestamps
 */
@Entity
@Table(
    name = "payments",
    indexes = {
        @Index(name = "idx_payments_reference", columnList = "reference", unique = true),
        @Index(name = "idx_payments_user_status", columnList = "user_id, status"),
        @Index(name = "idx_payments_application_status", columnList = "application_id, status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, unique = true, length = 100)
    private String reference;

    @Column(name = "gateway_reference", nullable = false)
    private boolean gatewayReference;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "application_id", nullable = false, updatable = false)
    private UUID applicationId;

    @Column(length = 100)
    private String program;

    @Column(length = 100)
    private String track;

    @Column(nullable = false, updatable = false)
    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3, updatable = false)
    private CurrencyCode currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentStatus status;

    @Column(nullable = false)
    private boolean verified;

    @Column(name = "paid_at")
    private Instant paidAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;

    @Column(name = "metadata", nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> metadata;

    @Column(name = "checkout_url", length = 500)
    private String checkoutUrl;

    @Column(name = "access_code", length = 100)
    private String accessCode;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        this.updatedAt = Instant.now();
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Controlled factory method to create an entity from a new domain payment.
     */
    static PaymentEntity fromDomain(Payment payment) {
        return new PaymentEntity(
            payment.getId(),
            payment.getReference(),
            payment.isGatewayReference(),
            payment.getUserId(),
            payment.getApplicationId(),
            payment.getProgram(),
            payment.getTrack(),
            payment.getAmount(),
            payment.getCurrency(),
            payment.getStatus(),
            payment.isVerified(),
            payment.getPaidAt(),
            payment.getExpiresAt(),
            new LinkedHashMap<>(payment.getMetadata()),
            payment.getCheckoutUrl(),
            payment.getAccessCode(),
            payment.getCreatedAt(),
            null // updatedAt - set by @PrePersist
        );
    }

    public Payment toDomain() {
        return new Payment(
            id,
            reference,
            gatewayReference,
            userId,
            applicationId,
            program,
            track,
            amount,
            currency,
            status,
            verified,
            paidAt,
            expiresAt,
            Payment.readOnlyCopy(metadata),
            checkoutUrl,
            accessCode,
            createdAt,
            updatedAt
        );
    }

    /**
     * Replaces the placeholder reference with the one issued by the gateway.
     * A gateway-issued reference is immutable.
     */
    void assignGatewayReference(String canonicalReference) {
        if (canonicalReference == null || canonicalReference.isBlank()) {
            throw new IllegalArgumentException("Gateway reference cannot be blank");
        }
        if (this.gatewayReference && !this.reference.equals(canonicalReference)) {
            throw new IllegalStateException(
                "Payment " + this.id + " already carries gateway reference " + this.reference +
                ", refusing to replace it with " + canonicalReference);
        }
        this.reference = canonicalReference;
        this.gatewayReference = true;
    }

    void recordCheckout(String checkoutUrl, String accessCode) {
        this.checkoutUrl = checkoutUrl;
        this.accessCode = accessCode;
    }

    /**
     * Merges entries into the metadata bag. Existing keys are overwritten,
     * insertion order is preserved.
     */
    void mergeMetadata(Map<String, Object> entries) {
        if (entries == null || entries.isEmpty()) {
            return;
        }
        Map<String, Object> merged = this.metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(this.metadata);
        merged.putAll(entries);
        this.metadata = merged;
    }
}
