package com.flagship.admissions_payment.reconciliation;

import com.flagship.admissions_payment.payment.PaymentStatus;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A cascade that did not complete after its payment's terminal transition.
 *
 * The payment itself is settled; this row tracks the Application/User
 * updates still owed for it until a retry succeeds.
 */
@Entity
@Table(
    name = "cascade_failures",
    indexes = {
        @Index(name = "idx_cascade_failures_open", columnList = "resolved, attempts")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CascadeFailureEntity {

    private static final int MAX_ERROR_LENGTH = 1000;

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "payment_id", nullable = false, updatable = false)
    private UUID paymentId;

    @Column(nullable = false, updatable = false, length = 100)
    private String reference;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, updatable = false, length = 20)
    private PaymentStatus paymentStatus;

    @Column(nullable = false)
    private int attempts;

    @Column(name = "last_error", length = MAX_ERROR_LENGTH)
    private String lastError;

    @Column(nullable = false)
    private boolean resolved;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

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

    static CascadeFailureEntity open(UUID paymentId, String reference, PaymentStatus paymentStatus, String error) {
        CascadeFailureEntity entity = new CascadeFailureEntity();
        entity.id = UUID.randomUUID();
        entity.paymentId = paymentId;
        entity.reference = reference;
        entity.paymentStatus = paymentStatus;
        entity.attempts = 1;
        entity.lastError = truncate(error);
        entity.resolved = false;
        return entity;
    }

    void recordFailedAttempt(String error) {
        this.attempts++;
        this.lastError = truncate(error);
    }

    void markResolved() {
        this.resolved = true;
        this.resolvedAt = Instant.now();
    }

    private static String truncate(String error) {
        if (error == null) {
            return null;
        }
        return error.length() > MAX_ERROR_LENGTH ? error.substring(0, MAX_ERROR_LENGTH) : error;
    }
}
