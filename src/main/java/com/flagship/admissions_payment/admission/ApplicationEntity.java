package com.flagship.admissions_payment.admission;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA Entity for an admission application, reduced to what the payment
 * lifecycle reads and writes.
 *
 * No setters: state changes go through the narrow mutators below, which are
 * only called by {@link ApplicationService}.
 */
@Entity
@Table(
    name = "applications",
    indexes = {
        @Index(name = "idx_applications_user", columnList = "user_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ApplicationEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(nullable = false)
    private String email;

    @Column(length = 100)
    private String program;

    @Column(length = 100)
    private String track;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ApplicationStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private ApplicationPaymentStatus paymentStatus;

    @Column(name = "payment_id")
    private UUID paymentId;

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
     * Creates a submitted application awaiting payment.
     */
    public static ApplicationEntity submit(UUID userId, String email, String program, String track) {
        if (userId == null) {
            throw new IllegalArgumentException("User is required");
        }
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("Email is required");
        }
        ApplicationEntity entity = new ApplicationEntity();
        entity.id = UUID.randomUUID();
        entity.userId = userId;
        entity.email = email;
        entity.program = program;
        entity.track = track;
        entity.status = ApplicationStatus.PENDING;
        entity.paymentStatus = ApplicationPaymentStatus.PENDING;
        return entity;
    }

    public boolean isPaid() {
        return paymentStatus == ApplicationPaymentStatus.PAID;
    }

    public boolean isCurrentPayment(UUID candidatePaymentId) {
        return paymentId != null && paymentId.equals(candidatePaymentId);
    }

    /**
     * Points the application at a new current payment. The payment status is
     * left as it was until a checkout is opened for the payment.
     */
    void linkPayment(UUID newPaymentId) {
        if (isPaid()) {
            throw new IllegalStateException("Application " + id + " has already been paid for");
        }
        this.paymentId = newPaymentId;
    }

    /**
     * The current payment has a checkout the applicant can pay at.
     */
    void markAwaitingPayment() {
        if (isPaid()) {
            throw new IllegalStateException("Application " + id + " has already been paid for");
        }
        this.paymentStatus = ApplicationPaymentStatus.PENDING;
    }

    void unlinkPayment() {
        this.paymentId = null;
    }

    void markEnrolled(UUID paidPaymentId) {
        this.paymentId = paidPaymentId;
        this.status = ApplicationStatus.ENROLLED;
        this.paymentStatus = ApplicationPaymentStatus.PAID;
    }

    void markPaymentStatus(ApplicationPaymentStatus newPaymentStatus) {
        if (newPaymentStatus == ApplicationPaymentStatus.PAID) {
            throw new IllegalArgumentException("PAID is only set together with enrollment");
        }
        this.paymentStatus = newPaymentStatus;
    }
}
