package com.flagship.admissions_payment.payment;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for Payment persistence.
 */
@Repository
public interface PaymentRepository extends JpaRepository<PaymentEntity, UUID> {

    Optional<PaymentEntity> findByReference(String reference);

    /**
     * Loads the payment with a row lock held until the surrounding transaction
     * ends. Serializes checkout recording against compensation.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PaymentEntity p WHERE p.id = :id")
    Optional<PaymentEntity> findByIdForUpdate(@Param("id") UUID id);

    boolean existsByReference(String reference);

    Optional<PaymentEntity> findFirstByApplicationIdAndStatusOrderByCreatedAtDesc(UUID applicationId,
                                                                                PaymentStatus status);

    /**
     * The compare-and-transition primitive.
     *
     * Applies the terminal status only while the row is still in the expected
     * status and unverified. Concurrent callers block on the row lock; the
     * loser re-evaluates the predicate after the winner commits and updates
     * zero rows.
     *
     * @return number of rows updated (0 or 1)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE PaymentEntity p
        SET p.status = :target,
            p.verified = true,
            p.paidAt = :paidAt,
            p.updatedAt = :now
        WHERE p.reference = :reference
        AND p.status = :expected
        AND p.verified = false
        """)
    int transitionIfUnverified(@Param("reference") String reference,
                               @Param("expected") PaymentStatus expected,
                               @Param("target") PaymentStatus target,
                               @Param("paidAt") Instant paidAt,
                               @Param("now") Instant now);

    /**
     * Pending payments still inside their horizon, for display.
     */
    @Query("""
        SELECT p FROM PaymentEntity p
        WHERE p.userId = :userId
        AND p.status = com.flagship.admissions_payment.payment.PaymentStatus.PENDING
        AND p.expiresAt > :now
        ORDER BY p.createdAt DESC
        """)
    List<PaymentEntity> findLivePendingByUser(@Param("userId") UUID userId, @Param("now") Instant now);

    /**
     * Pending payments past their horizon, oldest first. Used by the expiry sweep.
     */
    @Query("""
        SELECT p FROM PaymentEntity p
        WHERE p.status = com.flagship.admissions_payment.payment.PaymentStatus.PENDING
        AND p.verified = false
        AND p.expiresAt <= :now
        ORDER BY p.expiresAt ASC
        """)
    List<PaymentEntity> findOverdue(@Param("now") Instant now, Pageable page);

    long countByStatus(PaymentStatus status);
}
