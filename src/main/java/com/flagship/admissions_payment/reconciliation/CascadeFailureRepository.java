package com.flagship.admissions_payment.reconciliation;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CascadeFailureRepository extends JpaRepository<CascadeFailureEntity, UUID> {

    List<CascadeFailureEntity> findByResolvedFalseAndAttemptsLessThanOrderByCreatedAtAsc(int maxAttempts,
                                                                                       Pageable page);

    Optional<CascadeFailureEntity> findFirstByPaymentIdAndResolvedFalse(UUID paymentId);

    long countByResolvedFalse();

    long countByResolvedFalseAndAttemptsGreaterThanEqual(int maxAttempts);
}
