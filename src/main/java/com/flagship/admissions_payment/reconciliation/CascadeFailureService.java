package com.flagship.admissions_payment.reconciliation;

import com.flagship.admissions_payment.payment.Payment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Bookkeeping for cascades that still have to be applied.
 *
 * Writes run in their own transaction: the failure being recorded usually
 * comes from a transaction that has just rolled back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CascadeFailureService {

    private final CascadeFailureRepository repository;

    /**
     * Records a failed cascade attempt for the payment. A payment has at most
     * one open failure; a repeat bumps its attempt count.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordFailure(Payment payment, Throwable error) {
        String message = describe(error);
        CascadeFailureEntity failure = repository.findFirstByPaymentIdAndResolvedFalse(payment.getId())
                .map(existing -> {
                    existing.recordFailedAttempt(message);
                    return existing;
                })
                .orElseGet(() -> CascadeFailureEntity.open(payment.getId(), payment.getReference(),
                        payment.getStatus(), message));
        repository.save(failure);
        log.warn("Recorded cascade failure for payment {} (attempt {}): {}",
                payment.getReference(), failure.getAttempts(), message);
    }

    @Transactional(readOnly = true)
    public List<CascadeFailureEntity> findRetryable(int maxAttempts, int limit) {
        return repository.findByResolvedFalseAndAttemptsLessThanOrderByCreatedAtAsc(maxAttempts,
                PageRequest.of(0, limit));
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markResolved(UUID failureId) {
        repository.findById(failureId).ifPresent(failure -> {
            failure.markResolved();
            repository.save(failure);
            log.info("Cascade for payment {} completed after {} failed attempt(s)",
                    failure.getReference(), failure.getAttempts());
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int markAttemptFailed(UUID failureId, Throwable error) {
        return repository.findById(failureId).map(failure -> {
            failure.recordFailedAttempt(describe(error));
            repository.save(failure);
            return failure.getAttempts();
        }).orElse(0);
    }

    @Transactional(readOnly = true)
    public long countOpen() {
        return repository.countByResolvedFalse();
    }

    @Transactional(readOnly = true)
    public long countExhausted(int maxAttempts) {
        return repository.countByResolvedFalseAndAttemptsGreaterThanEqual(maxAttempts);
    }

    private static String describe(Throwable error) {
        return error.getClass().getSimpleName() + ": " + error.getMessage();
    }
}
