package com.flagship.admissions_payment.scheduler;

import com.flagship.admissions_payment.observability.CorrelationContext;
import com.flagship.admissions_payment.observability.PaymentMetrics;
import com.flagship.admissions_payment.payment.Payment;
import com.flagship.admissions_payment.payment.PaymentStore;
import com.flagship.admissions_payment.reconciliation.CascadeFailureEntity;
import com.flagship.admissions_payment.reconciliation.CascadeFailureService;
import com.flagship.admissions_payment.reconciliation.ReconciliationEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Replays cascades that failed after their payment settled.
 *
 * The cascade is idempotent, so replaying one that partially applied is
 * safe. A failure that reaches max-attempts is left open for an operator
 * and shows up in the cascade health indicator.
 */
@Component
@ConditionalOnProperty(name = "payment.cascade.retry.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class CascadeRetryJob {

    private final CascadeFailureService cascadeFailureService;
    private final PaymentStore paymentStore;
    private final ReconciliationEngine reconciliationEngine;
    private final PaymentMetrics paymentMetrics;

    @Value("${payment.cascade.retry.max-attempts:5}")
    private int maxAttempts;

    @Value("${payment.cascade.retry.batch-size:50}")
    private int batchSize;

    @Scheduled(fixedDelayString = "${payment.cascade.retry.interval-ms:60000}")
    public void retryFailedCascades() {
        CorrelationContext.begin(null);
        try {
            List<CascadeFailureEntity> failures = cascadeFailureService.findRetryable(maxAttempts, batchSize);
            for (CascadeFailureEntity failure : failures) {
                retry(failure);
            }
        } catch (Exception e) {
            log.error("Error in cascade retry loop", e);
        } finally {
            CorrelationContext.end();
        }
    }

    private void retry(CascadeFailureEntity failure) {
        Optional<Payment> payment = paymentStore.findById(failure.getPaymentId());
        if (payment.isEmpty()) {
            log.error("Cascade failure {} refers to missing payment {}", failure.getId(), failure.getReference());
            cascadeFailureService.markAttemptFailed(failure.getId(),
                    new IllegalStateException("Payment not found: " + failure.getReference()));
            paymentMetrics.recordCascadeRetry("failed");
            return;
        }

        try {
            reconciliationEngine.replayCascade(payment.get());
            cascadeFailureService.markResolved(failure.getId());
            paymentMetrics.recordCascadeRetry("resolved");
        } catch (RuntimeException e) {
            int attempts = cascadeFailureService.markAttemptFailed(failure.getId(), e);
            paymentMetrics.recordCascadeRetry("failed");
            if (attempts >= maxAttempts) {
                log.error("Cascade for payment {} exhausted {} attempts, needs manual repair",
                        failure.getReference(), attempts, e);
            } else {
                log.warn("Cascade retry for payment {} failed (attempt {}): {}",
                        failure.getReference(), attempts, e.getMessage());
            }
        }
    }
}
