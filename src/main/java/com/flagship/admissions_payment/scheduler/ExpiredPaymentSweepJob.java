package com.flagship.admissions_payment.scheduler;

import com.flagship.admissions_payment.observability.CorrelationContext;
import com.flagship.admissions_payment.observability.PaymentMetrics;
import com.flagship.admissions_payment.payment.Payment;
import com.flagship.admissions_payment.payment.PaymentStore;
import com.flagship.admissions_payment.reconciliation.ReconciliationEngine;
import com.flagship.admissions_payment.reconciliation.ReconciliationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Expires pending payments past their horizon without waiting for someone
 * to look at them. Off by default: lazy expiry on access already keeps
 * every read path correct, the sweep only tidies up abandoned payments.
 */
@Component
@ConditionalOnProperty(name = "payment.expiry.sweep.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class ExpiredPaymentSweepJob {

    private final PaymentStore paymentStore;
    private final ReconciliationEngine reconciliationEngine;
    private final PaymentMetrics paymentMetrics;

    @Value("${payment.expiry.sweep.batch-size:100}")
    private int batchSize;

    @Scheduled(fixedDelayString = "${payment.expiry.sweep.interval-ms:300000}")
    public void sweep() {
        CorrelationContext.begin(null);
        try {
            List<Payment> overdue = paymentStore.findOverdue(Instant.now(), batchSize);
            if (overdue.isEmpty()) {
                return;
            }

            int expired = 0;
            for (Payment payment : overdue) {
                if (expire(payment)) {
                    expired++;
                }
            }
            log.info("Expiry sweep: {} of {} overdue payments expired", expired, overdue.size());

        } catch (Exception e) {
            log.error("Error in expiry sweep", e);
        } finally {
            CorrelationContext.end();
        }
    }

    private boolean expire(Payment payment) {
        try {
            ReconciliationResult result = reconciliationEngine.expire(payment.getReference());
            if (result.isApplied()) {
                paymentMetrics.recordExpired("sweep");
                return true;
            }
        } catch (RuntimeException e) {
            log.warn("Could not expire payment {}: {}", payment.getReference(), e.getMessage());
        }
        return false;
    }
}
