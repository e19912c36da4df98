package com.flagship.admissions_payment.reconciliation;

import com.flagship.admissions_payment.observability.CorrelationContext;
import com.flagship.admissions_payment.observability.PaymentMetrics;
import com.flagship.admissions_payment.payment.Payment;
import com.flagship.admissions_payment.payment.PaymentOutcome;
import com.flagship.admissions_payment.payment.PaymentStatus;
import com.flagship.admissions_payment.payment.PaymentStore;
import com.flagship.admissions_payment.payment.PaymentTransition;
import com.flagship.admissions_payment.payment.exception.TransitionConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * The single authority for terminal payment transitions.
 *
 * Verify, webhook and expiry all end up here. Whichever caller wins the
 * conditional update performs the cascade; every other caller, concurrent or
 * late, observes the settled payment and changes nothing.
 *
 * Key principles:
 * - One terminal transition per reference, decided by the database
 * - Losing a race is a normal result, never an error
 * - The payment commits before the cascade runs; a failed cascade is
 *   recorded for retry and never undoes the payment
 *
 * Not transactional itself: each step runs in its own transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationEngine {

    private final PaymentStore paymentStore;
    private final EnrollmentCascade enrollmentCascade;
    private final CascadeFailureService cascadeFailureService;
    private final PaymentMetrics paymentMetrics;

    /**
     * Applies a decided gateway outcome to the payment carrying the reference.
     *
     * @param reference   payment reference as known to the gateway
     * @param outcome     decided outcome
     * @param paidAt      gateway payment time, only used for SUCCESS (defaults to now)
     * @param channel     path the outcome arrived through
     * @param gatewayData gateway payload, merged into the payment's metadata
     */
    public ReconciliationResult reconcile(String reference, PaymentOutcome outcome, Instant paidAt,
                                          ReconciliationChannel channel, Map<String, Object> gatewayData) {
        if (outcome == null) {
            throw new IllegalArgumentException("Only decided outcomes can be reconciled");
        }
        MDC.put(CorrelationContext.PAYMENT_REFERENCE_MDC_KEY, reference);
        try {
            Optional<Payment> current = paymentStore.getByReference(reference);
            if (current.isEmpty()) {
                log.warn("Dropping {} outcome {} for unknown payment reference", channel, outcome);
                paymentMetrics.recordReconciliation(channel.tagValue(), outcome.name(), "unknown_reference");
                return ReconciliationResult.unknown(reference);
            }

            Payment payment = current.get();
            if (payment.isVerified()) {
                return settled(payment, outcome.getTerminalStatus(), channel);
            }

            PaymentTransition transition = outcome.isSuccess()
                    ? PaymentTransition.succeed(paidAt, channel.getMetadataKey(), gatewayData)
                    : PaymentTransition.fail(outcome.getTerminalStatus(), channel.getMetadataKey(), gatewayData);

            return transition(reference, transition, channel);
        } finally {
            MDC.remove(CorrelationContext.PAYMENT_REFERENCE_MDC_KEY);
        }
    }

    /**
     * Expires a pending payment observed past its horizon.
     * A payment that was settled in the meantime is returned unchanged.
     */
    public ReconciliationResult expire(String reference) {
        MDC.put(CorrelationContext.PAYMENT_REFERENCE_MDC_KEY, reference);
        try {
            Optional<Payment> current = paymentStore.getByReference(reference);
            if (current.isEmpty()) {
                log.warn("Cannot expire unknown payment reference");
                return ReconciliationResult.unknown(reference);
            }
            if (current.get().isVerified()) {
                return settled(current.get(), PaymentStatus.EXPIRED, ReconciliationChannel.EXPIRY);
            }
            return transition(reference, PaymentTransition.expire(), ReconciliationChannel.EXPIRY);
        } finally {
            MDC.remove(CorrelationContext.PAYMENT_REFERENCE_MDC_KEY);
        }
    }

    /**
     * Re-runs the cascade for a payment that is already terminal.
     * Used by the cascade retry job; exceptions propagate to the caller.
     */
    public void replayCascade(Payment payment) {
        if (!payment.isTerminal()) {
            throw new IllegalStateException("Payment " + payment.getReference() + " is not terminal");
        }
        enrollmentCascade.apply(payment);
    }

    private ReconciliationResult transition(String reference, PaymentTransition transition,
                                            ReconciliationChannel channel) {
        String outcomeTag = transition.getTargetStatus().name();
        Payment transitioned;
        try {
            transitioned = paymentStore.compareAndTransition(reference, PaymentStatus.PENDING, transition);
        } catch (TransitionConflictException e) {
            Payment winner = paymentStore.getByReference(reference)
                    .orElseThrow(() -> new IllegalStateException("Payment vanished during reconciliation: " + reference));
            log.info("Lost {} race, payment already {}", channel, winner.getStatus());
            return settled(winner, transition.getTargetStatus(), channel);
        }

        paymentMetrics.recordReconciliation(channel.tagValue(), outcomeTag, "applied");
        log.info("Payment reconciled via {}: status={}, applicationId={}",
                channel, transitioned.getStatus(), transitioned.getApplicationId());

        runCascade(transitioned);
        return ReconciliationResult.applied(transitioned);
    }

    private ReconciliationResult settled(Payment payment, PaymentStatus proposedStatus, ReconciliationChannel channel) {
        paymentMetrics.recordReconciliation(channel.tagValue(), proposedStatus.name(), "already_settled");
        if (payment.getStatus() != proposedStatus && channel != ReconciliationChannel.EXPIRY) {
            // e.g. a gateway success arriving for a payment that already expired
            log.warn("Late {} outcome {} for payment already {}; not applied, needs manual review",
                    channel, proposedStatus, payment.getStatus());
            paymentMetrics.recordLateOutcome(channel.tagValue(), payment.getStatus().name(), proposedStatus.name());
        } else {
            log.debug("Payment already {}, nothing to do", payment.getStatus());
        }
        return ReconciliationResult.alreadySettled(payment);
    }

    private void runCascade(Payment payment) {
        try {
            enrollmentCascade.apply(payment);
        } catch (RuntimeException e) {
            log.error("Cascade failed for payment {} ({}), queued for retry",
                    payment.getReference(), payment.getStatus(), e);
            paymentMetrics.recordCascadeFailure(payment.getStatus().name());
            recordCascadeFailure(payment, e);
        }
    }

    private void recordCascadeFailure(Payment payment, RuntimeException cause) {
        try {
            cascadeFailureService.recordFailure(payment, cause);
        } catch (RuntimeException e) {
            log.error("Could not record cascade failure for payment {}; the cascade must be replayed by hand",
                    payment.getReference(), e);
        }
    }
}
