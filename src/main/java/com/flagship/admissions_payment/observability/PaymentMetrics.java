package com.flagship.admissions_payment.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for the payment lifecycle.
 *
 * Metrics exposed:
 * - payments.initialized: checkout requests by currency and result
 * - payments.reconciliations: outcomes by channel, proposed status and result
 * - payments.reconciliation.late_outcome: outcomes that arrived after a different terminal status
 * - payments.cascade.failures / payments.cascade.retries
 * - payments.webhooks: webhook deliveries by result
 * - payments.gateway.latency: gateway calls by operation and outcome
 * - payments.latency: orchestrator operations
 *
 * Tag values come from enums or fixed strings; free text goes through
 * {@link #sanitizeTag} to keep cardinality bounded.
 */
@Component
public class PaymentMetrics {

    private final MeterRegistry registry;

    public PaymentMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPaymentInitialized(String currency, String result) {
        registry.counter("payments.initialized",
                "currency", sanitizeTag(currency),
                "result", sanitizeTag(result)
        ).increment();
    }

    /**
     * @param result applied, already_settled or unknown_reference
     */
    public void recordReconciliation(String channel, String outcome, String result) {
        registry.counter("payments.reconciliations",
                "channel", sanitizeTag(channel),
                "outcome", sanitizeTag(outcome),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordLateOutcome(String channel, String settledStatus, String proposedStatus) {
        registry.counter("payments.reconciliation.late_outcome",
                "channel", sanitizeTag(channel),
                "settled", sanitizeTag(settledStatus),
                "proposed", sanitizeTag(proposedStatus)
        ).increment();
    }

    public void recordCascadeFailure(String paymentStatus) {
        registry.counter("payments.cascade.failures",
                "status", sanitizeTag(paymentStatus)
        ).increment();
    }

    public void recordCascadeRetry(String result) {
        registry.counter("payments.cascade.retries",
                "result", sanitizeTag(result)
        ).increment();
    }

    /**
     * @param result accepted, ignored, replayed, unauthenticated or malformed
     */
    public void recordWebhook(String eventType, String result) {
        registry.counter("payments.webhooks",
                "event", sanitizeTag(eventType),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordExpired(String trigger) {
        registry.counter("payments.expired",
                "trigger", sanitizeTag(trigger)
        ).increment();
    }

    public void recordGatewayCall(String operation, String outcome, long durationMs) {
        registry.timer("payments.gateway.latency",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordPaymentLatency(String operation, long durationMs) {
        registry.timer("payments.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    static String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
