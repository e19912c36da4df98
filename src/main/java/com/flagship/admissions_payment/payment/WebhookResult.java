package com.flagship.admissions_payment.payment;

/**
 * How an authenticated webhook delivery was handled. Every value is
 * acknowledged to the gateway with 200.
 */
public enum WebhookResult {
    /** Dispatched to the reconciliation engine for a known payment. */
    ACCEPTED,
    /** Event type this service does not act on. */
    IGNORED,
    /** Same event already settled, answered from the replay cache. */
    REPLAYED,
    /** No payment carries the reference; logged and dropped. */
    UNKNOWN_REFERENCE
}
