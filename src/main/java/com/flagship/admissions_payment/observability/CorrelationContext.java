package com.flagship.admissions_payment.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Correlation ID handling on top of the logging MDC.
 *
 * An HTTP request keeps the ID its caller sent; webhook deliveries and
 * scheduled runs get a fresh one. While a payment is being worked on its
 * reference is also in the MDC, so every line about it can be grepped.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String PAYMENT_REFERENCE_MDC_KEY = "paymentReference";

    private CorrelationContext() {
    }

    /**
     * Starts a unit of work on the current thread.
     *
     * @param incomingId ID received from the caller, may be null or blank
     * @return the ID in effect
     */
    public static String begin(String incomingId) {
        String correlationId = incomingId == null || incomingId.isBlank()
                ? generateCorrelationId()
                : incomingId;
        MDC.put(CORRELATION_ID_MDC_KEY, correlationId);
        return correlationId;
    }

    /**
     * Ends the unit of work started by {@link #begin(String)}.
     */
    public static void end() {
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(PAYMENT_REFERENCE_MDC_KEY);
    }

    /**
     * Short format for readability in logs.
     */
    static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
