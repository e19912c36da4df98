package com.flagship.admissions_payment.payment;

import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutation applied by {@link PaymentStore#compareAndTransition}.
 *
 * A transition always targets a terminal status and always marks the payment
 * verified. paidAt is only carried for SUCCESS.
 */
@Value
public class PaymentTransition {
    PaymentStatus targetStatus;
    Instant paidAt;
    Map<String, Object> metadata;

    public static PaymentTransition succeed(Instant paidAt, String metadataKey, Object gatewayData) {
        return new PaymentTransition(PaymentStatus.SUCCESS,
            paidAt != null ? paidAt : Instant.now(),
            metadataEntry(metadataKey, gatewayData));
    }

    public static PaymentTransition fail(PaymentStatus failureStatus, String metadataKey, Object gatewayData) {
        if (failureStatus != PaymentStatus.FAILED && failureStatus != PaymentStatus.CANCELLED) {
            throw new IllegalArgumentException("Failure transition must target FAILED or CANCELLED, got " + failureStatus);
        }
        return new PaymentTransition(failureStatus, null, metadataEntry(metadataKey, gatewayData));
    }

    public static PaymentTransition expire() {
        return new PaymentTransition(PaymentStatus.EXPIRED, null, Collections.emptyMap());
    }

    private static Map<String, Object> metadataEntry(String key, Object value) {
        if (key == null || value == null) {
            return Collections.emptyMap();
        }
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put(key, value);
        return entry;
    }
}
