package com.flagship.admissions_payment.gateway;

import com.flagship.admissions_payment.payment.PaymentOutcome;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Result of {@link PaymentGatewayClient#verifyTransaction}.
 *
 * outcome is null while the gateway still considers the transaction open
 * (ongoing, pending, queued...).
 */
@Value
public class GatewayVerification {
    String reference;
    String gatewayStatus;
    PaymentOutcome outcome;
    Instant paidAt;
    Map<String, Object> rawPayload;

    public Optional<PaymentOutcome> decidedOutcome() {
        return Optional.ofNullable(outcome);
    }
}
