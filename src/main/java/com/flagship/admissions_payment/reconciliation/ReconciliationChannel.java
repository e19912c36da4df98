package com.flagship.admissions_payment.reconciliation;

import java.util.Locale;

/**
 * Path through which an outcome reached the engine.
 * Decided outcomes keep the gateway's payload under the channel's metadata key.
 */
public enum ReconciliationChannel {
    VERIFY("gatewayVerification"),
    WEBHOOK("gatewayWebhook"),
    EXPIRY(null);

    private final String metadataKey;

    ReconciliationChannel(String metadataKey) {
        this.metadataKey = metadataKey;
    }

    public String getMetadataKey() {
        return metadataKey;
    }

    public String tagValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
