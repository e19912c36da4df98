package com.flagship.admissions_payment.payment.dto;

import lombok.Value;

/**
 * Acknowledgement returned to the gateway for every authenticated delivery.
 */
@Value
public class WebhookAck {
    boolean received;

    public static WebhookAck received() {
        return new WebhookAck(true);
    }
}
