package com.flagship.admissions_payment.gateway;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Authenticates gateway webhook deliveries.
 *
 * The signature header carries the hex encoded HMAC-SHA512 of the raw request
 * body, keyed with the webhook secret. The body must be the exact bytes that
 * arrived on the wire; re-serialized JSON will not match.
 *
 * Without a configured secret every delivery is rejected, unless
 * payment.gateway.webhook.allow-unsigned is set for sandbox use.
 */
@Component
@Slf4j
public class WebhookSignatureVerifier {

    private static final String ALGORITHM = "HmacSHA512";

    private final String webhookSecret;
    private final boolean allowUnsigned;

    public WebhookSignatureVerifier(@Value("${payment.gateway.webhook.secret:}") String webhookSecret,
                                    @Value("${payment.gateway.webhook.allow-unsigned:false}") boolean allowUnsigned) {
        this.webhookSecret = webhookSecret;
        this.allowUnsigned = allowUnsigned;
        if (allowUnsigned) {
            log.warn("Unsigned webhooks are accepted when no webhook secret is configured. Never enable this in production.");
        }
    }

    public boolean authenticate(byte[] rawBody, String signature) {
        if (webhookSecret == null || webhookSecret.isBlank()) {
            if (allowUnsigned) {
                log.warn("Accepting webhook without signature check: no webhook secret configured");
                return true;
            }
            log.error("Rejecting webhook: no webhook secret configured");
            return false;
        }
        if (rawBody == null || signature == null || signature.isBlank()) {
            return false;
        }

        byte[] expected = sign(rawBody).getBytes(StandardCharsets.US_ASCII);
        byte[] presented = signature.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, presented);
    }

    /**
     * Hex encoded HMAC-SHA512 of the payload under the configured secret.
     */
    String sign(byte[] payload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(webhookSecret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(payload));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("Unable to compute webhook signature", e);
        }
    }
}
