package com.flagship.admissions_payment.gateway;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

import static org.junit.jupiter.api.Assertions.*;

class WebhookSignatureVerifierTest {

    private static final String SECRET = "sk_test_webhook_secret";
    private static final byte[] BODY =
            "{\"event\":\"charge.success\",\"data\":{\"reference\":\"PAY-1\"}}".getBytes(StandardCharsets.UTF_8);

    private static String hmacSha512Hex(String secret, byte[] body) throws Exception {
        Mac mac = Mac.getInstance("HmacSHA512");
        mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA512"));
        return HexFormat.of().formatHex(mac.doFinal(body));
    }

    @Test
    @DisplayName("Accepts the HMAC-SHA512 of the raw body")
    void acceptsValidSignature() throws Exception {
        WebhookSignatureVerifier verifier = new WebhookSignatureVerifier(SECRET, false);

        assertTrue(verifier.authenticate(BODY, hmacSha512Hex(SECRET, BODY)));
    }

    @Test
    @DisplayName("Signature hex case does not matter")
    void acceptsUpperCaseHex() throws Exception {
        WebhookSignatureVerifier verifier = new WebhookSignatureVerifier(SECRET, false);

        assertTrue(verifier.authenticate(BODY, hmacSha512Hex(SECRET, BODY).toUpperCase()));
    }

    @Test
    @DisplayName("Rejects a signature made with another secret")
    void rejectsWrongSecret() throws Exception {
        WebhookSignatureVerifier verifier = new WebhookSignatureVerifier(SECRET, false);

        assertFalse(verifier.authenticate(BODY, hmacSha512Hex("another_secret", BODY)));
    }

    @Test
    @DisplayName("Rejects a body altered after signing, even by whitespace")
    void rejectsAlteredBody() throws Exception {
        WebhookSignatureVerifier verifier = new WebhookSignatureVerifier(SECRET, false);
        String signature = hmacSha512Hex(SECRET, BODY);
        byte[] reformatted = "{\"event\": \"charge.success\",\"data\":{\"reference\":\"PAY-1\"}}"
                .getBytes(StandardCharsets.UTF_8);

        assertFalse(verifier.authenticate(reformatted, signature));
    }

    @Test
    @DisplayName("Rejects a missing or blank signature")
    void rejectsMissingSignature() {
        WebhookSignatureVerifier verifier = new WebhookSignatureVerifier(SECRET, false);

        assertFalse(verifier.authenticate(BODY, null));
        assertFalse(verifier.authenticate(BODY, "  "));
    }

    @Test
    @DisplayName("Fails closed when no secret is configured")
    void failsClosedWithoutSecret() throws Exception {
        WebhookSignatureVerifier verifier = new WebhookSignatureVerifier("", false);

        assertFalse(verifier.authenticate(BODY, hmacSha512Hex(SECRET, BODY)));
        assertFalse(verifier.authenticate(BODY, null));
    }

    @Test
    @DisplayName("Unsigned deliveries are accepted only with the explicit opt-in")
    void allowUnsignedOptIn() {
        WebhookSignatureVerifier verifier = new WebhookSignatureVerifier("", true);

        assertTrue(verifier.authenticate(BODY, null));
    }

    @Test
    @DisplayName("The opt-in is ignored once a secret is configured")
    void optInIgnoredWithSecret() {
        WebhookSignatureVerifier verifier = new WebhookSignatureVerifier(SECRET, true);

        assertFalse(verifier.authenticate(BODY, null));
        assertFalse(verifier.authenticate(BODY, "deadbeef"));
    }
}
