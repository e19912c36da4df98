package com.flagship.admissions_payment.payment;

import com.flagship.admissions_payment.payment.dto.CheckoutResponse;
import com.flagship.admissions_payment.payment.dto.InitializePaymentRequest;
import com.flagship.admissions_payment.payment.dto.PaymentResponse;
import com.flagship.admissions_payment.payment.dto.VerifyPaymentResponse;
import com.flagship.admissions_payment.payment.dto.WebhookAck;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * REST Controller for admission payments.
 *
 * X-User-Id is set by the upstream authentication layer.
 * The webhook endpoint takes the body as raw bytes: the signature is computed
 * over exactly what the gateway sent.
 */
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Slf4j
public class PaymentController {

    static final String USER_ID_HEADER = "X-User-Id";
    static final String SIGNATURE_HEADER = "x-paystack-signature";

    private final PaymentOrchestrator orchestrator;

    @PostMapping("/initialize")
    public ResponseEntity<CheckoutResponse> initialize(@Valid @RequestBody InitializePaymentRequest request) {
        InitializePaymentCommand command = new InitializePaymentCommand(
            request.getApplicationId(),
            request.getAmount(),
            parseCurrency(request.getCurrency()),
            request.getEmail(),
            request.getProgram(),
            request.getTrack(),
            request.getMetadata());

        return ResponseEntity.ok(CheckoutResponse.from(orchestrator.initialize(command)));
    }

    /**
     * 200 for a successful or still pending payment, 400 with the same body
     * shape when the payment ended unsuccessfully.
     */
    @GetMapping("/verify")
    public ResponseEntity<VerifyPaymentResponse> verify(@RequestParam("reference") String reference) {
        PaymentVerification verification = orchestrator.verify(reference);
        VerifyPaymentResponse body = VerifyPaymentResponse.from(verification);

        if (verification.isSuccessful() || verification.isPending()) {
            return ResponseEntity.ok(body);
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @PostMapping("/webhook")
    public ResponseEntity<WebhookAck> webhook(
            @RequestBody byte[] rawBody,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature) {

        WebhookResult result = orchestrator.handleWebhook(rawBody, signature);
        log.debug("Webhook handled: {}", result);
        return ResponseEntity.ok(WebhookAck.received());
    }

    @GetMapping("/pending")
    public ResponseEntity<List<PaymentResponse>> pending(@RequestHeader(USER_ID_HEADER) UUID userId) {
        List<PaymentResponse> payments = orchestrator.findPending(userId)
            .stream()
            .map(PaymentResponse::from)
            .toList();
        return ResponseEntity.ok(payments);
    }

    @GetMapping("/{paymentId}")
    public ResponseEntity<PaymentResponse> getPayment(
            @PathVariable("paymentId") UUID paymentId,
            @RequestHeader(USER_ID_HEADER) UUID userId) {
        return ResponseEntity.ok(PaymentResponse.from(orchestrator.getPayment(paymentId, userId)));
    }

    private static CurrencyCode parseCurrency(String currency) {
        if (currency == null || currency.isBlank()) {
            return CurrencyCode.NGN;
        }
        try {
            return CurrencyCode.valueOf(currency.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported currency: " + currency);
        }
    }
}
