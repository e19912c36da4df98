package com.flagship.admissions_payment.payment;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flagship.admissions_payment.admission.ApplicationEntity;
import com.flagship.admissions_payment.admission.ApplicationService;
import com.flagship.admissions_payment.gateway.CheckoutRequest;
import com.flagship.admissions_payment.gateway.CheckoutSession;
import com.flagship.admissions_payment.gateway.GatewayException;
import com.flagship.admissions_payment.gateway.GatewayTimestamps;
import com.flagship.admissions_payment.gateway.GatewayVerification;
import com.flagship.admissions_payment.gateway.PaymentGatewayClient;
import com.flagship.admissions_payment.gateway.WebhookSignatureVerifier;
import com.flagship.admissions_payment.observability.CorrelationContext;
import com.flagship.admissions_payment.observability.PaymentMetrics;
import com.flagship.admissions_payment.payment.exception.DuplicateReferenceException;
import com.flagship.admissions_payment.payment.exception.MalformedWebhookException;
import com.flagship.admissions_payment.payment.exception.PaymentNotFoundException;
import com.flagship.admissions_payment.payment.exception.WebhookAuthenticationException;
import com.flagship.admissions_payment.reconciliation.ReconciliationChannel;
import com.flagship.admissions_payment.reconciliation.ReconciliationEngine;
import com.flagship.admissions_payment.reconciliation.ReconciliationResult;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for every payment operation exposed over HTTP.
 *
 * Owns the sequencing around the gateway: database work is committed before
 * a gateway call and resumed after it, never held open across it. Terminal
 * transitions are always delegated to the {@link ReconciliationEngine}.
 */
@Service
@Slf4j
public class PaymentOrchestrator {

    static final String EVENT_CHARGE_SUCCESS = "charge.success";
    static final String EVENT_CHARGE_FAILED = "charge.failed";
    static final String EVENT_CHARGE_CANCELLED = "charge.cancelled";
    static final String EVENT_INVOICE_PAYMENT_FAILED = "invoice.payment_failed";

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final PaymentStore paymentStore;
    private final ApplicationService applicationService;
    private final PaymentGatewayClient gatewayClient;
    private final WebhookSignatureVerifier signatureVerifier;
    private final ReconciliationEngine reconciliationEngine;
    private final WebhookReplayCache replayCache;
    private final PaymentMetrics paymentMetrics;
    private final ObjectMapper objectMapper;
    private final Duration expiryHorizon;
    private final String frontendUrl;

    public PaymentOrchestrator(PaymentStore paymentStore,
                               ApplicationService applicationService,
                               PaymentGatewayClient gatewayClient,
                               WebhookSignatureVerifier signatureVerifier,
                               ReconciliationEngine reconciliationEngine,
                               WebhookReplayCache replayCache,
                               PaymentMetrics paymentMetrics,
                               ObjectMapper objectMapper,
                               @Value("${payment.expiry.horizon:24h}") Duration expiryHorizon,
                               @Value("${payment.frontend-url:http://localhost:3000}") String frontendUrl) {
        this.paymentStore = paymentStore;
        this.applicationService = applicationService;
        this.gatewayClient = gatewayClient;
        this.signatureVerifier = signatureVerifier;
        this.reconciliationEngine = reconciliationEngine;
        this.replayCache = replayCache;
        this.paymentMetrics = paymentMetrics;
        this.objectMapper = objectMapper;
        this.expiryHorizon = expiryHorizon;
        this.frontendUrl = frontendUrl;
    }

    // ==================== Initialize ====================

    /**
     * Opens a checkout for the application.
     *
     * A live pending payment is re-issued instead of creating a second one; an
     * overdue one is expired first. A new payment is committed before the
     * gateway is called and deleted again if the gateway refuses the checkout.
     *
     * @throws com.flagship.admissions_payment.payment.exception.ApplicationNotFoundException if the application does not exist
     * @throws IllegalStateException if the application is already paid for
     * @throws GatewayException if the gateway could not open a checkout
     */
    public PaymentCheckout initialize(InitializePaymentCommand command) {
        long startTime = System.currentTimeMillis();
        String currency = command.getCurrency() != null ? command.getCurrency().name() : "unknown";

        log.info("Received payment initialization: applicationId={}, amount={}, currency={}",
                command.getApplicationId(), command.getAmount(), currency);

        try {
            ApplicationEntity application = applicationService.getPayableApplication(command.getApplicationId());
            String email = hasText(command.getEmail()) ? command.getEmail() : application.getEmail();

            Optional<Payment> pending = paymentStore.findPendingForApplication(application.getId());
            if (pending.isPresent()) {
                Payment existing = pending.get();
                if (existing.isOverdue(Instant.now())) {
                    log.info("Expiring overdue payment {} before opening a new one", existing.getReference());
                    reconciliationEngine.expire(existing.getReference());
                    paymentMetrics.recordExpired("initialize");
                } else {
                    PaymentCheckout checkout = reissue(existing, email);
                    paymentMetrics.recordPaymentInitialized(currency, "reused");
                    return checkout;
                }
            }

            Payment draft = newDraft(command, application);
            Payment opened;
            try {
                opened = paymentStore.openForApplication(draft);
            } catch (DuplicateReferenceException e) {
                log.warn("Placeholder reference {} is taken, retrying with a fresh one", e.getReference());
                draft = newDraft(command, application);
                opened = paymentStore.openForApplication(draft);
            }
            if (!opened.getId().equals(draft.getId())) {
                // a concurrent request opened one first
                PaymentCheckout checkout = reissue(opened, email);
                paymentMetrics.recordPaymentInitialized(currency, "reused");
                return checkout;
            }

            PaymentCheckout checkout = openCheckout(opened, email);
            paymentMetrics.recordPaymentInitialized(currency, "created");
            return checkout;

        } catch (RuntimeException e) {
            paymentMetrics.recordPaymentInitialized(currency, "error");
            log.error("Payment initialization failed: applicationId={}, error={}",
                    command.getApplicationId(), e.getMessage());
            throw e;
        } finally {
            paymentMetrics.recordPaymentLatency("initialize", System.currentTimeMillis() - startTime);
        }
    }

    private PaymentCheckout openCheckout(Payment payment, String email) {
        CheckoutSession session;
        try {
            session = gatewayClient.createCheckout(checkoutRequest(payment, email));
        } catch (GatewayException e) {
            log.warn("Gateway refused checkout for payment {}, rolling back: {}", payment.getReference(), e.getMessage());
            compensate(payment);
            throw e;
        }

        Payment attached;
        try {
            attached = paymentStore.attachCheckout(payment.getId(), session);
        } catch (DuplicateReferenceException e) {
            log.warn("Gateway reference {} collided while attaching payment {}, attaching again",
                    e.getReference(), payment.getId());
            attached = paymentStore.attachCheckout(payment.getId(), session);
        }
        log.info("Payment initialized: paymentId={}, reference={}, applicationId={}",
                attached.getId(), attached.getReference(), attached.getApplicationId());
        return new PaymentCheckout(attached, session.getCheckoutUrl(), session.getAccessCode(), false);
    }

    /**
     * Re-issues a checkout for a live pending payment under its existing
     * reference. If the gateway will not open a new session, the last one
     * recorded for the payment is handed back instead.
     *
     * A payment whose first checkout is still being opened is not re-issued:
     * the request opening it may yet delete it if the gateway refuses.
     *
     * @throws IllegalStateException if the first checkout is not attached yet
     */
    private PaymentCheckout reissue(Payment payment, String email) {
        if (!hasText(payment.getCheckoutUrl()) && !payment.isGatewayReference()) {
            throw new IllegalStateException("A checkout for payment " + payment.getReference()
                    + " is still being opened, try again shortly");
        }
        log.info("Re-issuing checkout for live pending payment {}", payment.getReference());
        try {
            CheckoutSession session = gatewayClient.createCheckout(checkoutRequest(payment, email));
            Payment updated = paymentStore.recordCheckout(payment.getId(), session);
            return new PaymentCheckout(updated, updated.getCheckoutUrl(), updated.getAccessCode(), true);
        } catch (GatewayException e) {
            if (!hasText(payment.getCheckoutUrl())) {
                throw e;
            }
            log.warn("Gateway would not re-issue checkout for {}, returning the recorded session: {}",
                    payment.getReference(), e.getMessage());
            return new PaymentCheckout(payment, payment.getCheckoutUrl(), payment.getAccessCode(), true);
        }
    }

    private void compensate(Payment payment) {
        try {
            paymentStore.delete(payment.getId());
            applicationService.unlinkPayment(payment.getApplicationId(), payment.getId());
        } catch (RuntimeException e) {
            // the pending payment is left behind and will expire on its own
            log.error("Compensation failed for payment {}", payment.getReference(), e);
        }
    }

    private Payment newDraft(InitializePaymentCommand command, ApplicationEntity application) {
        return Payment.create(
                application.getUserId(),
                application.getId(),
                hasText(command.getProgram()) ? command.getProgram() : application.getProgram(),
                hasText(command.getTrack()) ? command.getTrack() : application.getTrack(),
                command.getAmount(),
                command.getCurrency(),
                paymentMetadata(command, application),
                expiryHorizon);
    }

    private CheckoutRequest checkoutRequest(Payment payment, String email) {
        Map<String, Object> metadata = new LinkedHashMap<>(payment.getMetadata());
        metadata.put("paymentId", payment.getId().toString());
        metadata.put("applicationId", payment.getApplicationId().toString());
        if (payment.getProgram() != null) {
            metadata.put("program", payment.getProgram());
        }
        if (payment.getTrack() != null) {
            metadata.put("track", payment.getTrack());
        }
        return new CheckoutRequest(email, payment.getAmount(), payment.getCurrency(), payment.getReference(), metadata);
    }

    private static Map<String, Object> paymentMetadata(InitializePaymentCommand command, ApplicationEntity application) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (command.getMetadata() != null) {
            metadata.putAll(command.getMetadata());
        }
        metadata.put("applicationId", application.getId().toString());
        return metadata;
    }

    // ==================== Verify ====================

    /**
     * Client-initiated confirmation after the gateway redirect.
     *
     * A verified payment is returned as is, without asking the gateway again.
     *
     * @throws PaymentNotFoundException if no payment carries the reference
     * @throws GatewayException if the gateway could not be asked
     */
    public PaymentVerification verify(String reference) {
        if (!hasText(reference)) {
            throw new IllegalArgumentException("Payment reference is required");
        }
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.PAYMENT_REFERENCE_MDC_KEY, reference);
        try {
            Payment payment = paymentStore.getByReference(reference)
                    .orElseThrow(() -> new PaymentNotFoundException(reference));

            if (payment.isVerified()) {
                log.info("Payment already verified: status={}", payment.getStatus());
                return verification(payment);
            }

            GatewayVerification gatewayVerification = gatewayClient.verifyTransaction(reference);

            if (gatewayVerification.decidedOutcome().isEmpty()) {
                log.info("Gateway reports payment still open: gatewayStatus={}", gatewayVerification.getGatewayStatus());
                return verification(expireIfOverdue(payment, "verify"));
            }

            ReconciliationResult result = reconciliationEngine.reconcile(
                    reference,
                    gatewayVerification.getOutcome(),
                    gatewayVerification.getPaidAt(),
                    ReconciliationChannel.VERIFY,
                    gatewayVerification.getRawPayload());

            Payment reconciled = result.isKnown() ? result.getPayment() : payment;
            return verification(reconciled);

        } finally {
            paymentMetrics.recordPaymentLatency("verify", System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.PAYMENT_REFERENCE_MDC_KEY);
        }
    }

    private PaymentVerification verification(Payment payment) {
        String redirectUrl = payment.getStatus() == PaymentStatus.SUCCESS ? frontendUrl + "/dashboard" : null;
        return new PaymentVerification(payment, redirectUrl);
    }

    // ==================== Webhook ====================

    /**
     * Handles a gateway webhook delivery.
     *
     * @param rawBody   request body exactly as received
     * @param signature value of the gateway signature header, may be null
     * @throws WebhookAuthenticationException if the signature does not match
     * @throws MalformedWebhookException if an authenticated body cannot be parsed
     */
    public WebhookResult handleWebhook(byte[] rawBody, String signature) {
        if (!signatureVerifier.authenticate(rawBody, signature)) {
            paymentMetrics.recordWebhook("unknown", "unauthenticated");
            log.warn("Rejected webhook with missing or invalid signature");
            throw new WebhookAuthenticationException("Invalid webhook signature");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(rawBody);
        } catch (IOException e) {
            paymentMetrics.recordWebhook("unknown", "malformed");
            throw new MalformedWebhookException("Webhook body is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            paymentMetrics.recordWebhook("unknown", "malformed");
            throw new MalformedWebhookException("Webhook body is not a JSON object", null);
        }

        String event = root.path("event").asText("");
        Optional<PaymentOutcome> outcome = outcomeForEvent(event);
        if (outcome.isEmpty()) {
            log.info("Ignoring webhook event {}", event);
            paymentMetrics.recordWebhook(event, "ignored");
            return WebhookResult.IGNORED;
        }

        JsonNode data = root.path("data");
        String reference = data.path("reference").asText("");
        if (reference.isBlank()) {
            paymentMetrics.recordWebhook(event, "malformed");
            throw new MalformedWebhookException("Webhook " + event + " carries no reference", null);
        }

        if (replayCache.isSettled(event, reference)) {
            paymentMetrics.recordWebhook(event, "replayed");
            return WebhookResult.REPLAYED;
        }

        Instant paidAt = GatewayTimestamps.parse(firstText(data, "paid_at", "paidAt"));
        ReconciliationResult result = reconciliationEngine.reconcile(
                reference, outcome.get(), paidAt, ReconciliationChannel.WEBHOOK, gatewayData(data));

        if (!result.isKnown()) {
            paymentMetrics.recordWebhook(event, "unknown_reference");
            return WebhookResult.UNKNOWN_REFERENCE;
        }

        replayCache.markSettled(event, reference);
        paymentMetrics.recordWebhook(event, "accepted");
        return WebhookResult.ACCEPTED;
    }

    static Optional<PaymentOutcome> outcomeForEvent(String event) {
        return switch (event) {
            case EVENT_CHARGE_SUCCESS -> Optional.of(PaymentOutcome.SUCCESS);
            case EVENT_CHARGE_FAILED, EVENT_INVOICE_PAYMENT_FAILED -> Optional.of(PaymentOutcome.FAILED);
            case EVENT_CHARGE_CANCELLED -> Optional.of(PaymentOutcome.CANCELLED);
            default -> Optional.empty();
        };
    }

    /**
     * Webhook data as a map. The gateway sometimes sends data.metadata as a
     * JSON encoded string; it is decoded so the stored payload is uniform.
     */
    private Map<String, Object> gatewayData(JsonNode data) {
        if (!data.isObject()) {
            return Map.of();
        }
        ObjectNode copy = ((ObjectNode) data).deepCopy();
        JsonNode metadata = copy.path("metadata");
        if (metadata.isTextual() && !metadata.asText().isBlank()) {
            try {
                copy.set("metadata", objectMapper.readTree(metadata.asText()));
            } catch (IOException e) {
                log.debug("Webhook metadata string is not JSON, keeping it verbatim");
            }
        }
        return objectMapper.convertValue(copy, MAP_TYPE);
    }

    // ==================== Inspect ====================

    /**
     * Owner-scoped lookup. A payment of another user is reported as not found.
     * An overdue pending payment is expired on read.
     */
    public Payment getPayment(UUID paymentId, UUID userId) {
        Payment payment = paymentStore.findById(paymentId)
                .filter(candidate -> candidate.isOwnedBy(userId))
                .orElseThrow(() -> new PaymentNotFoundException(paymentId.toString()));
        return expireIfOverdue(payment, "inspect");
    }

    public List<Payment> findPending(UUID userId) {
        return paymentStore.findPending(userId);
    }

    private Payment expireIfOverdue(Payment payment, String trigger) {
        if (!payment.isOverdue(Instant.now())) {
            return payment;
        }
        ReconciliationResult result = reconciliationEngine.expire(payment.getReference());
        if (result.isApplied()) {
            paymentMetrics.recordExpired(trigger);
        }
        return result.isKnown() ? result.getPayment() : payment;
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.path(field);
            if (!value.isMissingNode() && !value.isNull()) {
                return value.asText();
            }
        }
        return null;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
