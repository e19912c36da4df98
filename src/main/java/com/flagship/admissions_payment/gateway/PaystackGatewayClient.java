package com.flagship.admissions_payment.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.admissions_payment.observability.PaymentMetrics;
import com.flagship.admissions_payment.payment.PaymentOutcome;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Paystack implementation of {@link PaymentGatewayClient}.
 *
 * Endpoints used:
 * - POST /transaction/initialize
 * - GET  /transaction/verify/{reference}
 *
 * Both calls go through the "paymentGateway" circuit breaker. Only
 * verification is retried; checkout creation creates remote state and is
 * attempted once.
 */
@Component
@Slf4j
public class PaystackGatewayClient implements PaymentGatewayClient {

    static final String GATEWAY_NAME = "paystack";

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final CircuitBreaker circuitBreaker;
    private final Retry verifyRetry;
    private final PaymentMetrics paymentMetrics;
    private final String secretKey;
    private final String callbackUrl;

    public PaystackGatewayClient(@Qualifier("gatewayRestTemplate") RestTemplate restTemplate,
                                 ObjectMapper objectMapper,
                                 @Qualifier("gatewayCircuitBreaker") CircuitBreaker circuitBreaker,
                                 @Qualifier("gatewayVerifyRetry") Retry verifyRetry,
                                 PaymentMetrics paymentMetrics,
                                 @Value("${payment.gateway.secret-key:}") String secretKey,
                                 @Value("${payment.frontend-url:http://localhost:3000}") String callbackUrl) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.circuitBreaker = circuitBreaker;
        this.verifyRetry = verifyRetry;
        this.paymentMetrics = paymentMetrics;
        this.secretKey = secretKey;
        this.callbackUrl = callbackUrl;
    }

    @Override
    public CheckoutSession createCheckout(CheckoutRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("email", request.getEmail());
        body.put("amount", request.getAmount());
        body.put("currency", request.getCurrency().name());
        body.put("reference", request.getReference());
        // the gateway expects metadata as a JSON string
        body.put("metadata", writeJson(request.getMetadata(), request.getReference()));
        body.put("callback_url", callbackUrl);

        JsonNode data = timed("initialize", () -> guarded(() ->
                exchange(HttpMethod.POST, "/transaction/initialize", body, request.getReference())));

        String reference = text(data, "reference");
        String checkoutUrl = text(data, "authorization_url");
        if (reference == null || checkoutUrl == null) {
            throw new GatewayException("Gateway checkout response is missing reference or authorization_url",
                    GATEWAY_NAME, request.getReference(), false);
        }

        log.info("Opened checkout session: reference={}, amount={}, currency={}",
                reference, request.getAmount(), request.getCurrency());

        return new CheckoutSession(checkoutUrl, reference, text(data, "access_code"));
    }

    @Override
    public GatewayVerification verifyTransaction(String reference) {
        JsonNode data = timed("verify", () -> Retry.decorateSupplier(verifyRetry, () -> guarded(() ->
                exchange(HttpMethod.GET, "/transaction/verify/{reference}", null, reference))).get());

        String gatewayStatus = text(data, "status");
        PaymentOutcome outcome = mapStatus(gatewayStatus);
        Instant paidAt = GatewayTimestamps.parse(text(data, "paid_at"));
        if (paidAt == null) {
            paidAt = GatewayTimestamps.parse(text(data, "paidAt"));
        }

        log.info("Verified transaction: reference={}, gatewayStatus={}, outcome={}",
                reference, gatewayStatus, outcome);

        return new GatewayVerification(reference, gatewayStatus, outcome, paidAt,
                objectMapper.convertValue(data, MAP_TYPE));
    }

    @Override
    public String getGatewayName() {
        return GATEWAY_NAME;
    }

    /**
     * Maps the gateway's transaction status onto a decided outcome.
     * Open states map to null. Paystack reports "abandoned" for a checkout the
     * payer has not finished yet, so it stays open until the expiry horizon.
     */
    static PaymentOutcome mapStatus(String gatewayStatus) {
        if (gatewayStatus == null) {
            return null;
        }
        return switch (gatewayStatus.toLowerCase(Locale.ROOT)) {
            case "success" -> PaymentOutcome.SUCCESS;
            case "failed", "reversed" -> PaymentOutcome.FAILED;
            case "cancelled" -> PaymentOutcome.CANCELLED;
            default -> null; // abandoned, ongoing, pending, processing, queued
        };
    }

    private JsonNode exchange(HttpMethod method, String path, Object body, String reference) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(secretKey);
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(java.util.List.of(MediaType.APPLICATION_JSON));

        ResponseEntity<JsonNode> response;
        try {
            response = restTemplate.exchange(path, method, new HttpEntity<>(body, headers), JsonNode.class, reference);
        } catch (HttpStatusCodeException e) {
            boolean retryable = e.getStatusCode().is5xxServerError()
                    || e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value();
            throw new GatewayException(
                    String.format("Gateway returned %s: %s", e.getStatusCode().value(), gatewayMessage(e)),
                    GATEWAY_NAME, reference, retryable, e);
        } catch (ResourceAccessException e) {
            throw new GatewayException("Gateway unreachable or timed out: " + e.getMessage(),
                    GATEWAY_NAME, reference, true, e);
        } catch (RestClientException e) {
            throw new GatewayException("Gateway call failed: " + e.getMessage(),
                    GATEWAY_NAME, reference, true, e);
        }

        JsonNode envelope = response.getBody();
        if (envelope == null || !envelope.path("status").asBoolean(false)) {
            String message = envelope == null ? "empty response" : envelope.path("message").asText("request rejected");
            throw new GatewayException("Gateway rejected request: " + message, GATEWAY_NAME, reference, false);
        }
        return envelope.path("data");
    }

    private JsonNode guarded(Supplier<JsonNode> call) {
        try {
            return circuitBreaker.executeSupplier(call);
        } catch (CallNotPermittedException e) {
            throw new GatewayException("Gateway circuit is open, failing fast", GATEWAY_NAME, null, true, e);
        }
    }

    private <T> T timed(String operation, Supplier<T> call) {
        long startTime = System.currentTimeMillis();
        try {
            T result = call.get();
            paymentMetrics.recordGatewayCall(operation, "success", System.currentTimeMillis() - startTime);
            return result;
        } catch (GatewayException e) {
            paymentMetrics.recordGatewayCall(operation, e.isRetryable() ? "transient_error" : "rejected",
                    System.currentTimeMillis() - startTime);
            throw e;
        }
    }

    private String gatewayMessage(HttpStatusCodeException e) {
        try {
            JsonNode body = objectMapper.readTree(e.getResponseBodyAsString());
            return body.path("message").asText(e.getStatusText());
        } catch (JsonProcessingException parseFailure) {
            return e.getStatusText();
        }
    }

    private String writeJson(Map<String, Object> metadata, String reference) {
        try {
            return objectMapper.writeValueAsString(metadata == null ? Map.of() : metadata);
        } catch (JsonProcessingException e) {
            throw new GatewayException("Checkout metadata is not serializable", GATEWAY_NAME, reference, false, e);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? null : value.asText();
    }
}
