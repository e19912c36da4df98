package com.flagship.admissions_payment.config;

import com.flagship.admissions_payment.gateway.GatewayException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Resilience4j policies for the payment gateway.
 *
 * The circuit breaker guards every gateway call and only counts transient
 * failures; a request the gateway rejected says nothing about its health.
 *
 * The retry policy is applied to verification only. Checkout creation opens
 * a session on the gateway side and is never repeated automatically.
 */
@Configuration
@Slf4j
public class ResilienceConfig {

    public static final String GATEWAY_CIRCUIT_BREAKER = "paymentGateway";
    public static final String GATEWAY_VERIFY_RETRY = "gatewayVerify";

    @Value("${payment.gateway.verify.max-attempts:3}")
    private int verifyMaxAttempts;

    @Value("${payment.gateway.verify.retry-wait:500ms}")
    private Duration verifyRetryWait;

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowSize(10)
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .permittedNumberOfCallsInHalfOpenState(3)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .recordException(ResilienceConfig::isTransientGatewayFailure)
                .build();

        return CircuitBreakerRegistry.of(config);
    }

    @Bean
    public CircuitBreaker gatewayCircuitBreaker(CircuitBreakerRegistry registry) {
        CircuitBreaker circuitBreaker = registry.circuitBreaker(GATEWAY_CIRCUIT_BREAKER);
        circuitBreaker.getEventPublisher().onStateTransition(event ->
                log.warn("Gateway circuit breaker transition: {}", event.getStateTransition()));
        return circuitBreaker;
    }

    @Bean
    public RetryRegistry retryRegistry() {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, verifyMaxAttempts))
                .waitDuration(verifyRetryWait)
                // an open circuit fails fast; retrying it only adds latency
                .retryOnException(e -> isTransientGatewayFailure(e)
                        && !(e.getCause() instanceof CallNotPermittedException))
                .build();

        return RetryRegistry.of(config);
    }

    @Bean
    public Retry gatewayVerifyRetry(RetryRegistry registry) {
        Retry retry = registry.retry(GATEWAY_VERIFY_RETRY);
        retry.getEventPublisher().onRetry(event ->
                log.info("Retrying gateway verification (attempt {}): {}",
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        return retry;
    }

    static boolean isTransientGatewayFailure(Throwable e) {
        return !(e instanceof GatewayException) || ((GatewayException) e).isRetryable();
    }
}
