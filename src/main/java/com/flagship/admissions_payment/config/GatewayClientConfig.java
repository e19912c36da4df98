package com.flagship.admissions_payment.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP client for the payment gateway.
 *
 * Every gateway call has a bounded connect and read timeout, so a hung
 * gateway surfaces as a retryable GatewayException instead of a stuck
 * request thread.
 */
@Configuration
public class GatewayClientConfig {

    @Value("${payment.gateway.base-url:https://api.paystack.co}")
    private String baseUrl;

    @Value("${payment.gateway.connect-timeout:5s}")
    private Duration connectTimeout;

    @Value("${payment.gateway.read-timeout:15s}")
    private Duration readTimeout;

    @Bean
    public RestTemplate gatewayRestTemplate(RestTemplateBuilder builder) {
        return builder
                .rootUri(baseUrl)
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .build();
    }
}
