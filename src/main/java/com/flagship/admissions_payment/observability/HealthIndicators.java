package com.flagship.admissions_payment.observability;

import com.flagship.admissions_payment.outbox.OutboxEventRepository;
import com.flagship.admissions_payment.reconciliation.CascadeFailureService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Custom health indicators for the admissions payment service.
 */
public class HealthIndicators {

    /**
     * Unhealthy if too many lifecycle events are waiting to be published.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Reports cascades that are still owed. Exhausted ones (no more automatic
     * retries) need an operator and turn the indicator to WARNING.
     */
    @Component("cascadeHealth")
    public static class CascadeHealthIndicator implements HealthIndicator {

        private final CascadeFailureService cascadeFailureService;
        private final int maxAttempts;

        public CascadeHealthIndicator(CascadeFailureService cascadeFailureService,
                                      @Value("${payment.cascade.retry.max-attempts:5}") int maxAttempts) {
            this.cascadeFailureService = cascadeFailureService;
            this.maxAttempts = maxAttempts;
        }

        @Override
        public Health health() {
            try {
                long open = cascadeFailureService.countOpen();
                long exhausted = cascadeFailureService.countExhausted(maxAttempts);

                Health.Builder builder = exhausted == 0 ? Health.up() : Health.status("WARNING");
                return builder
                        .withDetail("openCascadeFailures", open)
                        .withDetail("exhaustedCascadeFailures", exhausted)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Redis only backs the webhook replay cache; without it the database
     * guard still holds, so failures report DEGRADED rather than DOWN.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private static final String FALLBACK_NOTE = "Webhooks fall back to the database guard without Redis";

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                var connectionFactory = redisTemplate.getConnectionFactory();
                if (connectionFactory == null) {
                    return Health.status("DEGRADED")
                            .withDetail("error", "No connection factory configured")
                            .withDetail("note", FALLBACK_NOTE)
                            .build();
                }

                try (var connection = connectionFactory.getConnection()) {
                    String result = connection.ping();
                    if ("PONG".equals(result)) {
                        return Health.up()
                                .withDetail("response", result)
                                .build();
                    }
                    return Health.down()
                            .withDetail("response", result != null ? result : "null")
                            .build();
                }

            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
        }
    }
}
