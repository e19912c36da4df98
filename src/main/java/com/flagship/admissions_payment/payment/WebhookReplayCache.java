package com.flagship.admissions_payment.payment;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis fast path for repeated webhook deliveries.
 *
 * Gateways retry deliveries until they see a 2xx, so the same event for the
 * same reference commonly arrives several times. Once an event has been
 * reconciled, its key is remembered here and later copies are acknowledged
 * without touching the database.
 *
 * Redis is optional. A miss, a disabled cache or any Redis error falls back
 * to the database guard in the reconciliation engine, which is the source
 * of truth either way.
 */
@Service
@Slf4j
public class WebhookReplayCache {

    private static final String REDIS_KEY_PREFIX = "webhook:";

    private final Optional<StringRedisTemplate> redisTemplate;
    private final boolean enabled;
    private final Duration ttl;

    public WebhookReplayCache(Optional<StringRedisTemplate> redisTemplate,
                              @Value("${payment.webhook.replay-cache.enabled:true}") boolean enabled,
                              @Value("${payment.webhook.replay-cache.ttl:72h}") Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.enabled = enabled;
        this.ttl = ttl;
    }

    public boolean isSettled(String event, String reference) {
        if (!isActive()) {
            return false;
        }
        try {
            Boolean present = redisTemplate.get().hasKey(key(event, reference));
            if (Boolean.TRUE.equals(present)) {
                log.debug("Webhook {} for {} already settled (Redis)", event, reference);
                return true;
            }
        } catch (Exception e) {
            log.warn("Redis lookup failed for webhook {} / {}. Falling back to database. Error: {}",
                    event, reference, e.getMessage());
        }
        return false;
    }

    public void markSettled(String event, String reference) {
        if (!isActive()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(key(event, reference), "1", ttl);
        } catch (Exception e) {
            log.warn("Failed to remember settled webhook {} / {} in Redis: {}", event, reference, e.getMessage());
        }
    }

    private boolean isActive() {
        return enabled && redisTemplate.isPresent();
    }

    private static String key(String event, String reference) {
        return REDIS_KEY_PREFIX + event + ":" + reference;
    }
}
