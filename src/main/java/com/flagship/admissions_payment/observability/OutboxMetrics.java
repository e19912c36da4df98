package com.flagship.admissions_payment.observability;

import com.flagship.admissions_payment.outbox.OutboxEventRepository;
import com.flagship.admissions_payment.payment.event.PaymentExpiredEvent;
import com.flagship.admissions_payment.payment.event.PaymentFailedEvent;
import com.flagship.admissions_payment.payment.event.PaymentInitializedEvent;
import com.flagship.admissions_payment.payment.event.PaymentSucceededEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outbox metrics, broken down by payment lifecycle event.
 *
 * A stuck PaymentSucceeded means downstream systems have not heard about an
 * enrollment, so the backlog is reported per event type rather than as one
 * number. Gauges read cached values refreshed by {@link MetricsScheduler}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    static final List<String> LIFECYCLE_EVENT_TYPES = List.of(
            PaymentInitializedEvent.EVENT_TYPE,
            PaymentSucceededEvent.EVENT_TYPE,
            PaymentFailedEvent.EVENT_TYPE,
            PaymentFailedEvent.CANCELLED_EVENT_TYPE,
            PaymentExpiredEvent.EVENT_TYPE);

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    private final Map<String, AtomicLong> backlogByEventType = new LinkedHashMap<>();
    private final AtomicLong oldestEventAgeSeconds = new AtomicLong(0);
    private final AtomicLong deadLetteredCount = new AtomicLong(0);

    @PostConstruct
    public void init() {
        for (String eventType : LIFECYCLE_EVENT_TYPES) {
            AtomicLong backlog = new AtomicLong(0);
            backlogByEventType.put(eventType, backlog);
            Gauge.builder("outbox.backlog.size", backlog, AtomicLong::get)
                    .description("Unpublished payment lifecycle events")
                    .tag("event_type", eventType)
                    .register(meterRegistry);
        }

        Gauge.builder("outbox.backlog.age.seconds", oldestEventAgeSeconds, AtomicLong::get)
                .description("Seconds the oldest unpublished event has been waiting")
                .register(meterRegistry);

        Gauge.builder("outbox.events.dead_lettered.current", deadLetteredCount, AtomicLong::get)
                .description("Events left unpublished after exhausting their retries")
                .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            Map<String, Long> counts = new LinkedHashMap<>();
            for (OutboxEventRepository.EventTypeCount row : outboxRepository.countUnpublishedByEventType()) {
                if (!backlogByEventType.containsKey(row.getEventType())) {
                    log.warn("Unpublished outbox events of unexpected type {}: {}", row.getEventType(), row.getTotal());
                    continue;
                }
                counts.put(row.getEventType(), row.getTotal());
            }
            Instant oldest = outboxRepository.findOldestUnpublishedCreatedAt().orElse(null);
            long deadLettered = outboxRepository.countDeadLettered(maxRetries);

            backlogByEventType.forEach((eventType, backlog) -> backlog.set(counts.getOrDefault(eventType, 0L)));
            oldestEventAgeSeconds.set(oldest == null
                    ? 0
                    : Math.max(0, Duration.between(oldest, Instant.now()).getSeconds()));
            deadLetteredCount.set(deadLettered);

            log.debug("Outbox metrics refreshed: backlog={}, oldestAge={}s, deadLettered={}",
                    backlogByEventType, oldestEventAgeSeconds.get(), deadLetteredCount.get());

        } catch (Exception e) {
            log.warn("Failed to refresh outbox metrics, keeping last values: {}", e.getMessage());
        }
    }

    public void recordEventPublished(String eventType) {
        publishCounter(eventType, "success").increment();
    }

    public void recordEventPublishFailed(String eventType) {
        publishCounter(eventType, "failure").increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("outbox.events.dead_lettered", "event_type", eventType).increment();
    }

    private Counter publishCounter(String eventType, String result) {
        return meterRegistry.counter("outbox.events.published", "event_type", eventType, "result", result);
    }
}
