package com.flagship.admissions_payment.observability;

import com.flagship.admissions_payment.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OutboxMetricsTest {

    @Mock
    private OutboxEventRepository outboxRepository;

    private SimpleMeterRegistry meterRegistry;
    private OutboxMetrics metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new OutboxMetrics(outboxRepository, meterRegistry);
        ReflectionTestUtils.setField(metrics, "maxRetries", 5);
        metrics.init();
    }

    @Test
    @DisplayName("Backlog is reported per lifecycle event type")
    void reportsBacklogPerEventType() {
        when(outboxRepository.countUnpublishedByEventType()).thenReturn(List.of(
                row("PaymentSucceeded", 3L),
                row("PaymentExpired", 1L)));
        when(outboxRepository.findOldestUnpublishedCreatedAt())
                .thenReturn(Optional.of(Instant.now().minusSeconds(120)));
        when(outboxRepository.countDeadLettered(5)).thenReturn(2L);

        metrics.refreshMetrics();

        assertEquals(3.0, backlog("PaymentSucceeded"));
        assertEquals(1.0, backlog("PaymentExpired"));
        assertEquals(0.0, backlog("PaymentInitialized"));
        assertTrue(meterRegistry.get("outbox.backlog.age.seconds").gauge().value() >= 120.0);
        assertEquals(2.0, meterRegistry.get("outbox.events.dead_lettered.current").gauge().value());
    }

    @Test
    @DisplayName("A drained event type drops back to zero on the next refresh")
    void drainedTypeResetsToZero() {
        when(outboxRepository.countUnpublishedByEventType())
                .thenReturn(List.of(row("PaymentFailed", 4L)))
                .thenReturn(List.of());
        when(outboxRepository.findOldestUnpublishedCreatedAt())
                .thenReturn(Optional.of(Instant.now()))
                .thenReturn(Optional.empty());
        when(outboxRepository.countDeadLettered(5)).thenReturn(0L);

        metrics.refreshMetrics();
        assertEquals(4.0, backlog("PaymentFailed"));

        metrics.refreshMetrics();
        assertEquals(0.0, backlog("PaymentFailed"));
        assertEquals(0.0, meterRegistry.get("outbox.backlog.age.seconds").gauge().value());
    }

    @Test
    @DisplayName("A failed refresh keeps the last reported values")
    void failedRefreshKeepsLastValues() {
        when(outboxRepository.countUnpublishedByEventType())
                .thenReturn(List.of(row("PaymentCancelled", 7L)))
                .thenThrow(new IllegalStateException("connection refused"));
        when(outboxRepository.findOldestUnpublishedCreatedAt()).thenReturn(Optional.empty());
        when(outboxRepository.countDeadLettered(5)).thenReturn(1L);

        metrics.refreshMetrics();
        assertDoesNotThrow(() -> metrics.refreshMetrics());

        assertEquals(7.0, backlog("PaymentCancelled"));
        assertEquals(1.0, meterRegistry.get("outbox.events.dead_lettered.current").gauge().value());
    }

    @Test
    @DisplayName("Publish outcomes are counted by event type and result")
    void countsPublishOutcomes() {
        metrics.recordEventPublished("PaymentSucceeded");
        metrics.recordEventPublished("PaymentSucceeded");
        metrics.recordEventPublishFailed("PaymentSucceeded");
        metrics.recordEventDeadLettered("PaymentExpired");

        assertEquals(2.0, meterRegistry.get("outbox.events.published")
                .tags("event_type", "PaymentSucceeded", "result", "success").counter().count());
        assertEquals(1.0, meterRegistry.get("outbox.events.published")
                .tags("event_type", "PaymentSucceeded", "result", "failure").counter().count());
        assertEquals(1.0, meterRegistry.get("outbox.events.dead_lettered")
                .tags("event_type", "PaymentExpired").counter().count());
    }

    private double backlog(String eventType) {
        return meterRegistry.get("outbox.backlog.size").tags("event_type", eventType).gauge().value();
    }

    private static OutboxEventRepository.EventTypeCount row(String eventType, long total) {
        return new OutboxEventRepository.EventTypeCount() {
            @Override
            public String getEventType() {
                return eventType;
            }

            @Override
            public Long getTotal() {
                return total;
            }
        };
    }
}
