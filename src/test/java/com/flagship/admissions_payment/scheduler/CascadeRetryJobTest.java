package com.flagship.admissions_payment.scheduler;

import com.flagship.admissions_payment.observability.PaymentMetrics;
import com.flagship.admissions_payment.payment.Payment;
import com.flagship.admissions_payment.payment.PaymentFixtures;
import com.flagship.admissions_payment.payment.PaymentStatus;
import com.flagship.admissions_payment.payment.PaymentStore;
import com.flagship.admissions_payment.reconciliation.CascadeFailureEntity;
import com.flagship.admissions_payment.reconciliation.CascadeFailureService;
import com.flagship.admissions_payment.reconciliation.ReconciliationEngine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CascadeRetryJobTest {

    @Mock
    private CascadeFailureService cascadeFailureService;

    @Mock
    private PaymentStore paymentStore;

    @Mock
    private ReconciliationEngine reconciliationEngine;

    private SimpleMeterRegistry meterRegistry;
    private CascadeRetryJob job;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        job = new CascadeRetryJob(cascadeFailureService, paymentStore, reconciliationEngine,
                new PaymentMetrics(meterRegistry));
        ReflectionTestUtils.setField(job, "maxAttempts", 5);
        ReflectionTestUtils.setField(job, "batchSize", 50);
    }

    private CascadeFailureEntity failureFor(UUID failureId, Payment payment) {
        CascadeFailureEntity failure = mock(CascadeFailureEntity.class);
        lenient().when(failure.getId()).thenReturn(failureId);
        lenient().when(failure.getPaymentId()).thenReturn(payment.getId());
        lenient().when(failure.getReference()).thenReturn(payment.getReference());
        return failure;
    }

    @Test
    @DisplayName("A successful replay resolves the failure")
    void resolvesOnSuccessfulReplay() {
        Payment succeeded = PaymentFixtures.settled(PaymentFixtures.pending("PAY-1"), PaymentStatus.SUCCESS);
        UUID failureId = UUID.randomUUID();
        CascadeFailureEntity failure = failureFor(failureId, succeeded);
        when(cascadeFailureService.findRetryable(5, 50)).thenReturn(List.of(failure));
        when(paymentStore.findById(succeeded.getId())).thenReturn(Optional.of(succeeded));

        job.retryFailedCascades();

        verify(reconciliationEngine).replayCascade(succeeded);
        verify(cascadeFailureService).markResolved(failureId);
        verify(cascadeFailureService, never()).markAttemptFailed(any(), any());
        assertEquals(1.0, meterRegistry.get("payments.cascade.retries").tags("result", "resolved").counter().count());
    }

    @Test
    @DisplayName("A failed replay counts an attempt and moves on to the next failure")
    void countsFailedAttempt() {
        Payment first = PaymentFixtures.settled(PaymentFixtures.pending("PAY-1"), PaymentStatus.FAILED);
        Payment second = PaymentFixtures.settled(PaymentFixtures.pending("PAY-2"), PaymentStatus.SUCCESS);
        UUID firstFailureId = UUID.randomUUID();
        UUID secondFailureId = UUID.randomUUID();
        CascadeFailureEntity firstFailure = failureFor(firstFailureId, first);
        CascadeFailureEntity secondFailure = failureFor(secondFailureId, second);
        RuntimeException boom = new IllegalStateException("still down");
        when(cascadeFailureService.findRetryable(5, 50)).thenReturn(List.of(firstFailure, secondFailure));
        when(paymentStore.findById(first.getId())).thenReturn(Optional.of(first));
        when(paymentStore.findById(second.getId())).thenReturn(Optional.of(second));
        doThrow(boom).when(reconciliationEngine).replayCascade(first);
        when(cascadeFailureService.markAttemptFailed(firstFailureId, boom)).thenReturn(5);

        job.retryFailedCascades();

        verify(cascadeFailureService, never()).markResolved(firstFailureId);
        verify(cascadeFailureService).markResolved(secondFailureId);
        assertEquals(1.0, meterRegistry.get("payments.cascade.retries").tags("result", "failed").counter().count());
    }

    @Test
    @DisplayName("A failure whose payment is gone is counted as a failed attempt")
    void missingPayment() {
        Payment ghost = PaymentFixtures.settled(PaymentFixtures.pending("PAY-GONE"), PaymentStatus.SUCCESS);
        UUID failureId = UUID.randomUUID();
        CascadeFailureEntity failure = failureFor(failureId, ghost);
        when(cascadeFailureService.findRetryable(5, 50)).thenReturn(List.of(failure));
        when(paymentStore.findById(ghost.getId())).thenReturn(Optional.empty());

        job.retryFailedCascades();

        verify(cascadeFailureService).markAttemptFailed(eq(failureId), any(IllegalStateException.class));
        verifyNoInteractions(reconciliationEngine);
    }

    @Test
    @DisplayName("Errors loading the batch do not escape the scheduler thread")
    void loopErrorsAreContained() {
        when(cascadeFailureService.findRetryable(5, 50)).thenThrow(new IllegalStateException("db down"));

        assertDoesNotThrow(() -> job.retryFailedCascades());
        verifyNoInteractions(reconciliationEngine);
    }
}
