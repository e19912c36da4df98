package com.flagship.admissions_payment.payment;

import com.flagship.admissions_payment.admission.ApplicationService;
import com.flagship.admissions_payment.gateway.CheckoutSession;
import com.flagship.admissions_payment.outbox.OutboxService;
import com.flagship.admissions_payment.payment.event.PaymentInitializedEvent;
import com.flagship.admissions_payment.payment.exception.DuplicateReferenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PaymentStoreTest {

    @Mock
    private PaymentRepository paymentRepository;

    @Mock
    private ApplicationService applicationService;

    @Mock
    private OutboxService outboxService;

    private PaymentStore paymentStore;
    private PaymentEntity entity;

    @BeforeEach
    void setUp() {
        paymentStore = new PaymentStore(paymentRepository, applicationService, outboxService);
        entity = PaymentEntity.fromDomain(Payment.create(UUID.randomUUID(), UUID.randomUUID(),
                "Software Engineering", "Backend", 2_500_000L, CurrencyCode.NGN,
                Map.of("cohort", "2025"), Duration.ofHours(24)));
    }

    private void lockReturns(PaymentEntity payment) {
        when(paymentRepository.findByIdForUpdate(payment.getId())).thenReturn(Optional.of(payment));
    }

    @Test
    @DisplayName("A payment handed out with a re-issued checkout survives compensation")
    void deleteRefusesIssuedCheckout() {
        String placeholder = entity.getReference();
        lockReturns(entity);
        when(paymentRepository.save(entity)).thenReturn(entity);

        paymentStore.recordCheckout(entity.getId(),
                new CheckoutSession("https://checkout.test/xyz", placeholder, "xyz"));

        assertThrows(IllegalStateException.class, () -> paymentStore.delete(entity.getId()));
        verify(paymentRepository, never()).delete(any(PaymentEntity.class));
        assertEquals("https://checkout.test/xyz", entity.getCheckoutUrl());
    }

    @Test
    @DisplayName("A payment that never got a checkout is deleted")
    void deleteRemovesUnissuedPayment() {
        lockReturns(entity);

        paymentStore.delete(entity.getId());

        verify(paymentRepository).delete(entity);
    }

    @Test
    @DisplayName("Attaching adopts the gateway reference and puts the application back to awaiting payment")
    void attachAdoptsGatewayReference() {
        lockReturns(entity);
        when(paymentRepository.existsByReference("GW-REF")).thenReturn(false);
        when(paymentRepository.saveAndFlush(entity)).thenReturn(entity);

        Payment attached = paymentStore.attachCheckout(entity.getId(),
                new CheckoutSession("https://checkout.test/abc", "GW-REF", "abc"));

        assertEquals("GW-REF", attached.getReference());
        assertTrue(attached.isGatewayReference());
        assertEquals("https://checkout.test/abc", attached.getCheckoutUrl());
        verify(applicationService).markAwaitingPayment(entity.getApplicationId(), entity.getId());
        verify(outboxService).savePaymentEvent(any(PaymentInitializedEvent.class));
    }

    @Test
    @DisplayName("A gateway reference owned by another payment is not adopted")
    void attachKeepsPlaceholderOnTakenReference() {
        String placeholder = entity.getReference();
        lockReturns(entity);
        when(paymentRepository.existsByReference("GW-TAKEN")).thenReturn(true);
        when(paymentRepository.saveAndFlush(entity)).thenReturn(entity);

        Payment attached = paymentStore.attachCheckout(entity.getId(),
                new CheckoutSession("https://checkout.test/abc", "GW-TAKEN", "abc"));

        assertEquals(placeholder, attached.getReference());
        assertFalse(attached.isGatewayReference());
        assertEquals("https://checkout.test/abc", attached.getCheckoutUrl());
    }

    @Test
    @DisplayName("A reference taken concurrently surfaces as a duplicate reference, with nothing published")
    void attachTranslatesConstraintViolation() {
        lockReturns(entity);
        when(paymentRepository.existsByReference("GW-REF")).thenReturn(false);
        when(paymentRepository.saveAndFlush(entity))
                .thenThrow(new DataIntegrityViolationException("uq_payments_reference"));

        DuplicateReferenceException e = assertThrows(DuplicateReferenceException.class,
                () -> paymentStore.attachCheckout(entity.getId(),
                        new CheckoutSession("https://checkout.test/abc", "GW-REF", "abc")));

        assertEquals("GW-REF", e.getReference());
        verifyNoInteractions(outboxService, applicationService);
    }

    @Test
    @DisplayName("Creating a payment with a taken reference is refused")
    void createRefusesTakenReference() {
        Payment payment = entity.toDomain();
        when(paymentRepository.existsByReference(payment.getReference())).thenReturn(true);

        assertThrows(DuplicateReferenceException.class, () -> paymentStore.create(payment));
        verify(paymentRepository, never()).saveAndFlush(any());
    }
}
