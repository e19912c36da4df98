package com.flagship.admissions_payment.payment;

import com.flagship.admissions_payment.admission.ApplicationEntity;
import com.flagship.admissions_payment.admission.ApplicationService;
import com.flagship.admissions_payment.gateway.CheckoutSession;
import com.flagship.admissions_payment.outbox.OutboxService;
import com.flagship.admissions_payment.payment.event.PaymentEvent;
import com.flagship.admissions_payment.payment.event.PaymentExpiredEvent;
import com.flagship.admissions_payment.payment.event.PaymentFailedEvent;
import com.flagship.admissions_payment.payment.event.PaymentInitializedEvent;
import com.flagship.admissions_payment.payment.event.PaymentSucceededEvent;
import com.flagship.admissions_payment.payment.exception.DuplicateReferenceException;
import com.flagship.admissions_payment.payment.exception.PaymentNotFoundException;
import com.flagship.admissions_payment.payment.exception.TransitionConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable store of payments, keyed by reference.
 *
 * Bridges the domain layer (Payment) and the persistence layer
 * (PaymentEntity). Status, verified and paidAt are only ever written by
 * {@link #compareAndTransition}; every other write leaves them alone.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentStore {

    private final PaymentRepository paymentRepository;
    private final ApplicationService applicationService;
    private final OutboxService outboxService;

    /**
     * Persists a new payment.
     *
     * @throws DuplicateReferenceException if the reference is taken
     */
    @Transactional
    public Payment create(Payment payment) {
        if (paymentRepository.existsByReference(payment.getReference())) {
            throw new DuplicateReferenceException(payment.getReference(), null);
        }
        try {
            PaymentEntity saved = paymentRepository.saveAndFlush(PaymentEntity.fromDomain(payment));
            log.debug("Saved payment {} with reference {}", saved.getId(), saved.getReference());
            return saved.toDomain();
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateReferenceException(payment.getReference(), e);
        }
    }

    /**
     * Creates the payment and makes it the application's current payment, under
     * the application's row lock.
     *
     * If a concurrent request already opened a live pending payment for the
     * application, that payment is returned instead and nothing is written.
     * Callers compare the returned id with the draft's to tell the two apart.
     *
     * @throws IllegalStateException if the application is already paid for
     */
    @Transactional
    public Payment openForApplication(Payment draft) {
        ApplicationEntity application = applicationService.lockPayableApplication(draft.getApplicationId());

        Optional<Payment> live = paymentRepository
                .findFirstByApplicationIdAndStatusOrderByCreatedAtDesc(draft.getApplicationId(), PaymentStatus.PENDING)
                .map(PaymentEntity::toDomain)
                .filter(existing -> !existing.isOverdue(Instant.now()));
        if (live.isPresent()) {
            log.info("Application {} already has live pending payment {}, not opening another",
                    draft.getApplicationId(), live.get().getReference());
            return live.get();
        }

        Payment created = create(draft);
        applicationService.linkPayment(application, created.getId());
        return created;
    }

    @Transactional(readOnly = true)
    public Optional<Payment> getByReference(String reference) {
        return paymentRepository.findByReference(reference).map(PaymentEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Payment> findById(UUID paymentId) {
        return paymentRepository.findById(paymentId).map(PaymentEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Payment> findPendingForApplication(UUID applicationId) {
        return paymentRepository
                .findFirstByApplicationIdAndStatusOrderByCreatedAtDesc(applicationId, PaymentStatus.PENDING)
                .map(PaymentEntity::toDomain);
    }

    /**
     * Pending payments of the user that are still inside their horizon.
     */
    @Transactional(readOnly = true)
    public List<Payment> findPending(UUID userId) {
        return paymentRepository.findLivePendingByUser(userId, Instant.now())
                .stream()
                .map(PaymentEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<Payment> findOverdue(Instant now, int limit) {
        return paymentRepository.findOverdue(now, PageRequest.of(0, limit))
                .stream()
                .map(PaymentEntity::toDomain)
                .toList();
    }

    /**
     * Moves the payment from expectedStatus to the transition's terminal status
     * and marks it verified, in one conditional update.
     *
     * In the same transaction the transition's metadata is merged and the
     * lifecycle event is written to the outbox, so both exist only if the
     * transition committed.
     *
     * @throws TransitionConflictException if the payment was no longer in
     *         expectedStatus or was already verified
     */
    @Transactional
    public Payment compareAndTransition(String reference, PaymentStatus expectedStatus, PaymentTransition transition) {
        int updated = paymentRepository.transitionIfUnverified(
                reference,
                expectedStatus,
                transition.getTargetStatus(),
                transition.getPaidAt(),
                Instant.now());

        if (updated == 0) {
            throw new TransitionConflictException(reference, expectedStatus);
        }

        PaymentEntity entity = paymentRepository.findByReference(reference)
                .orElseThrow(() -> new IllegalStateException("Payment vanished after transition: " + reference));
        entity.mergeMetadata(transition.getMetadata());
        Payment payment = paymentRepository.save(entity).toDomain();

        outboxService.savePaymentEvent(lifecycleEvent(payment));

        log.info("Payment {} transitioned {} -> {}", reference, expectedStatus, payment.getStatus());
        return payment;
    }

    /**
     * Records the checkout session opened for a newly created payment: the
     * gateway's canonical reference replaces the placeholder and the
     * PaymentInitialized event is written.
     *
     * A canonical reference that already belongs to another payment is not
     * adopted; the payment keeps its placeholder.
     *
     * @throws DuplicateReferenceException if another payment took the
     *         canonical reference concurrently; calling again resolves it
     */
    @Transactional
    public Payment attachCheckout(UUID paymentId, CheckoutSession session) {
        PaymentEntity entity = paymentRepository.findByIdForUpdate(paymentId)
                .orElseThrow(() -> new PaymentNotFoundException(paymentId.toString()));

        String canonicalReference = session.getReference();
        if (!entity.getReference().equals(canonicalReference)
                && paymentRepository.existsByReference(canonicalReference)) {
            log.error("Gateway reference {} for payment {} already belongs to another payment, keeping {}",
                    canonicalReference, paymentId, entity.getReference());
        } else {
            entity.assignGatewayReference(canonicalReference);
        }
        entity.recordCheckout(session.getCheckoutUrl(), session.getAccessCode());

        Payment payment;
        try {
            payment = paymentRepository.saveAndFlush(entity).toDomain();
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateReferenceException(canonicalReference, e);
        }

        applicationService.markAwaitingPayment(payment.getApplicationId(), payment.getId());
        outboxService.savePaymentEvent(PaymentInitializedEvent.fromPayment(payment));

        log.debug("Attached checkout to payment {}: reference={}", paymentId, payment.getReference());
        return payment;
    }

    /**
     * Records a re-issued checkout session for an existing payment. A session
     * carrying a different reference is not recorded; the payment keeps the
     * reference it already has.
     */
    @Transactional
    public Payment recordCheckout(UUID paymentId, CheckoutSession session) {
        PaymentEntity entity = paymentRepository.findByIdForUpdate(paymentId)
                .orElseThrow(() -> new PaymentNotFoundException(paymentId.toString()));

        if (!entity.getReference().equals(session.getReference())) {
            log.warn("Re-issued checkout for payment {} came back with reference {}, keeping {}",
                    paymentId, session.getReference(), entity.getReference());
            return entity.toDomain();
        }

        entity.recordCheckout(session.getCheckoutUrl(), session.getAccessCode());
        return paymentRepository.save(entity).toDomain();
    }

    /**
     * Removes a payment whose checkout could never be opened. Compensation only:
     * a payment that reached the gateway or was handed out with a checkout is
     * never deleted. The row lock orders this against {@link #recordCheckout}.
     */
    @Transactional
    public void delete(UUID paymentId) {
        paymentRepository.findByIdForUpdate(paymentId).ifPresent(entity -> {
            if (entity.isVerified() || entity.isGatewayReference() || entity.getCheckoutUrl() != null) {
                throw new IllegalStateException("Refusing to delete payment " + paymentId
                        + " that is verified, known to the gateway or has an issued checkout");
            }
            paymentRepository.delete(entity);
            log.info("Deleted payment {} ({})", paymentId, entity.getReference());
        });
    }

    private static PaymentEvent lifecycleEvent(Payment payment) {
        return switch (payment.getStatus()) {
            case SUCCESS -> PaymentSucceededEvent.fromPayment(payment);
            case FAILED, CANCELLED -> PaymentFailedEvent.fromPayment(payment);
            case EXPIRED -> PaymentExpiredEvent.fromPayment(payment);
            case PENDING -> throw new IllegalStateException("No lifecycle event for PENDING payment " + payment.getReference());
        };
    }
}
