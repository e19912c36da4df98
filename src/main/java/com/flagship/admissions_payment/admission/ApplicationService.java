package com.flagship.admissions_payment.admission;

import com.flagship.admissions_payment.payment.exception.ApplicationNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Narrow write operations on applications used by the payment lifecycle.
 *
 * Every cascade method takes the row lock first, so a success cascade and a
 * failure or expiry cascade for the same application never interleave.
 * The cascade methods return whether they changed anything.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ApplicationService {

    private final ApplicationRepository applicationRepository;

    @Transactional(readOnly = true)
    public ApplicationEntity getApplication(UUID applicationId) {
        return applicationRepository.findById(applicationId)
                .orElseThrow(() -> new ApplicationNotFoundException(applicationId));
    }

    /**
     * Loads an application that a new payment may be opened for.
     *
     * @throws ApplicationNotFoundException if the application does not exist
     * @throws IllegalStateException if the application is already paid for
     */
    @Transactional(readOnly = true)
    public ApplicationEntity getPayableApplication(UUID applicationId) {
        ApplicationEntity application = getApplication(applicationId);
        requireUnpaid(application);
        return application;
    }

    /**
     * Locks the application for the rest of the caller's transaction and
     * re-checks that it is still unpaid.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public ApplicationEntity lockPayableApplication(UUID applicationId) {
        ApplicationEntity application = applicationRepository.findByIdForUpdate(applicationId)
                .orElseThrow(() -> new ApplicationNotFoundException(applicationId));
        requireUnpaid(application);
        return application;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void linkPayment(ApplicationEntity application, UUID paymentId) {
        application.linkPayment(paymentId);
        applicationRepository.save(application);
        log.debug("Linked payment {} to application {}", paymentId, application.getId());
    }

    /**
     * Puts the payment status back to PENDING once a checkout has been opened
     * for the application's current payment. Runs in the caller's transaction.
     *
     * @return false if the payment is no longer current or the application is paid
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean markAwaitingPayment(UUID applicationId, UUID paymentId) {
        ApplicationEntity application = applicationRepository.findByIdForUpdate(applicationId)
                .orElseThrow(() -> new ApplicationNotFoundException(applicationId));

        if (application.isPaid() || !application.isCurrentPayment(paymentId)) {
            log.info("Checkout for payment {} does not change application {} (paymentStatus={})",
                    paymentId, applicationId, application.getPaymentStatus());
            return false;
        }

        application.markAwaitingPayment();
        applicationRepository.save(application);
        return true;
    }

    /**
     * Clears the payment pointer if it still points at the given payment.
     * Compensation for a checkout that could not be opened; the payment status
     * is untouched because it only moves to PENDING once a checkout exists.
     */
    @Transactional
    public void unlinkPayment(UUID applicationId, UUID paymentId) {
        applicationRepository.findByIdForUpdate(applicationId).ifPresent(application -> {
            if (application.isCurrentPayment(paymentId)) {
                application.unlinkPayment();
                applicationRepository.save(application);
                log.info("Unlinked payment {} from application {}", paymentId, applicationId);
            }
        });
    }

    /**
     * Enrolls the applicant: status ENROLLED and payment status PAID, set together.
     */
    @Transactional
    public boolean markEnrolled(UUID applicationId, UUID paymentId) {
        ApplicationEntity application = applicationRepository.findByIdForUpdate(applicationId)
                .orElseThrow(() -> new ApplicationNotFoundException(applicationId));

        if (application.isPaid()) {
            log.info("Application {} already paid, enrollment for payment {} is a no-op", applicationId, paymentId);
            return false;
        }

        application.markEnrolled(paymentId);
        applicationRepository.save(application);
        log.info("Application {} enrolled by payment {}", applicationId, paymentId);
        return true;
    }

    /**
     * Records a failed or cancelled attempt. The review status is left alone.
     * Skipped once the application is paid, or when a newer payment has
     * replaced the failed one.
     */
    @Transactional
    public boolean markPaymentFailed(UUID applicationId, UUID paymentId) {
        ApplicationEntity application = applicationRepository.findByIdForUpdate(applicationId)
                .orElseThrow(() -> new ApplicationNotFoundException(applicationId));

        if (application.isPaid()) {
            log.info("Application {} already paid, ignoring failure of payment {}", applicationId, paymentId);
            return false;
        }
        if (application.getPaymentId() != null && !application.isCurrentPayment(paymentId)) {
            log.info("Payment {} is no longer current for application {}, ignoring failure", paymentId, applicationId);
            return false;
        }

        application.markPaymentStatus(ApplicationPaymentStatus.FAILED);
        applicationRepository.save(application);
        log.info("Application {} payment status set to FAILED by payment {}", applicationId, paymentId);
        return true;
    }

    /**
     * Records the expiry of the current payment. Only applies while the
     * application still points at that payment and is waiting on it.
     */
    @Transactional
    public boolean markPaymentExpired(UUID applicationId, UUID paymentId) {
        ApplicationEntity application = applicationRepository.findByIdForUpdate(applicationId)
                .orElseThrow(() -> new ApplicationNotFoundException(applicationId));

        if (!application.isCurrentPayment(paymentId)
                || application.getPaymentStatus() != ApplicationPaymentStatus.PENDING) {
            log.debug("Expiry of payment {} does not affect application {} (paymentStatus={})",
                    paymentId, applicationId, application.getPaymentStatus());
            return false;
        }

        application.markPaymentStatus(ApplicationPaymentStatus.EXPIRED);
        applicationRepository.save(application);
        log.info("Application {} payment status set to EXPIRED by payment {}", applicationId, paymentId);
        return true;
    }

    private static void requireUnpaid(ApplicationEntity application) {
        if (application.isPaid()) {
            throw new IllegalStateException("Application " + application.getId() + " has already been paid for");
        }
    }
}
