package com.flagship.admissions_payment.reconciliation;

import com.flagship.admissions_payment.admission.ApplicationService;
import com.flagship.admissions_payment.payment.Payment;
import com.flagship.admissions_payment.user.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Propagates a payment's terminal status to its Application and User.
 *
 * Every step is idempotent, so the cascade can be re-run for a payment any
 * number of times with the same end state:
 * - SUCCESS: application ENROLLED + PAID, application id added to the user's enrolled programs
 * - FAILED, CANCELLED: application payment status FAILED unless already PAID
 * - EXPIRED: application payment status EXPIRED while the payment is still current
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EnrollmentCascade {

    private final ApplicationService applicationService;
    private final UserService userService;

    public void apply(Payment payment) {
        switch (payment.getStatus()) {
            case SUCCESS -> {
                applicationService.markEnrolled(payment.getApplicationId(), payment.getId());
                userService.addEnrolledProgram(payment.getUserId(), payment.getApplicationId());
            }
            case FAILED, CANCELLED -> applicationService.markPaymentFailed(payment.getApplicationId(), payment.getId());
            case EXPIRED -> applicationService.markPaymentExpired(payment.getApplicationId(), payment.getId());
            case PENDING -> throw new IllegalStateException(
                    "Cannot cascade pending payment " + payment.getReference());
        }
        log.debug("Cascade applied for payment {} ({})", payment.getReference(), payment.getStatus());
    }
}
