package com.flagship.admissions_payment.observability;

import com.flagship.admissions_payment.payment.PaymentRepository;
import com.flagship.admissions_payment.payment.PaymentStatus;
import com.flagship.admissions_payment.reconciliation.CascadeFailureRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Database-backed gauges for the payment lifecycle: payments awaiting an
 * outcome and cascades still owed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PaymentGauges {

    private final PaymentRepository paymentRepository;
    private final CascadeFailureRepository cascadeFailureRepository;
    private final MeterRegistry meterRegistry;

    private final AtomicLong pendingPayments = new AtomicLong(0);
    private final AtomicLong openCascadeFailures = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("payments.pending", pendingPayments, AtomicLong::get)
                .description("Payments still waiting for a gateway outcome")
                .register(meterRegistry);

        Gauge.builder("payments.cascade.open", openCascadeFailures, AtomicLong::get)
                .description("Terminal payments whose Application/User cascade has not completed")
                .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public void refresh() {
        try {
            pendingPayments.set(paymentRepository.countByStatus(PaymentStatus.PENDING));
            openCascadeFailures.set(cascadeFailureRepository.countByResolvedFalse());
        } catch (Exception e) {
            log.warn("Failed to refresh payment gauges: {}", e.getMessage());
        }
    }
}
