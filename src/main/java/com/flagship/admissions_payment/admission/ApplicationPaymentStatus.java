package com.flagship.admissions_payment.admission;

/**
 * Payment status as seen from the application.
 * PAID is final; the other values follow the application's current payment.
 */
public enum ApplicationPaymentStatus {
    PENDING,
    PAID,
    EXPIRED,
    FAILED
}
