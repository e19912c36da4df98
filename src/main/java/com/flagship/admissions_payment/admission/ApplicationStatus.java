package com.flagship.admissions_payment.admission;

/**
 * Review status of an admission application.
 * ENROLLED is only reached through a successful payment.
 */
public enum ApplicationStatus {
    PENDING,
    APPROVED,
    REJECTED,
    ENROLLED
}
