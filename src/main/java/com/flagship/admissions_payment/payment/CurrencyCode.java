package com.flagship.admissions_payment.payment;

/**
 * ISO-4217 currencies accepted by the checkout gateway.
 *
 * Amounts are always carried in the currency's minor unit (kobo, pesewas, cents).
 */
public enum CurrencyCode {
    NGN, // Nigerian Naira
    GHS, // Ghanaian Cedi
    ZAR, // South African Rand
    KES, // Kenyan Shilling
    USD  // US Dollar
}
