package com.localcooks.booking.payment.exception;

public enum PaymentFailureCode {
    DECLINED,
    AMOUNT_EXCEEDS_AUTHORIZED,
    AMOUNT_EXCEEDS_CAPTURED,
    AUTHORIZATION_EXPIRED,
    AUTHORIZATION_VOIDED,
    ALREADY_CAPTURED,
    UNKNOWN_AUTHORIZATION,
    UNKNOWN_CHARGE,
    PROVIDER_REJECTED,
    PROVIDER_UNAVAILABLE,
    TIMEOUT,
    IDEMPOTENCY_UNAVAILABLE
}
