package com.localcooks.booking.payment.exception;

import lombok.Getter;

/**
 * A payment operation did not happen. Never thrown for an operation whose outcome is
 * unknown and might have succeeded; those surface as {@link PaymentFailureCode#TIMEOUT}
 * and are resolved by retrying with the same idempotency key.
 */
@Getter
public abstract class PaymentOperationException extends RuntimeException {

    private final PaymentFailureCode failureCode;
    private final String reference;

    protected PaymentOperationException(PaymentFailureCode failureCode, String reference, String message, Throwable cause) {
        super(message, cause);
        this.failureCode = failureCode;
        this.reference = reference;
    }
}
