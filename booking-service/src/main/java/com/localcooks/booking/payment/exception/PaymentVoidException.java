package com.localcooks.booking.payment.exception;

public class PaymentVoidException extends PaymentOperationException {

    public PaymentVoidException(PaymentFailureCode failureCode, String authorizationRef, String message) {
        this(failureCode, authorizationRef, message, null);
    }

    public PaymentVoidException(PaymentFailureCode failureCode, String authorizationRef, String message, Throwable cause) {
        super(failureCode, authorizationRef, message, cause);
    }
}
