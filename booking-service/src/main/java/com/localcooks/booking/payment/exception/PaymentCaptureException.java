package com.localcooks.booking.payment.exception;

public class PaymentCaptureException extends PaymentOperationException {

    public PaymentCaptureException(PaymentFailureCode failureCode, String authorizationRef, String message) {
        this(failureCode, authorizationRef, message, null);
    }

    public PaymentCaptureException(PaymentFailureCode failureCode, String authorizationRef, String message, Throwable cause) {
        super(failureCode, authorizationRef, message, cause);
    }
}
