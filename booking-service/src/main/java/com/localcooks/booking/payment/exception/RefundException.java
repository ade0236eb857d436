package com.localcooks.booking.payment.exception;

public class RefundException extends PaymentOperationException {

    public RefundException(PaymentFailureCode failureCode, String chargeRef, String message) {
        this(failureCode, chargeRef, message, null);
    }

    public RefundException(PaymentFailureCode failureCode, String chargeRef, String message, Throwable cause) {
        super(failureCode, chargeRef, message, cause);
    }
}
