package com.localcooks.booking.payment.model;

public enum PaymentOperation {
    CAPTURE("capture"),
    VOID("void"),
    REFUND("refund");

    private final String keySuffix;

    PaymentOperation(String keySuffix) {
        this.keySuffix = keySuffix;
    }

    public String keySuffix() {
        return keySuffix;
    }
}
