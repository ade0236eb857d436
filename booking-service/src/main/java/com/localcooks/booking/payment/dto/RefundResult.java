package com.localcooks.booking.payment.dto;

public record RefundResult(
        String refundId,
        String chargeRef,
        long refundedAmountCents
) {
}
