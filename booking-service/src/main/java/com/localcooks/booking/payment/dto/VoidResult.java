package com.localcooks.booking.payment.dto;

public record VoidResult(
        String authorizationRef,
        long releasedAmountCents
) {
}
