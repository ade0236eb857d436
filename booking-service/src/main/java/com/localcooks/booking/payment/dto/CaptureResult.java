package com.localcooks.booking.payment.dto;

/**
 * @param providerChargeId null for a zero-amount capture, which never reaches the provider
 */
public record CaptureResult(
        long capturedAmountCents,
        String providerChargeId
) {
    public static CaptureResult noCharge() {
        return new CaptureResult(0L, null);
    }
}
