package com.localcooks.booking.payment.dto;

import com.localcooks.booking.payment.model.PaymentAuthorization;

/**
 * Read-only view of an authorization for callers deciding between void and refund.
 */
public record PaymentAuthorizationView(
        String authorizationRef,
        long amountAuthorizedCents,
        long amountCapturedCents,
        long amountRefundedCents,
        PaymentAuthorization.AuthorizationStatus status,
        String providerChargeId
) {
    public static PaymentAuthorizationView from(PaymentAuthorization authorization) {
        return new PaymentAuthorizationView(
                authorization.getAuthorizationRef(),
                authorization.getAmountAuthorizedCents(),
                authorization.getAmountCapturedCents(),
                authorization.getAmountRefundedCents(),
                authorization.getStatus(),
                authorization.getProviderChargeId()
        );
    }

    /** Captured and not yet refunded. */
    public long netCapturedCents() {
        return amountCapturedCents - amountRefundedCents;
    }
}
