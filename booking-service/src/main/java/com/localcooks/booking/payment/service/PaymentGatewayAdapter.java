package com.localcooks.booking.payment.service;

import com.localcooks.booking.payment.dto.CaptureResult;
import com.localcooks.booking.payment.dto.PaymentAuthorizationView;
import com.localcooks.booking.payment.dto.RefundResult;
import com.localcooks.booking.payment.dto.VoidResult;
import com.localcooks.booking.payment.exception.PaymentCaptureException;
import com.localcooks.booking.payment.exception.PaymentVoidException;
import com.localcooks.booking.payment.exception.RefundException;

import java.util.Optional;

/**
 * Stable interface over the payment provider's authorization hold.
 *
 * Every mutating call takes an idempotency key. Calling again with a key that already
 * succeeded returns the first result and has no further effect at the provider.
 * Callers must hold no database transaction across these calls.
 */
public interface PaymentGatewayAdapter {

    /**
     * Captures {@code amountCents} of the hold. Zero is a no-op success that never reaches the provider.
     *
     * @throws PaymentCaptureException if the amount exceeds what is left on the hold, the hold expired
     *                                 or was voided, or the provider declined
     */
    CaptureResult capture(String authorizationRef, long amountCents, String idempotencyKey);

    /**
     * Releases the whole hold without charging. Voiding an already voided hold succeeds.
     *
     * @throws PaymentVoidException if any part of the hold was captured; use {@link #refund} instead
     */
    VoidResult voidAuthorization(String authorizationRef, String idempotencyKey);

    /**
     * Refunds {@code chargeRef}, one of the charges captured from {@code authorizationRef}.
     *
     * @throws RefundException if the amount exceeds what was captured from the hold and not yet refunded
     */
    RefundResult refund(String authorizationRef, String chargeRef, long amountCents, String idempotencyKey);

    Optional<PaymentAuthorizationView> findAuthorization(String authorizationRef);

    /** The result a capture under {@code idempotencyKey} already produced, if it completed. */
    Optional<CaptureResult> findCompletedCapture(String idempotencyKey);
}
