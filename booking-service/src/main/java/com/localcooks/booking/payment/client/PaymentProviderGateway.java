package com.localcooks.booking.payment.client;

import com.localcooks.booking.payment.client.dto.ProviderCaptureRequest;
import com.localcooks.booking.payment.client.dto.ProviderPaymentIntentResponse;
import com.localcooks.booking.payment.client.dto.ProviderRefundRequest;
import com.localcooks.booking.payment.client.dto.ProviderRefundResponse;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Circuit-breaker boundary around {@link PaymentProviderClient}.
 * No fallbacks: an open circuit surfaces as {@code CallNotPermittedException} and fails the unit.
 * No retries either; the manager resubmits and idempotency keys make that safe.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentProviderGateway {

    private static final String PROVIDER = "payment-provider";

    private final PaymentProviderClient client;

    @CircuitBreaker(name = PROVIDER)
    public ProviderPaymentIntentResponse capture(String authorizationRef, long amountCents, String idempotencyKey) {
        log.debug("Provider capture {} cents on {} [{}]", amountCents, authorizationRef, idempotencyKey);
        return client.capture(authorizationRef, idempotencyKey, new ProviderCaptureRequest(amountCents));
    }

    @CircuitBreaker(name = PROVIDER)
    public ProviderPaymentIntentResponse cancel(String authorizationRef, String idempotencyKey) {
        log.debug("Provider cancel {} [{}]", authorizationRef, idempotencyKey);
        return client.cancel(authorizationRef, idempotencyKey);
    }

    @CircuitBreaker(name = PROVIDER)
    public ProviderRefundResponse refund(String chargeRef, long amountCents, String idempotencyKey) {
        log.debug("Provider refund {} cents of {} [{}]", amountCents, chargeRef, idempotencyKey);
        return client.refund(idempotencyKey, new ProviderRefundRequest(chargeRef, amountCents));
    }
}
