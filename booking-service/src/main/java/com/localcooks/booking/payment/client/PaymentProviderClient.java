package com.localcooks.booking.payment.client;

import com.localcooks.booking.payment.client.dto.ProviderCaptureRequest;
import com.localcooks.booking.payment.client.dto.ProviderPaymentIntentResponse;
import com.localcooks.booking.payment.client.dto.ProviderRefundRequest;
import com.localcooks.booking.payment.client.dto.ProviderRefundResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;

/**
 * Feign client for the external payment provider's manual-capture payment intents.
 * Every mutating call carries an Idempotency-Key so the provider replays instead of repeating.
 */
@FeignClient(name = "payment-provider", url = "${payment.provider.url}", path = "/v1")
public interface PaymentProviderClient {

    String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    @PostMapping("/payment_intents/{authorizationRef}/capture")
    ProviderPaymentIntentResponse capture(@PathVariable("authorizationRef") String authorizationRef,
                                          @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
                                          @RequestBody ProviderCaptureRequest request);

    @PostMapping("/payment_intents/{authorizationRef}/cancel")
    ProviderPaymentIntentResponse cancel(@PathVariable("authorizationRef") String authorizationRef,
                                         @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey);

    @PostMapping("/refunds")
    ProviderRefundResponse refund(@RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
                                  @RequestBody ProviderRefundRequest request);
}
