package com.localcooks.booking.payment.service;

import com.localcooks.booking.payment.client.PaymentProviderGateway;
import com.localcooks.booking.payment.client.dto.ProviderPaymentIntentResponse;
import com.localcooks.booking.payment.client.dto.ProviderRefundResponse;
import com.localcooks.booking.payment.dto.CaptureResult;
import com.localcooks.booking.payment.dto.PaymentAuthorizationView;
import com.localcooks.booking.payment.dto.RefundResult;
import com.localcooks.booking.payment.dto.VoidResult;
import com.localcooks.booking.payment.exception.PaymentCaptureException;
import com.localcooks.booking.payment.exception.PaymentFailureCode;
import com.localcooks.booking.payment.exception.PaymentVoidException;
import com.localcooks.booking.payment.exception.RefundException;
import com.localcooks.booking.payment.model.PaymentAuthorization;
import com.localcooks.booking.payment.model.PaymentAuthorization.AuthorizationStatus;
import com.localcooks.booking.payment.model.PaymentOperation;
import com.localcooks.booking.payment.repository.PaymentAuthorizationRepository;
import feign.FeignException;
import feign.RetryableException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * {@link PaymentGatewayAdapter} backed by the provider's HTTP API and the local
 * {@code payment_authorizations} mirror.
 *
 * Amounts are booked on the mirror with a guarded update before the provider is called
 * and unbooked if the provider refuses, so units sharing one hold cannot overdraw it.
 * Mirror updates commit on their own; nothing here runs inside a caller's transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProviderPaymentGatewayAdapter implements PaymentGatewayAdapter {

    private static final Set<AuthorizationStatus> CAPTURABLE = EnumSet.of(
            AuthorizationStatus.REQUIRES_CAPTURE,
            AuthorizationStatus.PARTIALLY_CAPTURED,
            AuthorizationStatus.CAPTURE_FAILED);

    private static final Set<AuthorizationStatus> VOIDABLE = EnumSet.of(
            AuthorizationStatus.REQUIRES_CAPTURE,
            AuthorizationStatus.CAPTURE_FAILED);

    private final PaymentProviderGateway providerGateway;
    private final PaymentAuthorizationRepository authorizationRepository;
    private final PaymentIdempotencyStore idempotencyStore;

    @Value("${payment.authorization.expiry-hours:24}")
    private long authorizationExpiryHours;

    @Override
    public CaptureResult capture(String authorizationRef, long amountCents, String idempotencyKey) {
        if (amountCents < 0) {
            throw new IllegalArgumentException("Capture amount must not be negative: " + amountCents);
        }
        Optional<CaptureResult> replay = idempotencyStore.find(idempotencyKey, CaptureResult.class);
        if (replay.isPresent()) {
            log.info("Capture {} already completed, replaying result", idempotencyKey);
            return replay.get();
        }
        if (amountCents == 0) {
            CaptureResult result = CaptureResult.noCharge();
            idempotencyStore.record(idempotencyKey, PaymentOperation.CAPTURE, result);
            log.info("Capture {} is zero; nothing charged on {}", idempotencyKey, authorizationRef);
            return result;
        }

        PaymentAuthorization authorization = authorizationRepository.findByAuthorizationRef(authorizationRef)
                .orElseThrow(() -> new PaymentCaptureException(PaymentFailureCode.UNKNOWN_AUTHORIZATION,
                        authorizationRef, "Unknown authorization " + authorizationRef));
        LocalDateTime now = LocalDateTime.now();
        if (authorization.getStatus() == AuthorizationStatus.VOIDED) {
            throw new PaymentCaptureException(PaymentFailureCode.AUTHORIZATION_VOIDED,
                    authorizationRef, "Authorization " + authorizationRef + " was voided");
        }
        if (isExpired(authorization, now)) {
            throw new PaymentCaptureException(PaymentFailureCode.AUTHORIZATION_EXPIRED,
                    authorizationRef, "Authorization " + authorizationRef + " expired");
        }

        int reserved = authorizationRepository.reserveCapture(authorizationRef, amountCents,
                AuthorizationStatus.CAPTURED, AuthorizationStatus.PARTIALLY_CAPTURED, CAPTURABLE, now);
        if (reserved != 1) {
            throw new PaymentCaptureException(PaymentFailureCode.AMOUNT_EXCEEDS_AUTHORIZED, authorizationRef,
                    String.format("Capture of %d cents exceeds the remaining amount on %s", amountCents, authorizationRef));
        }

        ProviderPaymentIntentResponse response;
        try {
            response = providerGateway.capture(authorizationRef, amountCents, idempotencyKey);
        } catch (RuntimeException e) {
            authorizationRepository.releaseCapture(authorizationRef, amountCents,
                    AuthorizationStatus.REQUIRES_CAPTURE, AuthorizationStatus.PARTIALLY_CAPTURED, LocalDateTime.now());
            PaymentFailureCode code = classify(e);
            if (code == PaymentFailureCode.DECLINED) {
                authorizationRepository.transitionUncaptured(authorizationRef, VOIDABLE,
                        AuthorizationStatus.CAPTURE_FAILED, LocalDateTime.now());
            }
            log.warn("Capture of {} cents on {} failed [{}]: {}", amountCents, authorizationRef, code, e.getMessage());
            throw new PaymentCaptureException(code, authorizationRef,
                    "Provider did not capture " + authorizationRef + ": " + code, e);
        }

        String chargeId = response != null ? response.latestCharge() : null;
        if (chargeId != null) {
            authorizationRepository.recordCharge(authorizationRef, chargeId, LocalDateTime.now());
        }
        CaptureResult result = new CaptureResult(amountCents, chargeId);
        idempotencyStore.record(idempotencyKey, PaymentOperation.CAPTURE, result);
        log.info("Captured {} cents on {} (charge {})", amountCents, authorizationRef, chargeId);
        return result;
    }

    @Override
    public VoidResult voidAuthorization(String authorizationRef, String idempotencyKey) {
        Optional<VoidResult> replay = idempotencyStore.find(idempotencyKey, VoidResult.class);
        if (replay.isPresent()) {
            log.info("Void {} already completed, replaying result", idempotencyKey);
            return replay.get();
        }

        PaymentAuthorization authorization = authorizationRepository.findByAuthorizationRef(authorizationRef)
                .orElseThrow(() -> new PaymentVoidException(PaymentFailureCode.UNKNOWN_AUTHORIZATION,
                        authorizationRef, "Unknown authorization " + authorizationRef));
        if (authorization.getStatus() == AuthorizationStatus.VOIDED) {
            VoidResult result = new VoidResult(authorizationRef, 0L);
            idempotencyStore.record(idempotencyKey, PaymentOperation.VOID, result);
            log.info("Authorization {} already voided", authorizationRef);
            return result;
        }
        if (authorization.getAmountCapturedCents() > 0) {
            throw new PaymentVoidException(PaymentFailureCode.ALREADY_CAPTURED, authorizationRef,
                    "Authorization " + authorizationRef + " has captured funds; refund instead of void");
        }

        try {
            providerGateway.cancel(authorizationRef, idempotencyKey);
        } catch (RuntimeException e) {
            PaymentFailureCode code = classify(e);
            log.warn("Void of {} failed [{}]: {}", authorizationRef, code, e.getMessage());
            throw new PaymentVoidException(code, authorizationRef,
                    "Provider did not void " + authorizationRef + ": " + code, e);
        }

        int updated = authorizationRepository.transitionUncaptured(authorizationRef, VOIDABLE,
                AuthorizationStatus.VOIDED, LocalDateTime.now());
        if (updated != 1) {
            log.error("Provider voided {} but the local mirror could not follow; mirror needs reconciling",
                    authorizationRef);
        }
        VoidResult result = new VoidResult(authorizationRef, authorization.getAmountAuthorizedCents());
        idempotencyStore.record(idempotencyKey, PaymentOperation.VOID, result);
        log.info("Voided authorization {} ({} cents released)", authorizationRef, result.releasedAmountCents());
        return result;
    }

    @Override
    public RefundResult refund(String authorizationRef, String chargeRef, long amountCents, String idempotencyKey) {
        if (amountCents < 0) {
            throw new IllegalArgumentException("Refund amount must not be negative: " + amountCents);
        }
        Optional<RefundResult> replay = idempotencyStore.find(idempotencyKey, RefundResult.class);
        if (replay.isPresent()) {
            log.info("Refund {} already completed, replaying result", idempotencyKey);
            return replay.get();
        }
        if (amountCents == 0) {
            RefundResult result = new RefundResult(null, chargeRef, 0L);
            idempotencyStore.record(idempotencyKey, PaymentOperation.REFUND, result);
            return result;
        }
        if (chargeRef == null) {
            throw new RefundException(PaymentFailureCode.UNKNOWN_CHARGE, authorizationRef,
                    "No charge to refund on " + authorizationRef);
        }
        if (authorizationRepository.findByAuthorizationRef(authorizationRef).isEmpty()) {
            throw new RefundException(PaymentFailureCode.UNKNOWN_AUTHORIZATION, authorizationRef,
                    "Unknown authorization " + authorizationRef);
        }

        int reserved = authorizationRepository.reserveRefund(authorizationRef, amountCents,
                AuthorizationStatus.REFUNDED, LocalDateTime.now());
        if (reserved != 1) {
            throw new RefundException(PaymentFailureCode.AMOUNT_EXCEEDS_CAPTURED, chargeRef,
                    String.format("Refund of %d cents exceeds the refundable amount of %s", amountCents, authorizationRef));
        }

        ProviderRefundResponse response;
        try {
            response = providerGateway.refund(chargeRef, amountCents, idempotencyKey);
        } catch (RuntimeException e) {
            authorizationRepository.releaseRefund(authorizationRef, amountCents,
                    AuthorizationStatus.CAPTURED, AuthorizationStatus.PARTIALLY_CAPTURED, LocalDateTime.now());
            PaymentFailureCode code = classify(e);
            log.warn("Refund of {} cents on {} failed [{}]: {}", amountCents, chargeRef, code, e.getMessage());
            throw new RefundException(code, chargeRef, "Provider did not refund " + chargeRef + ": " + code, e);
        }

        RefundResult result = new RefundResult(response != null ? response.id() : null, chargeRef, amountCents);
        idempotencyStore.record(idempotencyKey, PaymentOperation.REFUND, result);
        log.info("Refunded {} cents on charge {} (refund {})", amountCents, chargeRef, result.refundId());
        return result;
    }

    @Override
    public Optional<PaymentAuthorizationView> findAuthorization(String authorizationRef) {
        return authorizationRepository.findByAuthorizationRef(authorizationRef).map(PaymentAuthorizationView::from);
    }

    @Override
    public Optional<CaptureResult> findCompletedCapture(String idempotencyKey) {
        return idempotencyStore.find(idempotencyKey, CaptureResult.class);
    }

    private boolean isExpired(PaymentAuthorization authorization, LocalDateTime now) {
        if (authorization.getExpiresAt() != null) {
            return authorization.isExpired(now);
        }
        return authorization.getAuthorizedAt() != null
                && now.isAfter(authorization.getAuthorizedAt().plusHours(authorizationExpiryHours));
    }

    /**
     * Timeouts are reported as such and never as declines: the provider may have acted,
     * and only a retry with the same key tells.
     */
    private PaymentFailureCode classify(RuntimeException e) {
        if (e instanceof CallNotPermittedException) {
            return PaymentFailureCode.PROVIDER_UNAVAILABLE;
        }
        if (e instanceof RetryableException) {
            return PaymentFailureCode.TIMEOUT;
        }
        if (e instanceof FeignException feignException) {
            if (feignException.status() == HttpStatus.PAYMENT_REQUIRED.value()) {
                return PaymentFailureCode.DECLINED;
            }
            if (feignException.status() >= 400 && feignException.status() < 500) {
                return PaymentFailureCode.PROVIDER_REJECTED;
            }
        }
        return PaymentFailureCode.PROVIDER_UNAVAILABLE;
    }
}
