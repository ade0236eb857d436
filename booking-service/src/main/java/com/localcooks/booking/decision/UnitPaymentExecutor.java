package com.localcooks.booking.decision;

import com.localcooks.booking.domain.model.DecisionOutcome;
import com.localcooks.booking.payment.dto.CaptureResult;
import com.localcooks.booking.payment.dto.PaymentAuthorizationView;
import com.localcooks.booking.payment.dto.RefundResult;
import com.localcooks.booking.payment.dto.VoidResult;
import com.localcooks.booking.payment.exception.PaymentFailureCode;
import com.localcooks.booking.payment.exception.PaymentOperationException;
import com.localcooks.booking.payment.model.PaymentAuthorization.AuthorizationStatus;
import com.localcooks.booking.payment.model.PaymentOperation;
import com.localcooks.booking.payment.service.PaymentGatewayAdapter;
import com.localcooks.common.exception.ServiceUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Runs the payment operation of every planned unit and reports each one independently.
 *
 * Captures run first, concurrently. Releases (void or refund) run after them. A hold that any
 * confirmed unit of the plan draws on is never voided, whether or not that unit's capture
 * succeeded, so a failed confirmation can be retried against the same hold.
 * Units sharing one hold get a single void. Each call is bounded by the unit timeout and
 * a timeout is a failure, never a success.
 */
@Slf4j
@Component
public class UnitPaymentExecutor {

    private final PaymentGatewayAdapter paymentGateway;
    private final Executor paymentExecutor;

    @Value("${booking.decision.unit-timeout-ms:15000}")
    private long unitTimeoutMs;

    public UnitPaymentExecutor(PaymentGatewayAdapter paymentGateway,
                               @Qualifier("paymentExecutor") Executor paymentExecutor) {
        this.paymentGateway = paymentGateway;
        this.paymentExecutor = paymentExecutor;
    }

    public Map<BillableUnit, UnitResult> execute(Long bookingId, List<BillableUnit> units) {
        Map<BillableUnit, UnitResult> results = new LinkedHashMap<>();

        Map<BillableUnit, CompletableFuture<UnitResult>> captures = new LinkedHashMap<>();
        for (BillableUnit unit : units) {
            if (unit.outcome() == DecisionOutcome.CONFIRMED) {
                captures.put(unit, CompletableFuture.supplyAsync(() -> capture(unit), paymentExecutor));
            }
        }
        results.putAll(await(bookingId, captures));

        Set<String> confirmedHolds = captures.keySet().stream()
                .map(BillableUnit::authorizationRef)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        Map<BillableUnit, CompletableFuture<UnitResult>> releases = new LinkedHashMap<>();
        Map<String, CompletableFuture<VoidResult>> voidsByHold = new LinkedHashMap<>();
        for (BillableUnit unit : units) {
            if (unit.outcome() == DecisionOutcome.CANCELLED) {
                releases.put(unit, release(unit, confirmedHolds, voidsByHold));
            }
        }
        results.putAll(await(bookingId, releases));

        Map<BillableUnit, UnitResult> ordered = new LinkedHashMap<>();
        units.forEach(unit -> ordered.put(unit, results.get(unit)));
        return ordered;
    }

    private UnitResult capture(BillableUnit unit) {
        if (unit.amountCents() == 0) {
            paymentGateway.capture(unit.authorizationRef(), 0L, unit.idempotencyKey(PaymentOperation.CAPTURE));
            return UnitResult.succeeded(unit, UnitResult.PaymentAction.NO_CHARGE, 0L, "No charge");
        }
        if (unit.authorizationRef() == null) {
            return UnitResult.failed(unit, PaymentFailureCode.UNKNOWN_AUTHORIZATION.name(),
                    "No authorization hold to capture " + unit.amountCents() + " cents from");
        }
        CaptureResult captured = paymentGateway.capture(
                unit.authorizationRef(), unit.amountCents(), unit.idempotencyKey(PaymentOperation.CAPTURE));
        return UnitResult.succeeded(unit, UnitResult.PaymentAction.CAPTURED, captured.capturedAmountCents(), "Captured");
    }

    private CompletableFuture<UnitResult> release(BillableUnit unit,
                                                  Set<String> confirmedHolds,
                                                  Map<String, CompletableFuture<VoidResult>> voidsByHold) {
        return CompletableFuture.supplyAsync(() -> priorCapture(unit), paymentExecutor)
                .thenCompose(prior -> {
                    if (prior.isPresent() && prior.get().capturedAmountCents() > 0) {
                        return CompletableFuture.supplyAsync(() -> refund(unit, prior.get()), paymentExecutor);
                    }
                    if (unit.authorizationRef() == null) {
                        return CompletableFuture.completedFuture(
                                UnitResult.succeeded(unit, UnitResult.PaymentAction.NONE, 0L, "Nothing was authorized"));
                    }
                    if (confirmedHolds.contains(unit.authorizationRef())) {
                        return CompletableFuture.completedFuture(UnitResult.succeeded(unit, UnitResult.PaymentAction.NONE, 0L,
                                "Hold is shared with a confirmed unit; this share is released when that unit is captured"));
                    }
                    return voidOnce(unit, voidsByHold).thenApply(voided -> voided == null
                            ? UnitResult.succeeded(unit, UnitResult.PaymentAction.NONE, 0L,
                                    "Hold is shared with a captured unit; the uncaptured remainder is released with it")
                            : UnitResult.succeeded(unit, UnitResult.PaymentAction.VOIDED, unit.amountCents(), "Voided"));
                });
    }

    private Optional<CaptureResult> priorCapture(BillableUnit unit) {
        return paymentGateway.findCompletedCapture(unit.idempotencyKey(PaymentOperation.CAPTURE));
    }

    private UnitResult refund(BillableUnit unit, CaptureResult prior) {
        if (prior.providerChargeId() == null) {
            return UnitResult.failed(unit, PaymentFailureCode.UNKNOWN_CHARGE.name(),
                    "Captured funds have no charge reference to refund");
        }
        RefundResult refunded = paymentGateway.refund(unit.authorizationRef(),
                prior.providerChargeId(), prior.capturedAmountCents(), unit.idempotencyKey(PaymentOperation.REFUND));
        return UnitResult.succeeded(unit, UnitResult.PaymentAction.REFUNDED, refunded.refundedAmountCents(), "Refunded");
    }

    /**
     * Completes with null when the hold already carries captured funds from another unit,
     * in which case there is nothing this unit may void.
     */
    private CompletableFuture<VoidResult> voidOnce(BillableUnit unit, Map<String, CompletableFuture<VoidResult>> voidsByHold) {
        synchronized (voidsByHold) {
            return voidsByHold.computeIfAbsent(unit.authorizationRef(), ref -> CompletableFuture.supplyAsync(() -> {
                Optional<PaymentAuthorizationView> hold = paymentGateway.findAuthorization(ref);
                if (hold.isPresent()
                        && hold.get().status() != AuthorizationStatus.VOIDED
                        && hold.get().amountCapturedCents() > 0) {
                    return null;
                }
                return paymentGateway.voidAuthorization(ref, unit.idempotencyKey(PaymentOperation.VOID));
            }, paymentExecutor));
        }
    }

    private Map<BillableUnit, UnitResult> await(Long bookingId, Map<BillableUnit, CompletableFuture<UnitResult>> futures) {
        Map<BillableUnit, UnitResult> results = new LinkedHashMap<>();
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(unitTimeoutMs);
        List<BillableUnit> timedOut = new ArrayList<>();
        for (Map.Entry<BillableUnit, CompletableFuture<UnitResult>> entry : futures.entrySet()) {
            BillableUnit unit = entry.getKey();
            try {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                results.put(unit, entry.getValue().get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                entry.getValue().cancel(true);
                timedOut.add(unit);
                results.put(unit, UnitResult.failed(unit, PaymentFailureCode.TIMEOUT.name(),
                        "Payment provider did not answer within " + unitTimeoutMs + " ms"));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                results.put(unit, UnitResult.failed(unit, PaymentFailureCode.TIMEOUT.name(), "Interrupted"));
            } catch (ExecutionException e) {
                results.put(unit, toFailure(bookingId, unit, e.getCause()));
            }
        }
        if (!timedOut.isEmpty()) {
            log.warn("Booking {}: payment calls timed out for {}", bookingId,
                    timedOut.stream().map(BillableUnit::label).toList());
        }
        return results;
    }

    private UnitResult toFailure(Long bookingId, BillableUnit unit, Throwable cause) {
        Throwable failure = cause instanceof CompletionException && cause.getCause() != null
                ? cause.getCause()
                : cause;
        if (failure instanceof PaymentOperationException paymentFailure) {
            log.warn("Booking {}: {} of {} failed [{}]: {}", bookingId, unit.outcome().getValue(),
                    unit.label(), paymentFailure.getFailureCode(), paymentFailure.getMessage());
            return UnitResult.failed(unit, paymentFailure.getFailureCode().name(), paymentFailure.getMessage());
        }
        if (failure instanceof ServiceUnavailableException) {
            log.warn("Booking {}: {} of {} skipped, idempotency store unavailable", bookingId,
                    unit.outcome().getValue(), unit.label());
            return UnitResult.failed(unit, PaymentFailureCode.IDEMPOTENCY_UNAVAILABLE.name(), failure.getMessage());
        }
        log.error("Booking {}: unexpected error during {} of {}", bookingId, unit.outcome().getValue(), unit.label(), failure);
        return UnitResult.failed(unit, "UNEXPECTED_ERROR", "Unexpected payment error");
    }
}
