package com.localcooks.booking.payment.service;

import com.localcooks.booking.payment.client.PaymentProviderGateway;
import com.localcooks.booking.payment.client.dto.ProviderPaymentIntentResponse;
import com.localcooks.booking.payment.client.dto.ProviderRefundResponse;
import com.localcooks.booking.payment.dto.CaptureResult;
import com.localcooks.booking.payment.dto.RefundResult;
import com.localcooks.booking.payment.dto.VoidResult;
import com.localcooks.booking.payment.exception.PaymentCaptureException;
import com.localcooks.booking.payment.exception.PaymentFailureCode;
import com.localcooks.booking.payment.exception.PaymentOperationException;
import com.localcooks.booking.payment.exception.PaymentVoidException;
import com.localcooks.booking.payment.exception.RefundException;
import com.localcooks.booking.payment.model.PaymentAuthorization;
import com.localcooks.booking.payment.model.PaymentAuthorization.AuthorizationStatus;
import com.localcooks.booking.payment.model.PaymentOperation;
import com.localcooks.booking.payment.repository.PaymentAuthorizationRepository;
import feign.FeignException;
import feign.Request;
import feign.Response;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link ProviderPaymentGatewayAdapter}.
 *
 * Verifies:
 * - Completed operations replay from the idempotency store without reaching the provider
 * - Amount, expiry and voided-hold checks happen before the provider is called
 * - Provider refusals unbook the amount from the local mirror and surface as typed failures
 */
@ExtendWith(MockitoExtension.class)
class ProviderPaymentGatewayAdapterTest {

    private static final String HOLD = "pi_1";
    private static final String CAPTURE_KEY = "kitchen-booking-42-capture";

    @Mock
    private PaymentProviderGateway providerGateway;

    @Mock
    private PaymentAuthorizationRepository authorizationRepository;

    @Mock
    private PaymentIdempotencyStore idempotencyStore;

    @InjectMocks
    private ProviderPaymentGatewayAdapter adapter;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(adapter, "authorizationExpiryHours", 24L);
    }

    private PaymentAuthorization hold(AuthorizationStatus status, long authorized, long captured) {
        return PaymentAuthorization.builder()
                .id(1L)
                .authorizationRef(HOLD)
                .amountAuthorizedCents(authorized)
                .amountCapturedCents(captured)
                .status(status)
                .authorizedAt(LocalDateTime.now().minusHours(1))
                .build();
    }

    private static FeignException providerError(int status) {
        Request request = Request.create(Request.HttpMethod.POST, "http://provider/v1/payment_intents/pi_1/capture",
                Map.of(), null, StandardCharsets.UTF_8, null);
        Response response = Response.builder()
                .status(status)
                .reason("error")
                .request(request)
                .headers(Map.of())
                .build();
        return FeignException.errorStatus("PaymentProviderClient#capture", response);
    }

    @Test
    @DisplayName("capture with a completed key replays the stored result")
    void capture_replaysCompletedOperation() {
        CaptureResult stored = new CaptureResult(1_000L, "ch_1");
        when(idempotencyStore.find(CAPTURE_KEY, CaptureResult.class)).thenReturn(Optional.of(stored));

        CaptureResult result = adapter.capture(HOLD, 1_000L, CAPTURE_KEY);

        assertThat(result).isEqualTo(stored);
        verifyNoInteractions(providerGateway, authorizationRepository);
        verify(idempotencyStore, never()).record(anyString(), any(), any());
    }

    @Test
    @DisplayName("a zero capture succeeds without touching the hold or the provider")
    void capture_zeroAmountIsNoOp() {
        CaptureResult result = adapter.capture(HOLD, 0L, CAPTURE_KEY);

        assertThat(result.capturedAmountCents()).isZero();
        assertThat(result.providerChargeId()).isNull();
        verify(idempotencyStore).record(CAPTURE_KEY, PaymentOperation.CAPTURE, result);
        verifyNoInteractions(providerGateway, authorizationRepository);
    }

    @Test
    @DisplayName("successful capture books the amount, records the charge and stores the result")
    void capture_success() {
        when(authorizationRepository.findByAuthorizationRef(HOLD))
                .thenReturn(Optional.of(hold(AuthorizationStatus.REQUIRES_CAPTURE, 5_000L, 0L)));
        when(authorizationRepository.reserveCapture(eq(HOLD), eq(1_000L), any(), any(), anyCollection(), any()))
                .thenReturn(1);
        when(providerGateway.capture(HOLD, 1_000L, CAPTURE_KEY))
                .thenReturn(new ProviderPaymentIntentResponse(HOLD, "succeeded", 5_000L, 1_000L, "ch_1"));

        CaptureResult result = adapter.capture(HOLD, 1_000L, CAPTURE_KEY);

        assertThat(result).isEqualTo(new CaptureResult(1_000L, "ch_1"));
        verify(authorizationRepository).recordCharge(eq(HOLD), eq("ch_1"), any());
        verify(idempotencyStore).record(CAPTURE_KEY, PaymentOperation.CAPTURE, result);
    }

    @Test
    @DisplayName("capture beyond the remaining hold fails before reaching the provider")
    void capture_amountExceedsAuthorized() {
        when(authorizationRepository.findByAuthorizationRef(HOLD))
                .thenReturn(Optional.of(hold(AuthorizationStatus.PARTIALLY_CAPTURED, 5_000L, 4_500L)));
        when(authorizationRepository.reserveCapture(eq(HOLD), eq(1_000L), any(), any(), anyCollection(), any()))
                .thenReturn(0);

        assertThatThrownBy(() -> adapter.capture(HOLD, 1_000L, CAPTURE_KEY))
                .isInstanceOf(PaymentCaptureException.class)
                .extracting(ex -> ((PaymentOperationException) ex).getFailureCode())
                .isEqualTo(PaymentFailureCode.AMOUNT_EXCEEDS_AUTHORIZED);
        verifyNoInteractions(providerGateway);
    }

    @Test
    @DisplayName("capture on a hold older than the expiry window fails as expired")
    void capture_expiredAuthorization() {
        PaymentAuthorization stale = hold(AuthorizationStatus.REQUIRES_CAPTURE, 5_000L, 0L);
        stale.setAuthorizedAt(LocalDateTime.now().minusHours(25));
        when(authorizationRepository.findByAuthorizationRef(HOLD)).thenReturn(Optional.of(stale));

        assertThatThrownBy(() -> adapter.capture(HOLD, 1_000L, CAPTURE_KEY))
                .isInstanceOf(PaymentCaptureException.class)
                .extracting(ex -> ((PaymentOperationException) ex).getFailureCode())
                .isEqualTo(PaymentFailureCode.AUTHORIZATION_EXPIRED);
        verify(authorizationRepository, never()).reserveCapture(any(), anyLong(), any(), any(), anyCollection(), any());
    }

    @Test
    @DisplayName("a 402 from the provider is a decline: the amount is unbooked and the hold marked failed")
    void capture_declined() {
        when(authorizationRepository.findByAuthorizationRef(HOLD))
                .thenReturn(Optional.of(hold(AuthorizationStatus.REQUIRES_CAPTURE, 5_000L, 0L)));
        when(authorizationRepository.reserveCapture(eq(HOLD), eq(1_000L), any(), any(), anyCollection(), any()))
                .thenReturn(1);
        when(providerGateway.capture(HOLD, 1_000L, CAPTURE_KEY)).thenThrow(providerError(402));

        assertThatThrownBy(() -> adapter.capture(HOLD, 1_000L, CAPTURE_KEY))
                .isInstanceOf(PaymentCaptureException.class)
                .extracting(ex -> ((PaymentOperationException) ex).getFailureCode())
                .isEqualTo(PaymentFailureCode.DECLINED);
        verify(authorizationRepository).releaseCapture(eq(HOLD), eq(1_000L), any(), any(), any());
        verify(authorizationRepository).transitionUncaptured(eq(HOLD), anyCollection(),
                eq(AuthorizationStatus.CAPTURE_FAILED), any());
        verify(idempotencyStore, never()).record(anyString(), any(), any());
    }

    @Test
    @DisplayName("an open circuit is reported as provider unavailable, never as success")
    void capture_circuitOpen() {
        when(authorizationRepository.findByAuthorizationRef(HOLD))
                .thenReturn(Optional.of(hold(AuthorizationStatus.REQUIRES_CAPTURE, 5_000L, 0L)));
        when(authorizationRepository.reserveCapture(eq(HOLD), eq(1_000L), any(), any(), anyCollection(), any()))
                .thenReturn(1);
        when(providerGateway.capture(HOLD, 1_000L, CAPTURE_KEY)).thenThrow(
                CallNotPermittedException.createCallNotPermittedException(CircuitBreaker.ofDefaults("payment-provider")));

        assertThatThrownBy(() -> adapter.capture(HOLD, 1_000L, CAPTURE_KEY))
                .isInstanceOf(PaymentCaptureException.class)
                .extracting(ex -> ((PaymentOperationException) ex).getFailureCode())
                .isEqualTo(PaymentFailureCode.PROVIDER_UNAVAILABLE);
        verify(authorizationRepository).releaseCapture(eq(HOLD), eq(1_000L), any(), any(), any());
    }

    @Test
    @DisplayName("void after any capture is refused; captured funds need a refund")
    void void_afterCapture() {
        when(authorizationRepository.findByAuthorizationRef(HOLD))
                .thenReturn(Optional.of(hold(AuthorizationStatus.PARTIALLY_CAPTURED, 5_000L, 1_000L)));

        assertThatThrownBy(() -> adapter.voidAuthorization(HOLD, "kitchen-booking-42-void"))
                .isInstanceOf(PaymentVoidException.class)
                .extracting(ex -> ((PaymentOperationException) ex).getFailureCode())
                .isEqualTo(PaymentFailureCode.ALREADY_CAPTURED);
        verifyNoInteractions(providerGateway);
    }

    @Test
    @DisplayName("voiding an already voided hold succeeds without a provider call")
    void void_alreadyVoided() {
        when(authorizationRepository.findByAuthorizationRef(HOLD))
                .thenReturn(Optional.of(hold(AuthorizationStatus.VOIDED, 5_000L, 0L)));

        VoidResult result = adapter.voidAuthorization(HOLD, "kitchen-booking-42-void");

        assertThat(result.releasedAmountCents()).isZero();
        verifyNoInteractions(providerGateway);
    }

    @Test
    @DisplayName("void releases the whole hold and moves the mirror to VOIDED")
    void void_success() {
        when(authorizationRepository.findByAuthorizationRef(HOLD))
                .thenReturn(Optional.of(hold(AuthorizationStatus.REQUIRES_CAPTURE, 5_000L, 0L)));
        when(authorizationRepository.transitionUncaptured(eq(HOLD), anyCollection(), eq(AuthorizationStatus.VOIDED), any()))
                .thenReturn(1);

        VoidResult result = adapter.voidAuthorization(HOLD, "kitchen-booking-42-void");

        assertThat(result.releasedAmountCents()).isEqualTo(5_000L);
        verify(providerGateway).cancel(HOLD, "kitchen-booking-42-void");
        verify(idempotencyStore).record("kitchen-booking-42-void", PaymentOperation.VOID, result);
    }

    @Test
    @DisplayName("refund beyond the captured amount fails before reaching the provider")
    void refund_exceedsCaptured() {
        when(authorizationRepository.findByAuthorizationRef(HOLD))
                .thenReturn(Optional.of(hold(AuthorizationStatus.CAPTURED, 5_000L, 5_000L)));
        when(authorizationRepository.reserveRefund(eq(HOLD), eq(6_000L), any(), any())).thenReturn(0);

        assertThatThrownBy(() -> adapter.refund(HOLD, "ch_1", 6_000L, "storage-booking-7-refund"))
                .isInstanceOf(RefundException.class)
                .extracting(ex -> ((PaymentOperationException) ex).getFailureCode())
                .isEqualTo(PaymentFailureCode.AMOUNT_EXCEEDS_CAPTURED);
        verifyNoInteractions(providerGateway);
    }

    @Test
    @DisplayName("an earlier charge on a shared hold stays refundable after a later capture")
    void refund_earlierChargeOnSharedHold() {
        // given: two captures on one hold, the hold now records the second charge
        PaymentAuthorization shared = hold(AuthorizationStatus.PARTIALLY_CAPTURED, 15_000L, 12_500L);
        shared.setProviderChargeId("ch_second");
        when(authorizationRepository.findByAuthorizationRef(HOLD)).thenReturn(Optional.of(shared));
        when(authorizationRepository.reserveRefund(eq(HOLD), eq(2_500L), eq(AuthorizationStatus.REFUNDED), any()))
                .thenReturn(1);
        when(providerGateway.refund("ch_first", 2_500L, "storage-booking-7-refund"))
                .thenReturn(new ProviderRefundResponse("re_1", "succeeded", 2_500L, "ch_first"));

        // when
        RefundResult result = adapter.refund(HOLD, "ch_first", 2_500L, "storage-booking-7-refund");

        // then
        assertThat(result.chargeRef()).isEqualTo("ch_first");
        assertThat(result.refundedAmountCents()).isEqualTo(2_500L);
        verify(idempotencyStore).record("storage-booking-7-refund", PaymentOperation.REFUND, result);
    }

    @Test
    @DisplayName("a failed refund gives the reserved amount back to the hold")
    void refund_providerFailureReleasesReservation() {
        when(authorizationRepository.findByAuthorizationRef(HOLD))
                .thenReturn(Optional.of(hold(AuthorizationStatus.CAPTURED, 5_000L, 5_000L)));
        when(authorizationRepository.reserveRefund(eq(HOLD), eq(5_000L), any(), any())).thenReturn(1);
        when(providerGateway.refund("ch_1", 5_000L, "kitchen-booking-42-refund")).thenThrow(providerError(503));

        assertThatThrownBy(() -> adapter.refund(HOLD, "ch_1", 5_000L, "kitchen-booking-42-refund"))
                .isInstanceOf(RefundException.class);
        verify(authorizationRepository).releaseRefund(eq(HOLD), eq(5_000L), any(), any(), any());
        verify(idempotencyStore, never()).record(anyString(), any(), any());
    }
}
