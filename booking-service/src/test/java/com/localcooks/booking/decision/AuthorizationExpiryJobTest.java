package com.localcooks.booking.decision;

import com.localcooks.booking.domain.aggregate.BookingAggregateRepository;
import com.localcooks.booking.domain.model.DecisionOutcome;
import com.localcooks.booking.exception.InvalidBookingStateException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuthorizationExpiryJobTest {

    @Mock
    private BookingAggregateRepository aggregateRepository;

    @Mock
    private BookingApprovalEngine approvalEngine;

    @InjectMocks
    private AuthorizationExpiryJob job;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(job, "expiryEnabled", true);
        ReflectionTestUtils.setField(job, "expiryHours", 24);
    }

    @Test
    @DisplayName("every expired pending booking gets a system cancellation; one failure does not stop the sweep")
    void cancelExpiredBookings_cancelsEach() {
        // given
        when(aggregateRepository.findPendingBookingIdsCreatedBefore(any(LocalDateTime.class)))
                .thenReturn(List.of(1L, 2L, 3L));
        when(approvalEngine.applyDecision(any(ApprovalDecision.class)))
                .thenReturn(null)
                .thenThrow(new InvalidBookingStateException(2L, "in progress"))
                .thenThrow(new IllegalStateException("boom"));

        // when
        job.cancelExpiredBookings();

        // then
        ArgumentCaptor<ApprovalDecision> captor = ArgumentCaptor.forClass(ApprovalDecision.class);
        verify(approvalEngine, times(3)).applyDecision(captor.capture());
        assertThat(captor.getAllValues()).extracting(ApprovalDecision::bookingId).containsExactly(1L, 2L, 3L);
        assertThat(captor.getAllValues()).allSatisfy(decision -> {
            assertThat(decision.status()).isEqualTo(DecisionOutcome.CANCELLED);
            assertThat(decision.source()).isEqualTo(DecisionSource.AUTHORIZATION_EXPIRY);
            assertThat(decision.storageActions()).isEmpty();
        });
    }

    @Test
    @DisplayName("the cutoff is the expiry window before now")
    void cancelExpiredBookings_usesExpiryWindow() {
        when(aggregateRepository.findPendingBookingIdsCreatedBefore(any(LocalDateTime.class))).thenReturn(List.of());

        LocalDateTime before = LocalDateTime.now().minusHours(24);
        job.cancelExpiredBookings();
        LocalDateTime after = LocalDateTime.now().minusHours(24);

        ArgumentCaptor<LocalDateTime> cutoff = ArgumentCaptor.forClass(LocalDateTime.class);
        verify(aggregateRepository).findPendingBookingIdsCreatedBefore(cutoff.capture());
        assertThat(cutoff.getValue()).isBetween(before, after);
        verifyNoInteractions(approvalEngine);
    }

    @Test
    @DisplayName("disabled sweep does nothing")
    void cancelExpiredBookings_disabled() {
        ReflectionTestUtils.setField(job, "expiryEnabled", false);

        job.cancelExpiredBookings();

        verifyNoInteractions(aggregateRepository, approvalEngine);
    }
}
