package com.localcooks.booking.decision;

import com.localcooks.booking.domain.aggregate.BookingAggregateRepository;
import com.localcooks.booking.exception.InvalidBookingStateException;
import com.localcooks.booking.exception.PartialDecisionFailureException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Scheduled job that cancels bookings left pending for longer than the authorization hold lives.
 * Goes through {@link BookingApprovalEngine}, so holds are voided and the chef is notified
 * exactly as for a manager's rejection. A booking that fails is picked up again on the next run.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuthorizationExpiryJob {

    private final BookingAggregateRepository aggregateRepository;
    private final BookingApprovalEngine approvalEngine;

    @Value("${booking.authorization-expiry.enabled:true}")
    private boolean expiryEnabled;

    @Value("${booking.authorization-expiry.expiry-hours:24}")
    private int expiryHours;

    @Scheduled(fixedDelayString = "${booking.authorization-expiry.interval-ms:900000}")
    public void cancelExpiredBookings() {
        if (!expiryEnabled) return;
        LocalDateTime cutoff = LocalDateTime.now().minusHours(expiryHours);
        List<Long> expired = aggregateRepository.findPendingBookingIdsCreatedBefore(cutoff);
        if (expired.isEmpty()) return;
        log.info("Authorization expiry: found {} pending booking(s) older than {}h", expired.size(), expiryHours);
        int cancelled = 0;
        for (Long bookingId : expired) {
            try {
                approvalEngine.applyDecision(ApprovalDecision.expiredAuthorization(bookingId));
                cancelled++;
            } catch (InvalidBookingStateException e) {
                log.debug("Authorization expiry: booking {} skipped: {}", bookingId, e.getMessage());
            } catch (PartialDecisionFailureException e) {
                log.warn("Authorization expiry: booking {} partly cancelled, {} unit(s) retried next run",
                        bookingId, e.getResult().failedUnitCount());
            } catch (Exception e) {
                log.error("Authorization expiry failed for booking {}", bookingId, e);
            }
        }
        log.info("Authorization expiry: cancelled {} of {} booking(s)", cancelled, expired.size());
    }
}
