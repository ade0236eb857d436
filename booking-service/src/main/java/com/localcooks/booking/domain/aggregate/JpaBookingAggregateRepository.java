package com.localcooks.booking.domain.aggregate;

import com.localcooks.booking.domain.model.DecisionOutcome;
import com.localcooks.booking.domain.model.KitchenBooking;
import com.localcooks.booking.domain.model.StorageBooking;
import com.localcooks.booking.domain.repository.EquipmentBookingRepository;
import com.localcooks.booking.domain.repository.KitchenBookingRepository;
import com.localcooks.booking.domain.repository.StorageBookingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JPA-backed aggregate repository. Every public method is its own short transaction;
 * none of them is ever open while a payment provider call runs.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaBookingAggregateRepository implements BookingAggregateRepository {

    private final KitchenBookingRepository kitchenBookingRepository;
    private final StorageBookingRepository storageBookingRepository;
    private final EquipmentBookingRepository equipmentBookingRepository;

    @Value("${booking.decision.claim-timeout-seconds:120}")
    private long claimTimeoutSeconds;

    @Override
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public Optional<BookingAggregate> loadForApproval(Long bookingId) {
        return kitchenBookingRepository.findById(bookingId)
                .map(booking -> BookingAggregate.of(
                        booking,
                        storageBookingRepository.findByKitchenBookingIdOrderByIdAsc(bookingId),
                        equipmentBookingRepository.findByKitchenBookingIdOrderByIdAsc(bookingId)));
    }

    @Override
    @Transactional
    public Optional<String> claimForDecision(Long bookingId) {
        LocalDateTime now = LocalDateTime.now();
        String token = UUID.randomUUID().toString();
        int claimed = kitchenBookingRepository.claimForDecision(
                bookingId, token, now, now.minusSeconds(claimTimeoutSeconds));
        log.debug("Decision claim for booking {}: {}", bookingId, claimed == 1 ? "taken" : "refused");
        return claimed == 1 ? Optional.of(token) : Optional.empty();
    }

    @Override
    @Transactional
    public void releaseClaim(Long bookingId, String claimToken) {
        int released = kitchenBookingRepository.releaseDecisionClaim(bookingId, claimToken);
        if (released == 0) {
            log.warn("Decision claim on booking {} was taken over before this request released it", bookingId);
        }
    }

    @Override
    @Transactional
    public void persistDecisions(Long bookingId,
                                 DecisionOutcome kitchenOutcome,
                                 Map<Long, DecisionOutcome> storageOutcomes) {
        LocalDateTime now = LocalDateTime.now();
        if (kitchenOutcome != null) {
            int updated = kitchenBookingRepository.transitionStatus(
                    bookingId, KitchenBooking.BookingStatus.PENDING, kitchenOutcome.toBookingStatus(), now);
            if (updated != 1) {
                throw new IllegalStateException(
                        "Kitchen booking " + bookingId + " is no longer pending; decision not persisted");
            }
        }
        for (Map.Entry<Long, DecisionOutcome> entry : storageOutcomes.entrySet()) {
            int updated = storageBookingRepository.transitionStatus(
                    entry.getKey(), bookingId, StorageBooking.StorageStatus.PENDING,
                    entry.getValue().toStorageStatus(), now);
            if (updated != 1) {
                throw new IllegalStateException("Storage booking " + entry.getKey()
                        + " of booking " + bookingId + " is no longer pending; decision not persisted");
            }
        }
        log.info("Persisted decision for booking {}: kitchen={}, storage={}", bookingId, kitchenOutcome, storageOutcomes);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Long> findPendingBookingIdsCreatedBefore(LocalDateTime cutoff) {
        return kitchenBookingRepository.findIdsByStatusCreatedBefore(KitchenBooking.BookingStatus.PENDING, cutoff);
    }
}
