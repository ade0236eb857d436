package com.localcooks.booking.domain.aggregate;

import com.localcooks.booking.domain.model.DecisionOutcome;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Sole owner of reads and writes of a kitchen booking together with its line items.
 */
public interface BookingAggregateRepository {

    /** One consistent read of the booking and every attached item. */
    Optional<BookingAggregate> loadForApproval(Long bookingId);

    /**
     * Takes the per-booking decision gate. Committed on return, before any payment call.
     *
     * @return the claim token to release with, or empty if another decision holds the gate
     *         or the booking does not exist
     */
    Optional<String> claimForDecision(Long bookingId);

    /**
     * Releases the gate if {@code claimToken} still holds it. A claim taken over after going stale
     * is left to its new holder.
     */
    void releaseClaim(Long bookingId, String claimToken);

    /**
     * Applies the outcomes of the units whose payment succeeded, all or nothing.
     * Every touched row must still be pending; otherwise nothing is written.
     *
     * @param kitchenOutcome  outcome for the kitchen booking, or null to leave it untouched
     * @param storageOutcomes storage booking id to outcome
     */
    void persistDecisions(Long bookingId, DecisionOutcome kitchenOutcome, Map<Long, DecisionOutcome> storageOutcomes);

    List<Long> findPendingBookingIdsCreatedBefore(LocalDateTime cutoff);
}
