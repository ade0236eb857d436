package com.localcooks.booking.domain.repository;

import com.localcooks.booking.domain.model.KitchenBooking;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;

public interface KitchenBookingRepository extends JpaRepository<KitchenBooking, Long> {

    /**
     * Atomically marks the booking as being decided.
     *
     * A single guarded UPDATE serialises racing requests for the same booking:
     * only one of them sees 1 row affected. A claim older than {@code staleBefore}
     * belongs to a request that died mid-flight and may be taken over.
     *
     * @return 1 if the claim was taken, 0 if another decision holds it or the booking does not exist
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE KitchenBooking b
           SET b.decisionInProgress = true,
               b.decisionStartedAt = :now,
               b.decisionClaimToken = :token
           WHERE b.id = :id
             AND (b.decisionInProgress = false OR b.decisionStartedAt < :staleBefore)
           """)
    int claimForDecision(@Param("id") Long id,
                         @Param("token") String token,
                         @Param("now") LocalDateTime now,
                         @Param("staleBefore") LocalDateTime staleBefore);

    /**
     * Clears the claim only while {@code token} still holds it, so a request whose claim was
     * taken over after going stale cannot release its successor's claim.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE KitchenBooking b
           SET b.decisionInProgress = false,
               b.decisionStartedAt = null,
               b.decisionClaimToken = null
           WHERE b.id = :id
             AND b.decisionClaimToken = :token
           """)
    int releaseDecisionClaim(@Param("id") Long id, @Param("token") String token);

    /**
     * Moves the booking out of {@code expected}. Returns 0 when it is no longer in that state.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE KitchenBooking b
           SET b.status = :status,
               b.updatedAt = :now
           WHERE b.id = :id
             AND b.status = :expected
           """)
    int transitionStatus(@Param("id") Long id,
                         @Param("expected") KitchenBooking.BookingStatus expected,
                         @Param("status") KitchenBooking.BookingStatus status,
                         @Param("now") LocalDateTime now);

    /** For the authorization expiry sweep: undecided bookings created before the cutoff. */
    @Query("""
           SELECT b.id FROM KitchenBooking b
           WHERE b.status = :status
             AND b.decisionInProgress = false
             AND b.createdAt < :before
           ORDER BY b.createdAt
           """)
    List<Long> findIdsByStatusCreatedBefore(@Param("status") KitchenBooking.BookingStatus status,
                                            @Param("before") LocalDateTime before);
}
