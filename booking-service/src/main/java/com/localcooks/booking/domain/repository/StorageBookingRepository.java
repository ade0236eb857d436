package com.localcooks.booking.domain.repository;

import com.localcooks.booking.domain.model.StorageBooking;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;

public interface StorageBookingRepository extends JpaRepository<StorageBooking, Long> {

    List<StorageBooking> findByKitchenBookingIdOrderByIdAsc(Long kitchenBookingId);

    /**
     * Guarded transition scoped to the parent booking, so a storage booking of another
     * kitchen booking can never be touched. Returns 0 when the row is not in {@code expected}.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE StorageBooking s
           SET s.status = :status,
               s.updatedAt = :now
           WHERE s.id = :id
             AND s.kitchenBookingId = :kitchenBookingId
             AND s.status = :expected
           """)
    int transitionStatus(@Param("id") Long id,
                         @Param("kitchenBookingId") Long kitchenBookingId,
                         @Param("expected") StorageBooking.StorageStatus expected,
                         @Param("status") StorageBooking.StorageStatus status,
                         @Param("now") LocalDateTime now);
}
