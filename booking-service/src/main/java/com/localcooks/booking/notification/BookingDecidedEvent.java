package com.localcooks.booking.notification;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Event published when a manager (or the expiry sweep) decides a booking.
 * Consumed by the notification service, which emails the chef.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingDecidedEvent {
    private Long bookingId;
    private Long chefId;
    /** Null when only storage rentals were settled. */
    private String kitchenOutcome;
    private Map<Long, String> storageOutcomes;
    private long capturedCents;
    private long releasedCents;
    private String summary;
    private String reason;
    private Instant timestamp;
}
