package com.localcooks.booking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A chef's booking of a kitchen slot. Start/end are wall-clock {@code HH:MM} values
 * in {@link #locationTimezone}. The price includes any bundled equipment rentals.
 */
@Entity
@Table(name = "kitchen_bookings", indexes = {
        @Index(name = "idx_kitchen_bookings_chef_id", columnList = "chef_id"),
        @Index(name = "idx_kitchen_bookings_manager_id", columnList = "manager_id"),
        @Index(name = "idx_kitchen_bookings_status", columnList = "status")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KitchenBooking {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "chef_id", nullable = false)
    private Long chefId;

    /** Manager of the location the kitchen belongs to; the only approver. */
    @Column(name = "manager_id", nullable = false)
    private Long managerId;

    @Column(name = "kitchen_id", nullable = false)
    private Long kitchenId;

    @Column(name = "location_timezone", length = 64)
    private String locationTimezone;

    @Column(name = "booking_date", nullable = false)
    private LocalDate bookingDate;

    @Column(name = "start_time", nullable = false, length = 5)
    private String startTime;

    @Column(name = "end_time", nullable = false, length = 5)
    private String endTime;

    @Column(name = "total_price_cents")
    private Long totalPriceCents;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BookingStatus status;

    @Column(name = "payment_authorization_ref", length = 255)
    private String paymentAuthorizationRef;

    @Column(name = "decision_in_progress", nullable = false)
    private boolean decisionInProgress;

    @Column(name = "decision_started_at")
    private LocalDateTime decisionStartedAt;

    /** Identifies the request holding the decision claim; only that request may release it. */
    @Column(name = "decision_claim_token", length = 36)
    private String decisionClaimToken;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        updatedAt = LocalDateTime.now();
        if (status == null) {
            status = BookingStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public enum BookingStatus {
        PENDING,
        CONFIRMED,
        CANCELLED,
        COMPLETED
    }
}
