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
 * Storage rental attached to a kitchen booking. It has its own lifecycle and its own
 * payment authorization, and the manager can approve or reject it independently.
 */
@Entity
@Table(name = "storage_bookings", indexes = {
        @Index(name = "idx_storage_bookings_kitchen_booking_id", columnList = "kitchen_booking_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StorageBooking {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "kitchen_booking_id", nullable = false)
    private Long kitchenBookingId;

    @Column(name = "storage_listing_id", nullable = false)
    private Long storageListingId;

    @Column(name = "name", nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "storage_type", nullable = false, length = 20)
    private StorageType storageType;

    @Column(name = "total_price_cents")
    private Long totalPriceCents;

    @Column(name = "start_date")
    private LocalDate startDate;

    @Column(name = "end_date")
    private LocalDate endDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private StorageStatus status;

    @Column(name = "payment_authorization_ref", length = 255)
    private String paymentAuthorizationRef;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
        if (status == null) {
            status = StorageStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public enum StorageType {
        DRY,
        COLD,
        FREEZER
    }

    public enum StorageStatus {
        PENDING,
        CONFIRMED,
        CANCELLED
    }
}
