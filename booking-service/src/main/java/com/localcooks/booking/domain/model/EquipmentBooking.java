package com.localcooks.booking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Equipment rented with a kitchen booking. Its charge is bundled into the kitchen booking's
 * price and it has no status of its own: it always follows the kitchen booking's outcome.
 */
@Entity
@Table(name = "equipment_bookings", indexes = {
        @Index(name = "idx_equipment_bookings_kitchen_booking_id", columnList = "kitchen_booking_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EquipmentBooking {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "kitchen_booking_id", nullable = false)
    private Long kitchenBookingId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "total_price_cents")
    private Long totalPriceCents;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
