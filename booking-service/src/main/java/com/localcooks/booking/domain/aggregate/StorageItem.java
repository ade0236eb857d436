package com.localcooks.booking.domain.aggregate;

import com.localcooks.booking.domain.model.StorageBooking;

import java.time.LocalDate;

/**
 * Storage line item of a booking aggregate. {@code id} is the storage listing;
 * {@code storageBookingId} is the rental the decision targets.
 */
public record StorageItem(
        Long id,
        Long storageBookingId,
        String name,
        StorageBooking.StorageType storageType,
        Long totalPriceCents,
        LocalDate startDate,
        LocalDate endDate,
        StorageBooking.StorageStatus status,
        String paymentAuthorizationRef
) {
    public static StorageItem from(StorageBooking booking) {
        return new StorageItem(
                booking.getStorageListingId(),
                booking.getId(),
                booking.getName(),
                booking.getStorageType(),
                booking.getTotalPriceCents(),
                booking.getStartDate(),
                booking.getEndDate(),
                booking.getStatus(),
                booking.getPaymentAuthorizationRef()
        );
    }

    public boolean isPending() {
        return status == StorageBooking.StorageStatus.PENDING;
    }
}
