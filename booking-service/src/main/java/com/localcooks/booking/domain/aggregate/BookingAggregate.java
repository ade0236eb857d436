package com.localcooks.booking.domain.aggregate;

import com.localcooks.booking.domain.model.EquipmentBooking;
import com.localcooks.booking.domain.model.KitchenBooking;
import com.localcooks.booking.domain.model.StorageBooking;
import com.localcooks.booking.exception.InvalidStorageReferenceException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A kitchen booking with its storage and equipment line items, read together.
 * Immutable snapshot; state changes go through {@link BookingAggregateRepository}.
 */
public record BookingAggregate(
        Long bookingId,
        Long chefId,
        Long managerId,
        Long kitchenId,
        KitchenBooking.BookingStatus status,
        LocalDate bookingDate,
        String startTime,
        String endTime,
        String locationTimezone,
        Long totalPriceCents,
        String paymentAuthorizationRef,
        LocalDateTime createdAt,
        List<StorageItem> storageItems,
        List<EquipmentItem> equipmentItems
) {
    public BookingAggregate {
        storageItems = storageItems == null ? List.of() : List.copyOf(storageItems);
        equipmentItems = equipmentItems == null ? List.of() : List.copyOf(equipmentItems);
    }

    public static BookingAggregate of(KitchenBooking booking,
                                      List<StorageBooking> storageBookings,
                                      List<EquipmentBooking> equipmentBookings) {
        return new BookingAggregate(
                booking.getId(),
                booking.getChefId(),
                booking.getManagerId(),
                booking.getKitchenId(),
                booking.getStatus(),
                booking.getBookingDate(),
                booking.getStartTime(),
                booking.getEndTime(),
                booking.getLocationTimezone(),
                booking.getTotalPriceCents(),
                booking.getPaymentAuthorizationRef(),
                booking.getCreatedAt(),
                storageBookings.stream().map(StorageItem::from).toList(),
                equipmentBookings.stream().map(EquipmentItem::from).toList()
        );
    }

    public boolean isKitchenPending() {
        return status == KitchenBooking.BookingStatus.PENDING;
    }

    /** True while the kitchen booking or any storage rental still awaits a decision. */
    public boolean hasPendingUnits() {
        return isKitchenPending() || storageItems.stream().anyMatch(StorageItem::isPending);
    }

    public Optional<StorageItem> findStorageItem(Long storageBookingId) {
        return storageItems.stream()
                .filter(item -> item.storageBookingId().equals(storageBookingId))
                .findFirst();
    }

    /**
     * @throws InvalidStorageReferenceException if any id is not one of this booking's storage rentals
     */
    public void requireOwnsStorageBookings(Collection<Long> storageBookingIds) {
        Set<Long> unknown = new LinkedHashSet<>();
        for (Long id : storageBookingIds) {
            if (findStorageItem(id).isEmpty()) {
                unknown.add(id);
            }
        }
        if (!unknown.isEmpty()) {
            throw new InvalidStorageReferenceException(bookingId, unknown);
        }
    }
}
