package com.localcooks.booking;

import com.localcooks.booking.domain.aggregate.BookingAggregate;
import com.localcooks.booking.domain.aggregate.EquipmentItem;
import com.localcooks.booking.domain.aggregate.StorageItem;
import com.localcooks.booking.domain.model.KitchenBooking;
import com.localcooks.booking.domain.model.StorageBooking;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Aggregates for tests: booking 42 of chef 100 and manager 5, 09:00-13:00 on Feb 2 2026.
 */
public final class BookingFixtures {

    public static final Long BOOKING_ID = 42L;
    public static final Long CHEF_ID = 100L;
    public static final Long MANAGER_ID = 5L;
    public static final String KITCHEN_HOLD = "pi_kitchen_42";

    private BookingFixtures() {
    }

    public static BookingAggregate booking(KitchenBooking.BookingStatus status,
                                           Long totalPriceCents,
                                           List<StorageItem> storage,
                                           List<EquipmentItem> equipment) {
        return new BookingAggregate(
                BOOKING_ID, CHEF_ID, MANAGER_ID, 9L, status,
                LocalDate.of(2026, 2, 2), "09:00", "13:00", "America/St_Johns",
                totalPriceCents, KITCHEN_HOLD, LocalDateTime.of(2026, 2, 1, 8, 0),
                storage, equipment);
    }

    public static BookingAggregate pendingBooking(StorageItem... storage) {
        return booking(KitchenBooking.BookingStatus.PENDING, 10_000L, List.of(storage), List.of());
    }

    public static StorageItem storage(long storageBookingId, Long totalPriceCents, StorageBooking.StorageStatus status) {
        return new StorageItem(
                900L + storageBookingId, storageBookingId, "Walk-in cooler " + storageBookingId,
                StorageBooking.StorageType.COLD, totalPriceCents,
                LocalDate.of(2026, 2, 3), LocalDate.of(2026, 2, 10), status,
                "pi_storage_" + storageBookingId);
    }

    public static StorageItem pendingStorage(long storageBookingId, Long totalPriceCents) {
        return storage(storageBookingId, totalPriceCents, StorageBooking.StorageStatus.PENDING);
    }

    /** Storage rental paid from the kitchen booking's hold. */
    public static StorageItem pendingStorageOnKitchenHold(long storageBookingId, Long totalPriceCents) {
        StorageItem item = pendingStorage(storageBookingId, totalPriceCents);
        return new StorageItem(item.id(), item.storageBookingId(), item.name(), item.storageType(),
                item.totalPriceCents(), item.startDate(), item.endDate(), item.status(), null);
    }

    public static EquipmentItem equipment(long id, Long totalPriceCents) {
        return new EquipmentItem(id, "Stand mixer", totalPriceCents);
    }
}
