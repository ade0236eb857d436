package com.localcooks.booking.api.dto;

import com.localcooks.booking.domain.aggregate.BookingAggregate;
import com.localcooks.booking.domain.aggregate.EquipmentItem;
import com.localcooks.booking.domain.aggregate.StorageItem;
import com.localcooks.booking.domain.model.KitchenBooking;
import com.localcooks.booking.domain.model.StorageBooking;
import com.localcooks.common.util.MoneyUtils;
import com.localcooks.common.util.TimeUtils;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;

/**
 * Booking as the manager's approval dialog shows it, with display strings already formatted
 * in the kitchen location's timezone.
 */
public record BookingDetailsResponse(
        Long bookingId,
        Long chefId,
        Long kitchenId,
        KitchenBooking.BookingStatus status,
        LocalDate bookingDate,
        String startTime,
        String endTime,
        String timezone,
        String slot,
        long totalPriceCents,
        String formattedTotalPrice,
        LocalDateTime createdAt,
        List<StorageLine> storageItems,
        List<EquipmentLine> equipmentItems
) {
    public record StorageLine(
            Long id,
            Long storageBookingId,
            String name,
            StorageBooking.StorageType storageType,
            StorageBooking.StorageStatus status,
            long totalPriceCents,
            String formattedPrice,
            String dateRange
    ) {
        static StorageLine from(StorageItem item) {
            long cents = MoneyUtils.centsOrZero(item.totalPriceCents());
            return new StorageLine(item.id(), item.storageBookingId(), item.name(), item.storageType(), item.status(),
                    cents, MoneyUtils.formatCents(cents), TimeUtils.formatDateRange(item.startDate(), item.endDate()));
        }
    }

    public record EquipmentLine(Long id, String name, long totalPriceCents, String formattedPrice) {
        static EquipmentLine from(EquipmentItem item) {
            long cents = MoneyUtils.centsOrZero(item.totalPriceCents());
            return new EquipmentLine(item.id(), item.name(), cents, MoneyUtils.formatCents(cents));
        }
    }

    public static BookingDetailsResponse from(BookingAggregate aggregate) {
        long total = MoneyUtils.centsOrZero(aggregate.totalPriceCents());
        ZoneId zone = TimeUtils.zoneOrDefault(aggregate.locationTimezone());
        return new BookingDetailsResponse(
                aggregate.bookingId(),
                aggregate.chefId(),
                aggregate.kitchenId(),
                aggregate.status(),
                aggregate.bookingDate(),
                aggregate.startTime(),
                aggregate.endTime(),
                zone.getId(),
                TimeUtils.formatSlot(aggregate.bookingDate(), aggregate.startTime(), aggregate.endTime(), zone),
                total,
                MoneyUtils.formatCents(total),
                aggregate.createdAt(),
                aggregate.storageItems().stream().map(StorageLine::from).toList(),
                aggregate.equipmentItems().stream().map(EquipmentLine::from).toList()
        );
    }
}
