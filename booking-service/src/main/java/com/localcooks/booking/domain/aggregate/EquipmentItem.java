package com.localcooks.booking.domain.aggregate;

import com.localcooks.booking.domain.model.EquipmentBooking;

public record EquipmentItem(
        Long id,
        String name,
        Long totalPriceCents
) {
    public static EquipmentItem from(EquipmentBooking booking) {
        return new EquipmentItem(booking.getId(), booking.getName(), booking.getTotalPriceCents());
    }
}
