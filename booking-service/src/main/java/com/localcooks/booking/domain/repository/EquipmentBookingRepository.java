package com.localcooks.booking.domain.repository;

import com.localcooks.booking.domain.model.EquipmentBooking;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface EquipmentBookingRepository extends JpaRepository<EquipmentBooking, Long> {
    List<EquipmentBooking> findByKitchenBookingIdOrderByIdAsc(Long kitchenBookingId);
}
