package com.localcooks.booking.payment.repository;

import com.localcooks.booking.payment.model.PaymentOperationRecord;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PaymentOperationRecordRepository extends JpaRepository<PaymentOperationRecord, String> {
}
