package com.localcooks.booking.payment.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Result of a completed payment operation, keyed by its idempotency key.
 * A retry with the same key replays {@code responseJson} instead of calling the provider.
 */
@Entity
@Table(name = "payment_operations")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class PaymentOperationRecord {

    @Id
    @Column(name = "idempotency_key", length = 255)
    private String idempotencyKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "operation", nullable = false, length = 20)
    private PaymentOperation operation;

    @Column(name = "response_json", nullable = false, columnDefinition = "TEXT")
    private String responseJson;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
