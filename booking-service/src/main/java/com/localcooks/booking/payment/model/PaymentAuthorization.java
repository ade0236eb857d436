package com.localcooks.booking.payment.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Local mirror of an authorization hold at the payment provider.
 * Created at checkout; mutated only by the payment gateway adapter, always through
 * the guarded updates of {@code PaymentAuthorizationRepository} so that units sharing
 * one hold never overdraw it.
 */
@Entity
@Table(name = "payment_authorizations", indexes = {
        @Index(name = "idx_payment_authorizations_charge", columnList = "provider_charge_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentAuthorization {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "authorization_ref", nullable = false, unique = true)
    private String authorizationRef;

    @Column(name = "amount_authorized_cents", nullable = false)
    private long amountAuthorizedCents;

    @Column(name = "amount_captured_cents", nullable = false)
    private long amountCapturedCents;

    @Column(name = "amount_refunded_cents", nullable = false)
    private long amountRefundedCents;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30)
    private AuthorizationStatus status;

    /** Charge of the most recent capture. A shared hold has one charge per capture. */
    @Column(name = "provider_charge_id")
    private String providerChargeId;

    @Column(name = "authorized_at", nullable = false)
    private LocalDateTime authorizedAt;

    @Column(name = "expires_at")
    private LocalDateTime expiresAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = LocalDateTime.now();
        if (status == null) {
            status = AuthorizationStatus.REQUIRES_CAPTURE;
        }
    }

    public long remainingCapturableCents() {
        return amountAuthorizedCents - amountCapturedCents;
    }

    public long refundableCents() {
        return amountCapturedCents - amountRefundedCents;
    }

    public boolean isExpired(LocalDateTime now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    public enum AuthorizationStatus {
        REQUIRES_CAPTURE,
        PARTIALLY_CAPTURED,
        CAPTURED,
        VOIDED,
        CAPTURE_FAILED,
        REFUNDED
    }
}
