package com.localcooks.booking.decision;

import com.localcooks.booking.domain.model.DecisionOutcome;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A decision on one kitchen booking. Storage rentals without an explicit action follow {@code status}.
 */
public record ApprovalDecision(
        Long bookingId,
        DecisionOutcome status,
        List<StorageAction> storageActions,
        DecisionSource source
) {
    public ApprovalDecision {
        Objects.requireNonNull(bookingId, "bookingId");
        Objects.requireNonNull(status, "status");
        storageActions = storageActions == null ? List.of() : List.copyOf(storageActions);
        source = source == null ? DecisionSource.MANAGER : source;
    }

    public static ApprovalDecision byManager(Long bookingId, DecisionOutcome status, List<StorageAction> storageActions) {
        return new ApprovalDecision(bookingId, status, storageActions, DecisionSource.MANAGER);
    }

    /** Cancels everything still pending; used when the authorization hold is about to lapse. */
    public static ApprovalDecision expiredAuthorization(Long bookingId) {
        return new ApprovalDecision(bookingId, DecisionOutcome.CANCELLED, List.of(), DecisionSource.AUTHORIZATION_EXPIRY);
    }

    /**
     * Explicit actions keyed by storage booking id, in request order.
     *
     * @throws IllegalStateException if one storage booking is named twice
     */
    public Map<Long, DecisionOutcome> storageActionsById() {
        Map<Long, DecisionOutcome> byId = new LinkedHashMap<>();
        for (StorageAction action : storageActions) {
            if (byId.put(action.storageBookingId(), action.action()) != null) {
                throw new IllegalStateException("Duplicate action for storage booking " + action.storageBookingId());
            }
        }
        return byId;
    }
}
