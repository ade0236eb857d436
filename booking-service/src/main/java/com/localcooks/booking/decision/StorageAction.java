package com.localcooks.booking.decision;

import com.localcooks.booking.domain.model.DecisionOutcome;

import java.util.Objects;

public record StorageAction(Long storageBookingId, DecisionOutcome action) {
    public StorageAction {
        Objects.requireNonNull(storageBookingId, "storageBookingId");
        Objects.requireNonNull(action, "action");
    }
}
