package com.localcooks.booking.api.dto;

import com.localcooks.booking.domain.model.DecisionOutcome;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record StorageActionRequest(
        @NotNull(message = "Storage booking ID cannot be null")
        @Positive(message = "Storage booking ID must be positive")
        Long storageBookingId,

        @NotNull(message = "Action cannot be null")
        DecisionOutcome action
) {
}
