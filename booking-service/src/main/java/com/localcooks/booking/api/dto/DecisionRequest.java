package com.localcooks.booking.api.dto;

import com.localcooks.booking.domain.model.DecisionOutcome;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Manager's decision payload. Storage rentals not listed in {@code storageActions} follow {@code status};
 * equipment always does.
 */
public record DecisionRequest(
        @NotNull(message = "Status cannot be null")
        DecisionOutcome status,

        List<@Valid @NotNull(message = "Storage action cannot be null") StorageActionRequest> storageActions
) {
    public List<StorageActionRequest> storageActionsOrEmpty() {
        return storageActions == null ? List.of() : storageActions;
    }
}
