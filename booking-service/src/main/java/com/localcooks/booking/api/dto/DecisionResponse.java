package com.localcooks.booking.api.dto;

import com.localcooks.booking.decision.DecisionResult;
import com.localcooks.booking.domain.model.DecisionOutcome;

import java.util.List;

/**
 * Body of a decision response, also attached to 502 responses so the caller can resubmit only the failed units.
 * For storage results {@code id} is the storage booking id.
 */
public record DecisionResponse(
        Long bookingId,
        DecisionOutcome status,
        UnitResultResponse kitchenResult,
        List<UnitResultResponse> storageResults,
        boolean equipmentFollowed
) {
    public static DecisionResponse from(DecisionResult result) {
        return new DecisionResponse(
                result.bookingId(),
                result.status(),
                result.kitchenResult() != null ? UnitResultResponse.from(result.kitchenResult()) : null,
                result.storageResults().stream().map(UnitResultResponse::from).toList(),
                result.equipmentFollowed()
        );
    }
}
