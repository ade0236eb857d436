package com.localcooks.booking.exception;

import com.localcooks.booking.decision.DecisionResult;
import lombok.Getter;

/**
 * One or more payment operations failed. Units that succeeded are already persisted;
 * failed units stay pending so the manager can resubmit just those. Mapped to 502
 * with the full per-unit result as the body.
 */
@Getter
public class PartialDecisionFailureException extends RuntimeException {

    private final DecisionResult result;

    public PartialDecisionFailureException(DecisionResult result) {
        super(String.format("Payment failed for %d of %d units of booking %d",
                result.failedUnitCount(), result.processedUnitCount(), result.bookingId()));
        this.result = result;
    }
}
