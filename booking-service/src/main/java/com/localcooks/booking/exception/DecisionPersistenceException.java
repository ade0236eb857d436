package com.localcooks.booking.exception;

import com.localcooks.booking.decision.DecisionResult;
import lombok.Getter;

/**
 * Payment operations ran but the final status commit failed and was rolled back.
 * The booking is still in the state the last successful transaction left it.
 * Payment calls are idempotent, so a retried decision completes it.
 */
@Getter
public class DecisionPersistenceException extends RuntimeException {

    private final DecisionResult result;

    public DecisionPersistenceException(DecisionResult result, Throwable cause) {
        super("Failed to persist decision for booking " + result.bookingId(), cause);
        this.result = result;
    }
}
