package com.localcooks.booking.exception;

import com.localcooks.common.exception.BusinessException;
import lombok.Getter;

/**
 * The booking cannot take this decision in its current state: it was already decided,
 * another decision for it is in flight, or the request contradicts an earlier outcome.
 * Clients treat it as "already handled". Mapped to 409.
 */
@Getter
public class InvalidBookingStateException extends BusinessException {

    private final Long bookingId;

    public InvalidBookingStateException(Long bookingId, String message) {
        super(message, "INVALID_STATE");
        this.bookingId = bookingId;
    }
}
