package com.localcooks.booking.exception;

import com.localcooks.common.exception.BusinessException;

public class BookingAccessDeniedException extends BusinessException {

    public BookingAccessDeniedException(Long bookingId, Long managerId) {
        super(String.format("Manager %d has no access to booking %d", managerId, bookingId), "ACCESS_DENIED");
    }
}
