package com.localcooks.booking.exception;

import com.localcooks.common.exception.BusinessException;
import lombok.Getter;

import java.util.Set;

/**
 * A storage action names a storage booking that is not attached to the kitchen booking being decided.
 */
@Getter
public class InvalidStorageReferenceException extends BusinessException {

    private final Long bookingId;
    private final Set<Long> unknownStorageBookingIds;

    public InvalidStorageReferenceException(Long bookingId, Set<Long> unknownStorageBookingIds) {
        super(String.format("Storage bookings %s do not belong to booking %d", unknownStorageBookingIds, bookingId),
                "INVALID_STORAGE_REFERENCE");
        this.bookingId = bookingId;
        this.unknownStorageBookingIds = Set.copyOf(unknownStorageBookingIds);
    }
}
