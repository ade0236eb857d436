package com.localcooks.booking.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The two answers a manager can give for a billable unit. Unknown strings are rejected
 * when the payload is bound, so nothing downstream ever sees an unrecognised action.
 */
public enum DecisionOutcome {
    CONFIRMED("confirmed"),
    CANCELLED("cancelled");

    private final String value;

    DecisionOutcome(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static DecisionOutcome fromValue(String value) {
        for (DecisionOutcome outcome : values()) {
            if (outcome.value.equals(value)) {
                return outcome;
            }
        }
        throw new IllegalArgumentException("Unknown decision value: " + value);
    }

    public KitchenBooking.BookingStatus toBookingStatus() {
        return switch (this) {
            case CONFIRMED -> KitchenBooking.BookingStatus.CONFIRMED;
            case CANCELLED -> KitchenBooking.BookingStatus.CANCELLED;
        };
    }

    public StorageBooking.StorageStatus toStorageStatus() {
        return switch (this) {
            case CONFIRMED -> StorageBooking.StorageStatus.CONFIRMED;
            case CANCELLED -> StorageBooking.StorageStatus.CANCELLED;
        };
    }
}
