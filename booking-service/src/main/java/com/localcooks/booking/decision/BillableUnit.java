package com.localcooks.booking.decision;

import com.localcooks.booking.domain.model.DecisionOutcome;
import com.localcooks.booking.payment.model.PaymentOperation;

/**
 * One thing that gets its own payment operation: the kitchen booking (with its equipment
 * bundled into the price) or one storage rental.
 *
 * @param unitId          kitchen booking id or storage booking id, depending on {@code unitType}
 * @param amountCents     stored price, 0 when the stored price is null
 * @param authorizationRef hold to capture against or release; null when nothing was authorized
 */
public record BillableUnit(
        UnitType unitType,
        Long unitId,
        String label,
        DecisionOutcome outcome,
        long amountCents,
        String authorizationRef
) {
    public enum UnitType {
        KITCHEN_BOOKING("kitchen-booking"),
        STORAGE_BOOKING("storage-booking");

        private final String keyPrefix;

        UnitType(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }
    }

    /**
     * Stable per unit and operation, so a retried decision replays instead of charging twice,
     * e.g. {@code kitchen-booking-42-capture}.
     */
    public String idempotencyKey(PaymentOperation operation) {
        return unitType.keyPrefix + "-" + unitId + "-" + operation.keySuffix();
    }
}
