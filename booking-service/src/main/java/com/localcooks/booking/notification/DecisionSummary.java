package com.localcooks.booking.notification;

import com.localcooks.booking.decision.BillableUnit;
import com.localcooks.booking.decision.DecisionResult;
import com.localcooks.booking.decision.DecisionSource;
import com.localcooks.booking.decision.UnitResult;
import com.localcooks.booking.domain.aggregate.BookingAggregate;
import com.localcooks.common.util.MoneyUtils;
import com.localcooks.common.util.TimeUtils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Chef-facing outcome of a decision. Only units settled by this decision appear in it.
 *
 * @param kitchenOutcome  "confirmed" or "cancelled", or null when the kitchen booking was not settled now
 * @param storageOutcomes storage booking id to outcome
 */
public record DecisionSummary(
        String kitchenOutcome,
        Map<Long, String> storageOutcomes,
        long capturedCents,
        long releasedCents,
        String message,
        String reason
) {
    public static final String REASON_MANAGER_DECISION = "manager decision";
    public static final String REASON_AUTHORIZATION_EXPIRED = "authorization expired";

    public static DecisionSummary of(BookingAggregate aggregate, DecisionResult result, DecisionSource source) {
        String kitchenOutcome = null;
        Map<Long, String> storageOutcomes = new LinkedHashMap<>();
        long captured = 0L;
        long released = 0L;
        for (UnitResult unit : result.allUnits()) {
            if (!unit.isSucceeded()) {
                continue;
            }
            if (unit.unitType() == BillableUnit.UnitType.KITCHEN_BOOKING) {
                kitchenOutcome = unit.outcome().getValue();
            } else {
                storageOutcomes.put(unit.unitId(), unit.outcome().getValue());
            }
            switch (unit.paymentAction()) {
                case CAPTURED -> captured = MoneyUtils.sum(captured, unit.amountCents());
                case VOIDED, REFUNDED -> released = MoneyUtils.sum(released, unit.amountCents());
                default -> {
                }
            }
        }

        StringBuilder message = new StringBuilder();
        String slot = TimeUtils.formatSlot(aggregate.bookingDate(), aggregate.startTime(), aggregate.endTime(),
                TimeUtils.zoneOrDefault(aggregate.locationTimezone()));
        if (kitchenOutcome != null) {
            message.append("Your kitchen booking for ").append(slot).append(" was ").append(kitchenOutcome).append('.');
        } else {
            message.append("Your storage rentals for the kitchen booking on ").append(slot).append(" were updated.");
        }
        if (!storageOutcomes.isEmpty()) {
            message.append(' ').append(storageOutcomes.size()).append(" storage rental(s) updated.");
        }
        if (captured > 0) {
            message.append(" Charged ").append(MoneyUtils.formatCents(captured)).append('.');
        }
        if (released > 0) {
            message.append(" Released ").append(MoneyUtils.formatCents(released)).append('.');
        }

        String reason = source == DecisionSource.AUTHORIZATION_EXPIRY
                ? REASON_AUTHORIZATION_EXPIRED
                : REASON_MANAGER_DECISION;
        return new DecisionSummary(kitchenOutcome, storageOutcomes, captured, released, message.toString(), reason);
    }
}
