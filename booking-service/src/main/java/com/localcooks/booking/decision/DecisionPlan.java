package com.localcooks.booking.decision;

import com.localcooks.booking.domain.aggregate.BookingAggregate;

import java.util.List;

/**
 * The units a decision acts on, in kitchen-first order, plus the ones an earlier decision already settled.
 */
public record DecisionPlan(
        BookingAggregate aggregate,
        ApprovalDecision decision,
        List<BillableUnit> units,
        List<UnitResult> skipped,
        boolean equipmentFollowed
) {
    public DecisionPlan {
        units = List.copyOf(units);
        skipped = List.copyOf(skipped);
    }
}
