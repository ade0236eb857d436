package com.localcooks.booking.decision;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.localcooks.booking.domain.model.DecisionOutcome;

/**
 * What happened to one billable unit in a decision.
 *
 * @param errorCode payment failure code when {@code status} is FAILED, otherwise null
 */
public record UnitResult(
        BillableUnit.UnitType unitType,
        Long unitId,
        String label,
        DecisionOutcome outcome,
        PaymentAction paymentAction,
        UnitStatus status,
        long amountCents,
        String errorCode,
        String message
) {
    public enum PaymentAction {
        CAPTURED,
        VOIDED,
        REFUNDED,
        NO_CHARGE,
        NONE
    }

    public enum UnitStatus {
        SUCCEEDED,
        FAILED,
        /** Decided by an earlier request; nothing was done this time. */
        SKIPPED
    }

    public static UnitResult succeeded(BillableUnit unit, PaymentAction action, long amountCents, String message) {
        return new UnitResult(unit.unitType(), unit.unitId(), unit.label(), unit.outcome(),
                action, UnitStatus.SUCCEEDED, amountCents, null, message);
    }

    public static UnitResult failed(BillableUnit unit, String errorCode, String message) {
        return new UnitResult(unit.unitType(), unit.unitId(), unit.label(), unit.outcome(),
                PaymentAction.NONE, UnitStatus.FAILED, 0L, errorCode, message);
    }

    public static UnitResult skipped(BillableUnit.UnitType unitType, Long unitId, String label, DecisionOutcome recorded) {
        return new UnitResult(unitType, unitId, label, recorded,
                PaymentAction.NONE, UnitStatus.SKIPPED, 0L, null, "Already " + recorded.getValue());
    }

    @JsonIgnore
    public boolean isSucceeded() {
        return status == UnitStatus.SUCCEEDED;
    }

    @JsonIgnore
    public boolean isFailed() {
        return status == UnitStatus.FAILED;
    }
}
