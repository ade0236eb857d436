package com.localcooks.booking.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.localcooks.booking.decision.UnitResult;
import com.localcooks.booking.domain.model.DecisionOutcome;
import com.localcooks.common.util.MoneyUtils;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record UnitResultResponse(
        Long id,
        String name,
        DecisionOutcome outcome,
        UnitResult.UnitStatus result,
        UnitResult.PaymentAction paymentAction,
        long amountCents,
        String formattedAmount,
        String errorCode,
        String message
) {
    public static UnitResultResponse from(UnitResult unit) {
        return new UnitResultResponse(
                unit.unitId(),
                unit.label(),
                unit.outcome(),
                unit.status(),
                unit.paymentAction(),
                unit.amountCents(),
                MoneyUtils.formatCents(unit.amountCents()),
                unit.errorCode(),
                unit.message()
        );
    }
}
