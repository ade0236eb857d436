package com.localcooks.booking.decision;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.localcooks.booking.domain.aggregate.StorageItem;
import com.localcooks.booking.domain.model.DecisionOutcome;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Per-unit outcome of one decision, including units skipped because an earlier request settled them.
 */
public record DecisionResult(
        Long bookingId,
        DecisionOutcome status,
        UnitResult kitchenResult,
        List<UnitResult> storageResults,
        boolean equipmentFollowed
) {
    public DecisionResult {
        storageResults = List.copyOf(storageResults);
    }

    /**
     * Assembles the result in plan order: the kitchen first, then storage rentals as the booking lists them.
     */
    public static DecisionResult assemble(DecisionPlan plan, Map<BillableUnit, UnitResult> executed) {
        List<UnitResult> all = new ArrayList<>(plan.skipped());
        plan.units().forEach(unit -> all.add(executed.get(unit)));

        UnitResult kitchen = all.stream()
                .filter(r -> r.unitType() == BillableUnit.UnitType.KITCHEN_BOOKING)
                .findFirst()
                .orElse(null);
        List<UnitResult> storage = new ArrayList<>();
        for (StorageItem item : plan.aggregate().storageItems()) {
            all.stream()
                    .filter(r -> r.unitType() == BillableUnit.UnitType.STORAGE_BOOKING
                            && r.unitId().equals(item.storageBookingId()))
                    .findFirst()
                    .ifPresent(storage::add);
        }
        return new DecisionResult(plan.aggregate().bookingId(), plan.decision().status(),
                kitchen, storage, plan.equipmentFollowed());
    }

    @JsonIgnore
    public boolean hasFailures() {
        return failedUnitCount() > 0;
    }

    public long failedUnitCount() {
        return allUnits().stream().filter(UnitResult::isFailed).count();
    }

    /** Units this decision acted on, successfully or not; skipped units are not counted. */
    public long processedUnitCount() {
        return allUnits().stream().filter(r -> r.status() != UnitResult.UnitStatus.SKIPPED).count();
    }

    @JsonIgnore
    public List<UnitResult> allUnits() {
        List<UnitResult> all = new ArrayList<>();
        if (kitchenResult != null) {
            all.add(kitchenResult);
        }
        all.addAll(storageResults);
        return all;
    }
}
