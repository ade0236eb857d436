package com.localcooks.booking.decision;

import com.localcooks.booking.domain.aggregate.BookingAggregate;
import com.localcooks.booking.domain.aggregate.StorageItem;
import com.localcooks.booking.domain.model.DecisionOutcome;
import com.localcooks.booking.domain.model.KitchenBooking;
import com.localcooks.booking.domain.model.StorageBooking;
import com.localcooks.booking.exception.InvalidBookingStateException;
import com.localcooks.common.util.MoneyUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns a decision into per-unit work against the current state of the booking.
 *
 * Only pending units get work. A unit that an earlier request already decided is skipped,
 * provided this decision does not contradict it.
 */
@Component
public class DecisionPlanner {

    public DecisionPlan plan(BookingAggregate aggregate, ApprovalDecision decision) {
        Long bookingId = aggregate.bookingId();
        if (!aggregate.hasPendingUnits()) {
            throw new InvalidBookingStateException(bookingId,
                    "Booking " + bookingId + " is not pending; it has already been decided");
        }
        Map<Long, DecisionOutcome> explicitActions = decision.storageActionsById();
        aggregate.requireOwnsStorageBookings(explicitActions.keySet());

        List<BillableUnit> units = new ArrayList<>();
        List<UnitResult> skipped = new ArrayList<>();

        String kitchenLabel = "Kitchen booking " + bookingId;
        if (aggregate.isKitchenPending()) {
            units.add(new BillableUnit(
                    BillableUnit.UnitType.KITCHEN_BOOKING,
                    bookingId,
                    kitchenLabel,
                    decision.status(),
                    MoneyUtils.centsOrZero(aggregate.totalPriceCents()),
                    aggregate.paymentAuthorizationRef()));
        } else {
            DecisionOutcome recorded = recordedOutcome(bookingId, aggregate.status());
            if (recorded != decision.status()) {
                throw new InvalidBookingStateException(bookingId, String.format(
                        "Booking %d was already %s; a %s decision cannot be applied",
                        bookingId, recorded.getValue(), decision.status().getValue()));
            }
            skipped.add(UnitResult.skipped(BillableUnit.UnitType.KITCHEN_BOOKING, bookingId, kitchenLabel, recorded));
        }

        for (StorageItem item : aggregate.storageItems()) {
            DecisionOutcome explicit = explicitActions.get(item.storageBookingId());
            if (item.isPending()) {
                units.add(new BillableUnit(
                        BillableUnit.UnitType.STORAGE_BOOKING,
                        item.storageBookingId(),
                        item.name() != null ? item.name() : "Storage booking " + item.storageBookingId(),
                        explicit != null ? explicit : decision.status(),
                        MoneyUtils.centsOrZero(item.totalPriceCents()),
                        item.paymentAuthorizationRef() != null
                                ? item.paymentAuthorizationRef()
                                : aggregate.paymentAuthorizationRef()));
                continue;
            }
            DecisionOutcome recorded = recordedOutcome(item.status());
            if (explicit != null && explicit != recorded) {
                throw new InvalidBookingStateException(bookingId, String.format(
                        "Storage booking %d was already %s; a %s action cannot be applied",
                        item.storageBookingId(), recorded.getValue(), explicit.getValue()));
            }
            skipped.add(UnitResult.skipped(BillableUnit.UnitType.STORAGE_BOOKING,
                    item.storageBookingId(), item.name(), recorded));
        }

        return new DecisionPlan(aggregate, decision, units, skipped, !aggregate.equipmentItems().isEmpty());
    }

    private DecisionOutcome recordedOutcome(Long bookingId, KitchenBooking.BookingStatus status) {
        return switch (status) {
            case CONFIRMED -> DecisionOutcome.CONFIRMED;
            case CANCELLED -> DecisionOutcome.CANCELLED;
            case COMPLETED -> throw new InvalidBookingStateException(bookingId,
                    "Booking " + bookingId + " is already completed");
            case PENDING -> throw new IllegalStateException("Pending booking has no recorded outcome");
        };
    }

    private DecisionOutcome recordedOutcome(StorageBooking.StorageStatus status) {
        return switch (status) {
            case CONFIRMED -> DecisionOutcome.CONFIRMED;
            case CANCELLED -> DecisionOutcome.CANCELLED;
            case PENDING -> throw new IllegalStateException("Pending storage booking has no recorded outcome");
        };
    }
}
