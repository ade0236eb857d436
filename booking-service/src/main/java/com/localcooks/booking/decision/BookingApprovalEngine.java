package com.localcooks.booking.decision;

import com.localcooks.booking.domain.aggregate.BookingAggregate;
import com.localcooks.booking.domain.aggregate.BookingAggregateRepository;
import com.localcooks.booking.domain.model.DecisionOutcome;
import com.localcooks.booking.exception.DecisionPersistenceException;
import com.localcooks.booking.exception.InvalidBookingStateException;
import com.localcooks.booking.exception.PartialDecisionFailureException;
import com.localcooks.booking.notification.DecisionSummary;
import com.localcooks.booking.notification.NotificationDispatcher;
import com.localcooks.common.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Applies an approval decision to a kitchen booking and its storage rentals.
 *
 * Flow:
 * 1. Take the booking's decision gate (committed, so racing requests lose with 409)
 * 2. Reload the booking and plan per-unit work; only pending units are acted on
 * 3. Capture confirmed units, then void or refund cancelled ones
 * 4. Persist, in one transaction, the statuses of the units whose payment succeeded
 * 5. Notify the chef (best-effort)
 * 6. Release the gate
 *
 * No database transaction is open while the payment provider is called.
 * Payment calls are idempotent per unit, so a decision that failed part-way is finished by resubmitting it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingApprovalEngine {

    private final BookingAggregateRepository aggregateRepository;
    private final DecisionPlanner decisionPlanner;
    private final UnitPaymentExecutor unitPaymentExecutor;
    private final NotificationDispatcher notificationDispatcher;

    /**
     * @throws ResourceNotFoundException       if the booking does not exist
     * @throws InvalidBookingStateException    if the booking was already decided or another decision is in flight
     * @throws PartialDecisionFailureException if any payment operation failed; succeeded units are persisted
     * @throws DecisionPersistenceException    if payments ran but the status commit failed
     */
    public DecisionResult applyDecision(ApprovalDecision decision) {
        Long bookingId = decision.bookingId();
        log.info("Applying {} decision {} to booking {} (storage actions: {})",
                decision.source(), decision.status().getValue(), bookingId, decision.storageActions());

        Optional<String> claim = aggregateRepository.claimForDecision(bookingId);
        if (claim.isEmpty()) {
            if (aggregateRepository.loadForApproval(bookingId).isEmpty()) {
                throw new ResourceNotFoundException("Booking", bookingId);
            }
            throw new InvalidBookingStateException(bookingId,
                    "A decision for booking " + bookingId + " is already in progress");
        }

        try {
            BookingAggregate aggregate = aggregateRepository.loadForApproval(bookingId)
                    .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
            DecisionPlan plan = decisionPlanner.plan(aggregate, decision);
            log.info("Booking {}: {} unit(s) to settle, {} already settled, equipment follows kitchen: {}",
                    bookingId, plan.units().size(), plan.skipped().size(), plan.equipmentFollowed());

            Map<BillableUnit, UnitResult> executed = unitPaymentExecutor.execute(bookingId, plan.units());
            DecisionResult result = DecisionResult.assemble(plan, executed);

            persistSucceeded(bookingId, decision, executed, result);
            notifyChef(aggregate, result, decision.source());

            if (result.hasFailures()) {
                log.warn("Booking {}: {} of {} unit(s) failed payment; failed units stay pending",
                        bookingId, result.failedUnitCount(), result.processedUnitCount());
                throw new PartialDecisionFailureException(result);
            }
            log.info("Booking {} decided: {}", bookingId, decision.status().getValue());
            return result;
        } finally {
            releaseClaim(bookingId, claim.get());
        }
    }

    private void persistSucceeded(Long bookingId,
                                  ApprovalDecision decision,
                                  Map<BillableUnit, UnitResult> executed,
                                  DecisionResult result) {
        DecisionOutcome kitchenOutcome = null;
        Map<Long, DecisionOutcome> storageOutcomes = new LinkedHashMap<>();
        for (Map.Entry<BillableUnit, UnitResult> entry : executed.entrySet()) {
            if (!entry.getValue().isSucceeded()) {
                continue;
            }
            BillableUnit unit = entry.getKey();
            switch (unit.unitType()) {
                case KITCHEN_BOOKING -> kitchenOutcome = unit.outcome();
                case STORAGE_BOOKING -> storageOutcomes.put(unit.unitId(), unit.outcome());
            }
        }
        if (kitchenOutcome == null && storageOutcomes.isEmpty()) {
            return;
        }
        try {
            aggregateRepository.persistDecisions(bookingId, kitchenOutcome, storageOutcomes);
        } catch (RuntimeException e) {
            log.error("Booking {}: payments completed but persisting the decision failed "
                            + "(decision={}, storageActions={}, kitchen={}, storage={}); nothing was written",
                    bookingId, decision.status().getValue(), decision.storageActions(),
                    kitchenOutcome, storageOutcomes, e);
            throw new DecisionPersistenceException(result, e);
        }
    }

    private void notifyChef(BookingAggregate aggregate, DecisionResult result, DecisionSource source) {
        if (result.allUnits().stream().noneMatch(UnitResult::isSucceeded)) {
            return;
        }
        try {
            notificationDispatcher.notify(aggregate.chefId(), aggregate.bookingId(),
                    DecisionSummary.of(aggregate, result, source));
        } catch (Exception e) {
            log.warn("Booking {}: chef {} could not be notified", aggregate.bookingId(), aggregate.chefId(), e);
        }
    }

    private void releaseClaim(Long bookingId, String claimToken) {
        try {
            aggregateRepository.releaseClaim(bookingId, claimToken);
        } catch (RuntimeException e) {
            log.error("Booking {}: failed to release decision claim; it lapses after the claim timeout", bookingId, e);
        }
    }
}
