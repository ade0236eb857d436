package com.localcooks.booking.service;

import com.localcooks.booking.api.dto.BookingDetailsResponse;
import com.localcooks.booking.api.dto.DecisionRequest;
import com.localcooks.booking.api.dto.DecisionResponse;
import com.localcooks.booking.api.dto.StorageActionRequest;
import com.localcooks.booking.decision.ApprovalDecision;
import com.localcooks.booking.decision.BookingApprovalEngine;
import com.localcooks.booking.decision.DecisionResult;
import com.localcooks.booking.decision.StorageAction;
import com.localcooks.booking.domain.aggregate.BookingAggregate;
import com.localcooks.booking.domain.aggregate.BookingAggregateRepository;
import com.localcooks.booking.exception.BookingAccessDeniedException;
import com.localcooks.booking.security.ManagerPrincipal;
import com.localcooks.common.exception.BusinessException;
import com.localcooks.common.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Manager-facing entry point: checks ownership and storage references before the engine
 * is allowed to touch any payment.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingDecisionService {

    private final BookingAggregateRepository aggregateRepository;
    private final BookingApprovalEngine approvalEngine;

    public DecisionResponse decide(ManagerPrincipal manager, Long bookingId, DecisionRequest request) {
        BookingAggregate aggregate = loadOwned(manager, bookingId);

        List<StorageAction> storageActions = request.storageActionsOrEmpty().stream()
                .map(action -> new StorageAction(action.storageBookingId(), action.action()))
                .toList();
        requireDistinct(bookingId, request.storageActionsOrEmpty());
        aggregate.requireOwnsStorageBookings(storageActions.stream().map(StorageAction::storageBookingId).toList());

        DecisionResult result = approvalEngine.applyDecision(
                ApprovalDecision.byManager(bookingId, request.status(), storageActions));
        return DecisionResponse.from(result);
    }

    public BookingDetailsResponse getBooking(ManagerPrincipal manager, Long bookingId) {
        return BookingDetailsResponse.from(loadOwned(manager, bookingId));
    }

    private BookingAggregate loadOwned(ManagerPrincipal manager, Long bookingId) {
        BookingAggregate aggregate = aggregateRepository.loadForApproval(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
        if (!manager.owns(aggregate.managerId())) {
            log.warn("Manager {} tried to access booking {} of manager {}",
                    manager.managerId(), bookingId, aggregate.managerId());
            throw new BookingAccessDeniedException(bookingId, manager.managerId());
        }
        return aggregate;
    }

    private void requireDistinct(Long bookingId, List<StorageActionRequest> actions) {
        Set<Long> seen = new HashSet<>();
        for (StorageActionRequest action : actions) {
            if (!seen.add(action.storageBookingId())) {
                throw new BusinessException(String.format(
                        "Storage booking %d appears more than once in the decision for booking %d",
                        action.storageBookingId(), bookingId), "DUPLICATE_STORAGE_ACTION");
            }
        }
    }
}
