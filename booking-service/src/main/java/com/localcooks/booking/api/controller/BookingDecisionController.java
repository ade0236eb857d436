package com.localcooks.booking.api.controller;

import com.localcooks.booking.api.dto.BookingDetailsResponse;
import com.localcooks.booking.api.dto.DecisionRequest;
import com.localcooks.booking.api.dto.DecisionResponse;
import com.localcooks.booking.security.AuthenticatedManager;
import com.localcooks.booking.security.ManagerPrincipal;
import com.localcooks.booking.service.BookingDecisionService;
import com.localcooks.common.dto.BaseResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/**
 * Manager endpoints for deciding kitchen bookings.
 */
@RestController
@RequestMapping("/api/manager/bookings")
@RequiredArgsConstructor
@Validated
public class BookingDecisionController {

    private final BookingDecisionService bookingDecisionService;

    @PostMapping("/{bookingId}/decision")
    public ResponseEntity<BaseResponse<DecisionResponse>> decide(
            @AuthenticatedManager ManagerPrincipal manager,
            @PathVariable @Positive(message = "Booking ID must be positive") Long bookingId,
            @Valid @RequestBody DecisionRequest request) {
        DecisionResponse response = bookingDecisionService.decide(manager, bookingId, request);
        return ResponseEntity.ok(BaseResponse.success("Booking " + response.status().getValue(), response));
    }

    @GetMapping("/{bookingId}")
    public ResponseEntity<BaseResponse<BookingDetailsResponse>> getBooking(
            @AuthenticatedManager ManagerPrincipal manager,
            @PathVariable @Positive(message = "Booking ID must be positive") Long bookingId) {
        return ResponseEntity.ok(BaseResponse.success(bookingDecisionService.getBooking(manager, bookingId)));
    }
}
