package com.localcooks.booking.api.exception;

import com.localcooks.booking.api.dto.DecisionResponse;
import com.localcooks.booking.exception.BookingAccessDeniedException;
import com.localcooks.booking.exception.DecisionPersistenceException;
import com.localcooks.booking.exception.InvalidBookingStateException;
import com.localcooks.booking.exception.PartialDecisionFailureException;
import com.localcooks.booking.security.UnauthenticatedException;
import com.localcooks.common.dto.BaseResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Decision errors that need a status other than the shared handler's 400/404/500.
 * Payment and persistence failures carry the per-unit result so the manager can retry just the failed units.
 */
@Slf4j
@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
public class BookingDecisionExceptionHandler {

    @ExceptionHandler(InvalidBookingStateException.class)
    public ResponseEntity<BaseResponse<?>> handleInvalidState(InvalidBookingStateException ex) {
        log.warn("Booking {} rejected decision: {}", ex.getBookingId(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(BaseResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(BookingAccessDeniedException.class)
    public ResponseEntity<BaseResponse<?>> handleAccessDenied(BookingAccessDeniedException ex) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(BaseResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(UnauthenticatedException.class)
    public ResponseEntity<BaseResponse<?>> handleUnauthenticated(UnauthenticatedException ex) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(BaseResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(PartialDecisionFailureException.class)
    public ResponseEntity<BaseResponse<DecisionResponse>> handlePartialFailure(PartialDecisionFailureException ex) {
        log.warn("Partial payment failure: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(BaseResponse.error(ex.getMessage(), "PAYMENT_PARTIAL_FAILURE",
                        DecisionResponse.from(ex.getResult())));
    }

    @ExceptionHandler(DecisionPersistenceException.class)
    public ResponseEntity<BaseResponse<DecisionResponse>> handlePersistenceFailure(DecisionPersistenceException ex) {
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(BaseResponse.error(
                        "Payments were processed but the booking could not be updated. Retry the same decision.",
                        "PERSISTENCE_FAILURE", DecisionResponse.from(ex.getResult())));
    }
}
