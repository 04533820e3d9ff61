package com.hotelhub.booking.api.exception;

import com.hotelhub.booking.api.dto.ConflictingBooking;
import com.hotelhub.booking.exception.BookingAccessDeniedException;
import com.hotelhub.booking.exception.BookingConflictException;
import com.hotelhub.booking.exception.InvalidStateTransitionException;
import com.hotelhub.common.dto.BaseResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;

/**
 * Booking-specific error mapping. Ordered ahead of the common handler, whose catch-all would
 * otherwise win for these exceptions.
 */
@Slf4j
@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
public class BookingExceptionHandler {

    @ExceptionHandler(BookingConflictException.class)
    public ResponseEntity<BaseResponse<List<ConflictingBooking>>> handleBookingConflict(BookingConflictException ex) {
        log.warn("Booking conflict: {}", ex.getMessage());
        List<ConflictingBooking> conflicts = ex.getConflictingBookings().stream()
                .map(ConflictingBooking::from)
                .toList();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(BaseResponse.error(ex.getMessage(), ex.getErrorCode(), conflicts));
    }

    @ExceptionHandler(InvalidStateTransitionException.class)
    public ResponseEntity<BaseResponse<?>> handleInvalidTransition(InvalidStateTransitionException ex) {
        log.warn("Invalid state transition: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(BaseResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(BookingAccessDeniedException.class)
    public ResponseEntity<BaseResponse<?>> handleAccessDenied(BookingAccessDeniedException ex) {
        log.warn("Access denied: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(BaseResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    /**
     * Lock failures that outlived the retries (optimistic) or timed out (pessimistic).
     */
    @ExceptionHandler(ConcurrencyFailureException.class)
    public ResponseEntity<BaseResponse<?>> handleConcurrencyFailure(ConcurrencyFailureException ex) {
        log.warn("Concurrent modification: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(BaseResponse.error("The room was modified concurrently, please retry", "CONCURRENT_MODIFICATION"));
    }
}
