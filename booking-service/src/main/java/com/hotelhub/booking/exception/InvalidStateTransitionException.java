package com.hotelhub.booking.exception;

import com.hotelhub.booking.domain.model.Booking.BookingStatus;
import com.hotelhub.common.exception.BusinessException;
import lombok.Getter;

/**
 * A status change the booking state machine does not allow, e.g. confirming a cancelled booking.
 */
@Getter
public class InvalidStateTransitionException extends BusinessException {

    private final BookingStatus currentStatus;
    private final BookingStatus requestedStatus;

    public InvalidStateTransitionException(Long bookingId, BookingStatus currentStatus, BookingStatus requestedStatus) {
        super(String.format("Booking %d cannot move from %s to %s", bookingId, currentStatus, requestedStatus),
                "INVALID_STATE_TRANSITION");
        this.currentStatus = currentStatus;
        this.requestedStatus = requestedStatus;
    }

    public InvalidStateTransitionException(Long bookingId, BookingStatus currentStatus, String operation) {
        super(String.format("Booking %d cannot be %s while %s", bookingId, operation, currentStatus),
                "INVALID_STATE_TRANSITION");
        this.currentStatus = currentStatus;
        this.requestedStatus = null;
    }
}
