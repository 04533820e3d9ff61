package com.hotelhub.booking.exception;

import com.hotelhub.booking.domain.access.BookingAction;
import com.hotelhub.common.exception.BusinessException;

/**
 * The caller lacks the role or ownership needed for the requested booking action.
 */
public class BookingAccessDeniedException extends BusinessException {

    public BookingAccessDeniedException(Long userId, BookingAction action, Long bookingId) {
        super(String.format("User %d is not allowed to %s booking %d", userId, action.describe(), bookingId),
                "ACCESS_DENIED");
    }

    public BookingAccessDeniedException(Long userId, BookingAction action) {
        super(String.format("User %d is not allowed to %s", userId, action.describe()), "ACCESS_DENIED");
    }
}
