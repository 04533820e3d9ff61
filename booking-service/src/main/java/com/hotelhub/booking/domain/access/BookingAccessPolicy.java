package com.hotelhub.booking.domain.access;

import com.hotelhub.booking.domain.model.Booking;
import com.hotelhub.booking.exception.BookingAccessDeniedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Single place where role and ownership rules for bookings are decided.
 * Every state-changing operation calls {@link #check(Actor, BookingAction, Booking)} before touching the booking.
 */
@Slf4j
@Component
public class BookingAccessPolicy {

    public boolean isAllowed(Actor actor, BookingAction action, Booking booking) {
        return switch (action.rule()) {
            case OWNER_ONLY -> booking != null && actor.owns(booking.getUserId());
            case OWNER_OR_STAFF -> actor.isStaff() || (booking != null && actor.owns(booking.getUserId()));
            case STAFF_ONLY -> actor.isStaff();
        };
    }

    public void check(Actor actor, BookingAction action, Booking booking) {
        if (!isAllowed(actor, action, booking)) {
            log.warn("Denied {} on booking {} for user {} ({})", action, booking.getId(), actor.userId(), actor.role());
            throw new BookingAccessDeniedException(actor.userId(), action, booking.getId());
        }
    }

    /**
     * For actions that do not target a single booking (listing, occupancy).
     */
    public void check(Actor actor, BookingAction action) {
        if (!isAllowed(actor, action, null)) {
            log.warn("Denied {} for user {} ({})", action, actor.userId(), actor.role());
            throw new BookingAccessDeniedException(actor.userId(), action);
        }
    }
}
