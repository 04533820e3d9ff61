package com.hotelhub.booking.domain.service;

import com.hotelhub.booking.domain.model.Booking;

import java.util.List;

/**
 * Outcome of an availability check: free, or blocked by the listed bookings.
 */
public record AvailabilityResult(boolean available, List<Booking> conflictingBookings) {

    public AvailabilityResult {
        conflictingBookings = List.copyOf(conflictingBookings);
    }

    public static AvailabilityResult of(List<Booking> conflicts) {
        return new AvailabilityResult(conflicts.isEmpty(), conflicts);
    }
}
