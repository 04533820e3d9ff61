package com.hotelhub.booking.api.dto;

import com.hotelhub.booking.domain.model.Booking;

import java.time.LocalDate;

/**
 * A booking that blocks a requested stay, as reported to the caller.
 */
public record ConflictingBooking(
        Long bookingId,
        LocalDate checkInDate,
        LocalDate checkOutDate,
        Booking.BookingStatus status
) {
    public static ConflictingBooking from(Booking booking) {
        return new ConflictingBooking(
                booking.getId(), booking.getCheckInDate(), booking.getCheckOutDate(), booking.getStatus());
    }
}
