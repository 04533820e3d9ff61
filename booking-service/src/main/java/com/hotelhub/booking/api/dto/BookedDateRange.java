package com.hotelhub.booking.api.dto;

import com.hotelhub.booking.domain.model.Booking;

import java.time.LocalDate;

/**
 * Occupied range for calendar rendering; the check-out day is bookable again.
 */
public record BookedDateRange(
        LocalDate checkInDate,
        LocalDate checkOutDate,
        Booking.BookingStatus status
) {
    public static BookedDateRange from(Booking booking) {
        return new BookedDateRange(booking.getCheckInDate(), booking.getCheckOutDate(), booking.getStatus());
    }
}
