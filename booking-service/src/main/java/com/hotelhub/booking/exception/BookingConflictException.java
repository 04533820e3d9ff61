package com.hotelhub.booking.exception;

import com.hotelhub.booking.domain.model.Booking;
import com.hotelhub.common.exception.BusinessException;
import lombok.Getter;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The requested stay overlaps one or more pending/confirmed bookings of the same room.
 */
@Getter
public class BookingConflictException extends BusinessException {

    private final transient List<Booking> conflictingBookings;

    public BookingConflictException(Long roomId, LocalDate checkIn, LocalDate checkOut, List<Booking> conflictingBookings) {
        super(String.format("Room %d is already booked between %s and %s (conflicting bookings: %s)",
                        roomId, checkIn, checkOut, idsOf(conflictingBookings)),
                "BOOKING_CONFLICT");
        this.conflictingBookings = List.copyOf(conflictingBookings);
    }

    private static String idsOf(List<Booking> bookings) {
        return bookings.stream()
                .map(b -> String.valueOf(b.getId()))
                .collect(Collectors.joining(", "));
    }
}
