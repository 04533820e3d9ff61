package com.hotelhub.booking.api.dto;

import com.hotelhub.booking.domain.service.AvailabilityResult;

import java.time.LocalDate;
import java.util.List;

public record AvailabilityResponse(
        Long roomId,
        LocalDate checkInDate,
        LocalDate checkOutDate,
        boolean available,
        List<ConflictingBooking> conflictingBookings
) {
    public static AvailabilityResponse from(Long roomId, LocalDate checkIn, LocalDate checkOut, AvailabilityResult result) {
        return new AvailabilityResponse(
                roomId,
                checkIn,
                checkOut,
                result.available(),
                result.conflictingBookings().stream().map(ConflictingBooking::from).toList());
    }
}
