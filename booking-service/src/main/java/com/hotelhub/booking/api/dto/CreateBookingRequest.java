package com.hotelhub.booking.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record CreateBookingRequest(
        @NotNull(message = "Room ID cannot be null")
        Long roomId,

        @NotNull(message = "Check-in date cannot be null")
        LocalDate checkInDate,

        @NotNull(message = "Check-out date cannot be null")
        LocalDate checkOutDate,

        @Positive(message = "Guests count must be positive")
        @NotNull(message = "Guests count cannot be null")
        Integer guestsCount,

        @Size(max = 2000, message = "Special requests must not exceed 2000 characters")
        String specialRequests,

        List<@NotNull(message = "Offer ID cannot be null") Long> offerIds
) {
    public CreateBookingRequest {
        // nulls are kept so bean validation can report them
        offerIds = offerIds == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(offerIds));
    }
}
