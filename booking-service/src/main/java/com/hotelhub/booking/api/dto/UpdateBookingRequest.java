package com.hotelhub.booking.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;
import java.util.List;

/**
 * Partial update; null fields are left unchanged. Status is not editable here.
 */
public record UpdateBookingRequest(
        LocalDate checkInDate,

        LocalDate checkOutDate,

        @Positive(message = "Guests count must be positive")
        Integer guestsCount,

        @Size(max = 2000, message = "Special requests must not exceed 2000 characters")
        String specialRequests,

        List<@NotNull(message = "Offer ID cannot be null") Long> offerIds
) {
    public boolean changesDates() {
        return checkInDate != null || checkOutDate != null;
    }

    public boolean changesOffers() {
        return offerIds != null;
    }
}
