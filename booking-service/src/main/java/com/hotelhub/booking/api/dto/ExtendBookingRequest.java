package com.hotelhub.booking.api.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record ExtendBookingRequest(
        @NotNull(message = "Days cannot be null")
        @Min(value = 1, message = "A booking must be extended by at least one day")
        Integer days
) {
}
