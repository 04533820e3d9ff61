package com.hotelhub.booking.api.dto;

import com.hotelhub.booking.domain.model.Booking;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;

public record BookingResponse(
        Long id,
        Long userId,
        Long roomId,
        LocalDate checkInDate,
        LocalDate checkOutDate,
        long nights,
        Integer guestsCount,
        String specialRequests,
        List<OfferSummary> selectedOffers,
        BigDecimal totalPrice,
        Booking.BookingStatus status,
        boolean bonusAwarded,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static BookingResponse from(Booking booking) {
        return new BookingResponse(
                booking.getId(),
                booking.getUserId(),
                booking.getRoomId(),
                booking.getCheckInDate(),
                booking.getCheckOutDate(),
                booking.getNights(),
                booking.getGuestsCount(),
                booking.getSpecialRequests(),
                booking.getSelectedOffers().stream()
                        .sorted(Comparator.comparing(o -> o.getId() == null ? Long.MAX_VALUE : o.getId()))
                        .map(OfferSummary::from)
                        .toList(),
                booking.getTotalPrice(),
                booking.getStatus(),
                booking.isBonusAwarded(),
                booking.getCreatedAt(),
                booking.getUpdatedAt()
        );
    }
}
