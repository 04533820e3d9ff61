package com.hotelhub.booking.api.dto;

import com.hotelhub.booking.domain.model.Room;

import java.util.List;

public record RoomOccupancyResponse(
        Long roomId,
        String roomNumber,
        Room.RoomType roomType,
        boolean occupied,
        BookingResponse currentBooking,
        List<BookingResponse> upcomingBookings
) {
}
