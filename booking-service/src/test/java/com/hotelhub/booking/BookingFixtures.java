package com.hotelhub.booking;

import com.hotelhub.booking.domain.model.Booking;
import com.hotelhub.booking.domain.model.Offer;
import com.hotelhub.booking.domain.model.Room;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.Set;

/**
 * Builders for unsaved test entities with sensible defaults.
 */
public final class BookingFixtures {

    private BookingFixtures() {
    }

    public static Room room(Long id, String pricePerNight) {
        return Room.builder()
                .id(id)
                .roomNumber("R" + id)
                .roomType(Room.RoomType.DOUBLE)
                .pricePerNight(new BigDecimal(pricePerNight))
                .capacity(2)
                .available(true)
                .floor(1)
                .build();
    }

    public static Offer globalOffer(Long id, String price) {
        return Offer.builder()
                .id(id)
                .name("Offer " + id)
                .price(new BigDecimal(price))
                .offerType(Offer.OfferType.GLOBAL)
                .active(true)
                .build();
    }

    public static Offer roomOffer(Long id, String price, Long... roomIds) {
        return Offer.builder()
                .id(id)
                .name("Room offer " + id)
                .price(new BigDecimal(price))
                .offerType(Offer.OfferType.ROOM_SPECIFIC)
                .active(true)
                .roomIds(new HashSet<>(Set.of(roomIds)))
                .build();
    }

    public static Booking booking(Long id, Long userId, Long roomId, LocalDate checkIn, LocalDate checkOut,
                                  Booking.BookingStatus status) {
        return Booking.builder()
                .id(id)
                .userId(userId)
                .roomId(roomId)
                .checkInDate(checkIn)
                .checkOutDate(checkOut)
                .guestsCount(1)
                .totalPrice(new BigDecimal("100.00"))
                .status(status)
                .build();
    }
}
