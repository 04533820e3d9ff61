package com.hotelhub.booking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * Room record from the room directory. Managed by hotel staff; the booking engine only reads it
 * and locks it while checking and writing bookings.
 */
@Entity
@Table(name = "rooms", indexes = {
        @Index(name = "idx_rooms_room_number", columnList = "room_number", unique = true)
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Room {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "room_number", nullable = false, unique = true, length = 10)
    private String roomNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "room_type", nullable = false, length = 20)
    private RoomType roomType;

    @Column(name = "price_per_night", nullable = false, precision = 10, scale = 2)
    private BigDecimal pricePerNight;

    @Column(name = "capacity", nullable = false)
    private Integer capacity;

    @Builder.Default
    @Column(name = "is_available", nullable = false)
    private boolean available = true;

    @Column(name = "floor")
    private Integer floor;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "amenities", columnDefinition = "TEXT")
    private String amenities;

    @Version
    @Column(name = "version")
    private Long version; // bumped by the optimistic room lock

    public boolean canHost(int guests) {
        return guests >= 1 && guests <= capacity;
    }

    public enum RoomType {
        SINGLE,
        DOUBLE,
        SUITE,
        DELUXE
    }
}
