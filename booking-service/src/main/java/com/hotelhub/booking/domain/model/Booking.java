package com.hotelhub.booking.domain.model;

import com.hotelhub.booking.exception.InvalidStateTransitionException;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Set;

/**
 * Booking entity representing a stay in one room over the half-open range
 * [checkInDate, checkOutDate).
 */
@Entity
@Table(name = "bookings", indexes = {
        @Index(name = "idx_bookings_user_id", columnList = "user_id"),
        @Index(name = "idx_bookings_room_dates", columnList = "room_id,check_in_date,check_out_date"),
        @Index(name = "idx_bookings_status", columnList = "status")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Booking {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "room_id", nullable = false)
    private Long roomId;

    @Column(name = "check_in_date", nullable = false)
    private LocalDate checkInDate;

    @Column(name = "check_out_date", nullable = false)
    private LocalDate checkOutDate;

    @Column(name = "guests_count", nullable = false)
    private Integer guestsCount;

    @Column(name = "special_requests", columnDefinition = "TEXT")
    private String specialRequests;

    @Builder.Default
    @ManyToMany(fetch = FetchType.EAGER)
    @JoinTable(name = "booking_offers",
            joinColumns = @JoinColumn(name = "booking_id"),
            inverseJoinColumns = @JoinColumn(name = "offer_id"))
    private Set<Offer> selectedOffers = new HashSet<>();

    @Column(name = "total_price", nullable = false, precision = 10, scale = 2)
    private BigDecimal totalPrice;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BookingStatus status;

    @Column(name = "bonus_awarded", nullable = false)
    private boolean bonusAwarded;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
        if (status == null) {
            status = BookingStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public long getNights() {
        return ChronoUnit.DAYS.between(checkInDate, checkOutDate);
    }

    public boolean isActive() {
        return status.blocksRoom();
    }

    /**
     * True when this stay covers {@code date}; the check-out day itself is free.
     */
    public boolean covers(LocalDate date) {
        return !checkInDate.isAfter(date) && date.isBefore(checkOutDate);
    }

    /**
     * Half-open interval overlap: [a,b) and [c,d) overlap iff a &lt; d and c &lt; b.
     */
    public boolean overlaps(LocalDate checkIn, LocalDate checkOut) {
        return checkInDate.isBefore(checkOut) && checkIn.isBefore(checkOutDate);
    }

    /**
     * Moves the booking to {@code target} or fails with the current and requested state.
     */
    public void transitionTo(BookingStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStateTransitionException(id, status, target);
        }
        this.status = target;
    }

    public enum BookingStatus {
        PENDING,
        CONFIRMED,
        COMPLETED,
        CANCELLED;

        private static final Set<BookingStatus> ROOM_BLOCKING = EnumSet.of(PENDING, CONFIRMED);

        public boolean blocksRoom() {
            return ROOM_BLOCKING.contains(this);
        }

        public boolean canTransitionTo(BookingStatus target) {
            return switch (this) {
                case PENDING -> target == CONFIRMED || target == CANCELLED;
                case CONFIRMED -> target == COMPLETED || target == CANCELLED;
                case COMPLETED, CANCELLED -> false;
            };
        }

        public static Set<BookingStatus> roomBlocking() {
            return EnumSet.copyOf(ROOM_BLOCKING);
        }
    }
}
