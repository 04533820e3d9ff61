package com.hotelhub.booking.domain.repository;

import com.hotelhub.booking.domain.model.Booking;
import com.hotelhub.booking.domain.model.Booking.BookingStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface BookingRepository extends JpaRepository<Booking, Long> {

    List<Booking> findByUserIdOrderByCheckInDateDesc(Long userId);

    List<Booking> findAllByOrderByCheckInDateDesc(Pageable pageable);

    List<Booking> findByRoomIdAndStatusIn(Long roomId, Collection<BookingStatus> statuses);

    /**
     * Bookings of a room in the given statuses whose stay overlaps [checkIn, checkOut).
     * Same-day turnover (existing check-out == requested check-in) is not an overlap.
     */
    @Query("""
           SELECT b FROM Booking b
           WHERE b.roomId = :roomId
             AND b.status IN :statuses
             AND b.checkInDate < :checkOut
             AND b.checkOutDate > :checkIn
           ORDER BY b.checkInDate
           """)
    List<Booking> findOverlapping(@Param("roomId") Long roomId,
                                  @Param("checkIn") LocalDate checkIn,
                                  @Param("checkOut") LocalDate checkOut,
                                  @Param("statuses") Collection<BookingStatus> statuses);

    /**
     * Bookings in the given statuses still relevant after {@code asOf}, used by the occupancy view.
     */
    @Query("""
           SELECT b FROM Booking b
           WHERE b.status IN :statuses
             AND b.checkOutDate > :asOf
           ORDER BY b.roomId, b.checkInDate
           """)
    List<Booking> findEndingAfter(@Param("asOf") LocalDate asOf,
                                  @Param("statuses") Collection<BookingStatus> statuses);

    /**
     * Row lock on a single booking so concurrent transitions (and bonus awards) serialize.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM Booking b WHERE b.id = :id")
    Optional<Booking> findByIdForUpdate(@Param("id") Long id);

    /** For the completion job: confirmed stays whose check-out date has passed. */
    List<Booking> findByStatusAndCheckOutDateLessThanEqual(BookingStatus status, LocalDate date);
}
