package com.hotelhub.booking.domain.service;

import com.hotelhub.booking.domain.model.Booking;
import com.hotelhub.booking.domain.model.Booking.BookingStatus;
import com.hotelhub.booking.domain.repository.BookingRepository;
import com.hotelhub.common.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;

/**
 * Overlap test between a requested stay and the pending/confirmed bookings of a room.
 *
 * Ranges are half-open, so a booking ending on the 5th and one starting on the 5th do not conflict.
 * Runs inside the caller's transaction; when the caller holds the room lock the answer stays valid
 * until that transaction commits.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AvailabilityService {

    private final BookingRepository bookingRepository;

    /**
     * @param excludingBookingId booking to leave out of the conflict set (the one being extended or edited); may be null
     */
    public AvailabilityResult checkAvailability(Long roomId, LocalDate checkIn, LocalDate checkOut, Long excludingBookingId) {
        if (checkIn == null || checkOut == null || !checkIn.isBefore(checkOut)) {
            throw new ValidationException("Check-out date must be after check-in date");
        }

        List<Booking> conflicts = bookingRepository.findByRoomIdAndStatusIn(roomId, BookingStatus.roomBlocking()).stream()
                .filter(existing -> excludingBookingId == null || !excludingBookingId.equals(existing.getId()))
                .filter(existing -> existing.overlaps(checkIn, checkOut))
                .sorted(Comparator.comparing(Booking::getCheckInDate))
                .toList();

        if (!conflicts.isEmpty()) {
            log.debug("Room {} unavailable for {} - {}: {} conflicting booking(s)",
                    roomId, checkIn, checkOut, conflicts.size());
        }
        return AvailabilityResult.of(conflicts);
    }
}
