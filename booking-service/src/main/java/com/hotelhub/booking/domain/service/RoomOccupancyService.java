package com.hotelhub.booking.domain.service;

import com.hotelhub.booking.api.dto.BookingResponse;
import com.hotelhub.booking.api.dto.RoomOccupancyResponse;
import com.hotelhub.booking.domain.access.Actor;
import com.hotelhub.booking.domain.access.BookingAccessPolicy;
import com.hotelhub.booking.domain.access.BookingAction;
import com.hotelhub.booking.domain.model.Booking;
import com.hotelhub.booking.domain.model.Booking.BookingStatus;
import com.hotelhub.booking.domain.model.Room;
import com.hotelhub.booking.domain.repository.BookingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Front-desk view of every room on a given day: who is in it and who arrives next.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class RoomOccupancyService {

    static final int MAX_UPCOMING = 5;

    private static final Set<BookingStatus> NOT_CANCELLED =
            EnumSet.of(BookingStatus.PENDING, BookingStatus.CONFIRMED, BookingStatus.COMPLETED);

    private final RoomDirectory roomDirectory;
    private final BookingRepository bookingRepository;
    private final BookingAccessPolicy accessPolicy;
    private final Clock clock;

    /**
     * @param asOf day to report on; today when null
     */
    public List<RoomOccupancyResponse> roomOccupancy(Actor actor, LocalDate asOf) {
        accessPolicy.check(actor, BookingAction.VIEW_OCCUPANCY);
        LocalDate day = asOf != null ? asOf : LocalDate.now(clock);

        Map<Long, List<Booking>> byRoom = bookingRepository.findEndingAfter(day, NOT_CANCELLED).stream()
                .collect(Collectors.groupingBy(Booking::getRoomId));

        List<RoomOccupancyResponse> occupancy = roomDirectory.listRooms().stream()
                .map(room -> occupancyOf(room, byRoom.getOrDefault(room.getId(), Collections.emptyList()), day))
                .toList();

        log.debug("Occupancy as of {}: {} of {} rooms occupied", day,
                occupancy.stream().filter(RoomOccupancyResponse::occupied).count(), occupancy.size());
        return occupancy;
    }

    private static RoomOccupancyResponse occupancyOf(Room room, List<Booking> bookings, LocalDate day) {
        BookingResponse current = bookings.stream()
                .filter(b -> b.covers(day))
                .findFirst()
                .map(BookingResponse::from)
                .orElse(null);

        List<BookingResponse> upcoming = bookings.stream()
                .filter(b -> b.getCheckInDate().isAfter(day))
                .sorted(Comparator.comparing(Booking::getCheckInDate))
                .limit(MAX_UPCOMING)
                .map(BookingResponse::from)
                .toList();

        return new RoomOccupancyResponse(
                room.getId(), room.getRoomNumber(), room.getRoomType(), current != null, current, upcoming);
    }
}
