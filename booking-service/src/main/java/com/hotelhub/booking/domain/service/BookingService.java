package com.hotelhub.booking.domain.service;

import com.hotelhub.booking.api.dto.BookedDateRange;
import com.hotelhub.booking.api.dto.BookingResponse;
import com.hotelhub.booking.api.dto.CreateBookingRequest;
import com.hotelhub.booking.api.dto.UpdateBookingRequest;
import com.hotelhub.booking.domain.access.Actor;
import com.hotelhub.booking.domain.access.BookingAccessPolicy;
import com.hotelhub.booking.domain.access.BookingAction;
import com.hotelhub.booking.domain.model.Booking;
import com.hotelhub.booking.domain.model.Booking.BookingStatus;
import com.hotelhub.booking.domain.model.Offer;
import com.hotelhub.booking.domain.model.Room;
import com.hotelhub.booking.domain.pricing.PriceCalculator;
import com.hotelhub.booking.domain.repository.BookingRepository;
import com.hotelhub.booking.domain.strategy.RoomLockStrategy;
import com.hotelhub.booking.events.BookingEventPublisher;
import com.hotelhub.booking.exception.BookingConflictException;
import com.hotelhub.booking.exception.InvalidStateTransitionException;
import com.hotelhub.common.exception.ResourceNotFoundException;
import com.hotelhub.common.exception.ValidationException;
import com.hotelhub.common.util.Constants;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Booking lifecycle: creation, edits, extensions and status transitions.
 *
 * Writes that depend on a room's calendar (create, update, extend) run through the configured
 * {@link RoomLockStrategy} so the availability check and the write share one locked transaction.
 * Those methods must not join an outer transaction: the optimistic strategy retries the unit of
 * work in a fresh transaction per attempt.
 * Status transitions lock the booking row instead.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingService {

    private static final String DEFAULT_LOCK_STRATEGY = "pessimistic";
    private static final int DEFAULT_BOOKED_DATES_WINDOW_DAYS = 365;

    private final BookingRepository bookingRepository;
    private final RoomDirectory roomDirectory;
    private final OfferCatalog offerCatalog;
    private final UserAccountService userAccountService;
    private final AvailabilityService availabilityService;
    private final PriceCalculator priceCalculator;
    private final BonusPointsService bonusPointsService;
    private final BookingAccessPolicy accessPolicy;
    private final BookingEventPublisher eventPublisher;
    private final Map<String, RoomLockStrategy> lockStrategies;
    private final Clock clock;

    @Value("${hotel.booking.lock.strategy:pessimistic}")
    private String lockStrategyType;

    @Value("${hotel.booking.max-extension-days:30}")
    private int maxExtensionDays;

    @PostConstruct
    public void init() {
        log.info("Initialized BookingService with lock strategy: {}, max extension: {} days",
                getLockStrategy().getStrategyType(), maxExtensionDays);
    }

    public BookingResponse createBooking(Actor actor, CreateBookingRequest request) {
        log.info("Creating booking for user {} in room {} ({} - {})",
                actor.userId(), request.roomId(), request.checkInDate(), request.checkOutDate());

        requireOrderedDates(request.checkInDate(), request.checkOutDate());
        requireNotInPast(request.checkInDate());
        userAccountService.getUser(actor.userId());

        Booking saved = getLockStrategy().executeWithRoomLock(request.roomId(), room -> {
            if (!room.isAvailable()) {
                throw new ValidationException("Room " + room.getRoomNumber() + " is not available for booking");
            }
            requireCapacity(room, request.guestsCount());
            Set<Offer> offers = offerCatalog.resolveSelection(room, request.offerIds());
            requireNoConflicts(room.getId(), request.checkInDate(), request.checkOutDate(), null);

            Booking booking = Booking.builder()
                    .userId(actor.userId())
                    .roomId(room.getId())
                    .checkInDate(request.checkInDate())
                    .checkOutDate(request.checkOutDate())
                    .guestsCount(request.guestsCount())
                    .specialRequests(request.specialRequests())
                    .selectedOffers(offers)
                    .totalPrice(priceCalculator.computePrice(
                            room, request.checkInDate(), request.checkOutDate(), offers))
                    .status(BookingStatus.PENDING)
                    .build();
            return bookingRepository.save(booking);
        });

        log.info("Booking {} created for user {} in room {}, total {}",
                saved.getId(), saved.getUserId(), saved.getRoomId(), saved.getTotalPrice());
        return BookingResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public BookingResponse getBooking(Actor actor, Long bookingId) {
        Booking booking = findBooking(bookingId);
        accessPolicy.check(actor, BookingAction.VIEW, booking);
        return BookingResponse.from(booking);
    }

    @Transactional(readOnly = true)
    public List<BookingResponse> getMyBookings(Actor actor) {
        return bookingRepository.findByUserIdOrderByCheckInDateDesc(actor.userId()).stream()
                .map(BookingResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<BookingResponse> getAllBookings(Actor actor, int page, int size) {
        accessPolicy.check(actor, BookingAction.LIST_ALL);
        if (page < 0) {
            throw new ValidationException("Page index must not be negative");
        }
        int pageSize = Math.min(Math.max(size, 1), Constants.MAX_PAGE_SIZE);
        return bookingRepository.findAllByOrderByCheckInDateDesc(PageRequest.of(page, pageSize)).stream()
                .map(BookingResponse::from)
                .toList();
    }

    /**
     * Edits guests, notes, dates or offers of an open booking. The price is recomputed when the
     * dates or the offer selection change; the status is never touched here.
     */
    public BookingResponse updateBooking(Actor actor, Long bookingId, UpdateBookingRequest request) {
        Booking current = findBooking(bookingId);
        accessPolicy.check(actor, BookingAction.UPDATE, current);

        Booking updated = getLockStrategy().executeWithRoomLock(current.getRoomId(), room -> {
            Booking booking = lockBooking(bookingId);
            requireOpen(booking, "updated");

            if (request.guestsCount() != null) {
                requireCapacity(room, request.guestsCount());
                booking.setGuestsCount(request.guestsCount());
            }
            if (request.specialRequests() != null) {
                booking.setSpecialRequests(request.specialRequests());
            }

            if (request.changesDates() || request.changesOffers()) {
                LocalDate checkIn = request.checkInDate() != null ? request.checkInDate() : booking.getCheckInDate();
                LocalDate checkOut = request.checkOutDate() != null ? request.checkOutDate() : booking.getCheckOutDate();
                requireOrderedDates(checkIn, checkOut);
                if (request.checkInDate() != null) {
                    requireNotInPast(checkIn);
                }
                if (request.changesDates()) {
                    requireNoConflicts(room.getId(), checkIn, checkOut, booking.getId());
                }
                Set<Offer> offers = request.changesOffers()
                        ? offerCatalog.resolveSelection(room, request.offerIds())
                        : booking.getSelectedOffers();

                booking.setCheckInDate(checkIn);
                booking.setCheckOutDate(checkOut);
                booking.setSelectedOffers(offers);
                booking.setTotalPrice(priceCalculator.computePrice(room, checkIn, checkOut, offers));
            }
            return bookingRepository.save(booking);
        });

        log.info("Booking {} updated by user {}", bookingId, actor.userId());
        return BookingResponse.from(updated);
    }

    /**
     * Pushes the check-out date back by {@code days}. On a conflict nothing changes and the
     * conflicting bookings are reported.
     */
    public BookingResponse extendBooking(Actor actor, Long bookingId, int days) {
        Booking current = findBooking(bookingId);
        accessPolicy.check(actor, BookingAction.EXTEND, current);
        if (days < 1 || days > maxExtensionDays) {
            throw new ValidationException(
                    String.format("Extension must be between 1 and %d days", maxExtensionDays));
        }

        Booking extended = getLockStrategy().executeWithRoomLock(current.getRoomId(), room -> {
            Booking booking = lockBooking(bookingId);
            requireOpen(booking, "extended");

            LocalDate newCheckOut = booking.getCheckOutDate().plusDays(days);
            requireNoConflicts(room.getId(), booking.getCheckInDate(), newCheckOut, booking.getId());

            // priced from scratch; offers retired since booking are skipped by the strategy
            BigDecimal total = priceCalculator.computePrice(
                    room, booking.getCheckInDate(), newCheckOut, booking.getSelectedOffers());
            booking.setCheckOutDate(newCheckOut);
            booking.setTotalPrice(total);
            return bookingRepository.save(booking);
        });

        log.info("Booking {} extended by {} day(s) to {}, new total {}",
                bookingId, days, extended.getCheckOutDate(), extended.getTotalPrice());
        return BookingResponse.from(extended);
    }

    @Transactional
    public BookingResponse confirmBooking(Actor actor, Long bookingId) {
        Booking booking = lockBooking(bookingId);
        accessPolicy.check(actor, BookingAction.CONFIRM, booking);

        booking.transitionTo(BookingStatus.CONFIRMED);
        booking = bookingRepository.save(booking);
        eventPublisher.publishBookingConfirmed(booking);

        log.info("Booking {} confirmed by user {}", bookingId, actor.userId());
        return BookingResponse.from(booking);
    }

    /**
     * Staff rejection of a pending request. Unlike cancel, a confirmed booking cannot be declined.
     */
    @Transactional
    public BookingResponse declineBooking(Actor actor, Long bookingId) {
        Booking booking = lockBooking(bookingId);
        accessPolicy.check(actor, BookingAction.DECLINE, booking);

        if (booking.getStatus() != BookingStatus.PENDING) {
            throw new InvalidStateTransitionException(bookingId, booking.getStatus(), "declined");
        }
        booking.transitionTo(BookingStatus.CANCELLED);
        booking = bookingRepository.save(booking);
        eventPublisher.publishBookingCancelled(booking, "Declined by staff");

        log.info("Booking {} declined by user {}", bookingId, actor.userId());
        return BookingResponse.from(booking);
    }

    @Transactional
    public BookingResponse cancelBooking(Actor actor, Long bookingId) {
        Booking booking = lockBooking(bookingId);
        accessPolicy.check(actor, BookingAction.CANCEL, booking);

        booking.transitionTo(BookingStatus.CANCELLED);
        booking = bookingRepository.save(booking);
        eventPublisher.publishBookingCancelled(booking,
                actor.owns(booking.getUserId()) ? "Cancelled by guest" : "Cancelled by staff");

        log.info("Booking {} cancelled by user {}", bookingId, actor.userId());
        return BookingResponse.from(booking);
    }

    /**
     * Marks a confirmed stay as completed and credits bonus points to its owner. Completing a booking
     * that is already completed returns it unchanged and awards nothing.
     */
    @Transactional
    public BookingResponse completeBooking(Actor actor, Long bookingId) {
        Booking booking = lockBooking(bookingId);
        accessPolicy.check(actor, BookingAction.COMPLETE, booking);

        if (booking.getStatus() == BookingStatus.COMPLETED) {
            log.debug("Booking {} already completed", bookingId);
            return BookingResponse.from(booking);
        }
        booking.transitionTo(BookingStatus.COMPLETED);
        int points = bonusPointsService.awardForCompletion(booking);
        booking = bookingRepository.save(booking);
        eventPublisher.publishBookingCompleted(booking, points);

        log.info("Booking {} completed, {} bonus points awarded to user {}", bookingId, points, booking.getUserId());
        return BookingResponse.from(booking);
    }

    @Transactional
    public void deleteBooking(Actor actor, Long bookingId) {
        Booking booking = findBooking(bookingId);
        accessPolicy.check(actor, BookingAction.DELETE, booking);
        bookingRepository.delete(booking);
        log.info("Booking {} deleted by user {}", bookingId, actor.userId());
    }

    /**
     * Pending and confirmed stays of a room overlapping [start, end). Without bounds the window is
     * today to one year ahead.
     */
    @Transactional(readOnly = true)
    public List<BookedDateRange> getBookedDates(Long roomId, LocalDate start, LocalDate end) {
        roomDirectory.getRoom(roomId);
        LocalDate from = start != null ? start : LocalDate.now(clock);
        LocalDate to = end != null ? end : from.plusDays(DEFAULT_BOOKED_DATES_WINDOW_DAYS);
        requireOrderedDates(from, to);

        return bookingRepository.findOverlapping(roomId, from, to, BookingStatus.roomBlocking()).stream()
                .sorted(Comparator.comparing(Booking::getCheckInDate))
                .map(BookedDateRange::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public AvailabilityResult checkAvailability(Long roomId, LocalDate checkIn, LocalDate checkOut) {
        roomDirectory.getRoom(roomId);
        return availabilityService.checkAvailability(roomId, checkIn, checkOut, null);
    }

    /**
     * Offers a guest may attach when booking this room.
     */
    @Transactional(readOnly = true)
    public List<Offer> getRoomOffers(Long roomId) {
        roomDirectory.getRoom(roomId);
        return offerCatalog.getOffersFor(roomId);
    }

    private Booking findBooking(Long bookingId) {
        return bookingRepository.findById(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
    }

    private Booking lockBooking(Long bookingId) {
        return bookingRepository.findByIdForUpdate(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
    }

    private void requireNoConflicts(Long roomId, LocalDate checkIn, LocalDate checkOut, Long excludingBookingId) {
        AvailabilityResult result = availabilityService.checkAvailability(roomId, checkIn, checkOut, excludingBookingId);
        if (!result.available()) {
            log.warn("Room {} already booked for {} - {}", roomId, checkIn, checkOut);
            throw new BookingConflictException(roomId, checkIn, checkOut, result.conflictingBookings());
        }
    }

    private static void requireOpen(Booking booking, String operation) {
        if (!booking.isActive()) {
            throw new InvalidStateTransitionException(booking.getId(), booking.getStatus(), operation);
        }
    }

    private static void requireCapacity(Room room, Integer guests) {
        if (guests == null || !room.canHost(guests)) {
            throw new ValidationException(String.format(
                    "Room %s hosts at most %d guests, requested %s", room.getRoomNumber(), room.getCapacity(), guests));
        }
    }

    private static void requireOrderedDates(LocalDate checkIn, LocalDate checkOut) {
        if (checkIn == null || checkOut == null || !checkIn.isBefore(checkOut)) {
            throw new ValidationException("Check-out date must be after check-in date");
        }
    }

    private void requireNotInPast(LocalDate checkIn) {
        if (checkIn.isBefore(LocalDate.now(clock))) {
            throw new ValidationException("Check-in date cannot be in the past");
        }
    }

    private RoomLockStrategy getLockStrategy() {
        RoomLockStrategy strategy = lockStrategies.get(lockStrategyType.toLowerCase());
        if (strategy == null) {
            log.warn("Unknown lock strategy: {}. Available strategies: {}. Defaulting to {}",
                    lockStrategyType, lockStrategies.keySet(), DEFAULT_LOCK_STRATEGY);
            strategy = lockStrategies.get(DEFAULT_LOCK_STRATEGY);
            if (strategy == null) {
                throw new IllegalStateException(
                        "pessimistic lock strategy not found. Available strategies: " + lockStrategies.keySet());
            }
        }
        return strategy;
    }
}
