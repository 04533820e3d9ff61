package com.hotelhub.booking.job;

import com.hotelhub.booking.domain.access.Actor;
import com.hotelhub.booking.domain.model.Booking.BookingStatus;
import com.hotelhub.booking.domain.repository.BookingRepository;
import com.hotelhub.booking.domain.service.BookingService;
import com.hotelhub.booking.exception.InvalidStateTransitionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static com.hotelhub.booking.BookingFixtures.booking;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class BookingCompletionJobTest {

    private static final LocalDate TODAY = LocalDate.of(2027, 1, 10);

    @Mock
    private BookingRepository bookingRepository;
    @Mock
    private BookingService bookingService;

    private BookingCompletionJob job;

    @BeforeEach
    void setUp() {
        job = new BookingCompletionJob(bookingRepository, bookingService,
                Clock.fixed(TODAY.atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC));
        ReflectionTestUtils.setField(job, "enabled", true);
    }

    @Test
    @DisplayName("confirmed stays checked out by today are completed; one failure does not stop the rest")
    void completesDueBookings() {
        given(bookingRepository.findByStatusAndCheckOutDateLessThanEqual(BookingStatus.CONFIRMED, TODAY))
                .willReturn(List.of(
                        booking(1L, 10L, 1L, TODAY.minusDays(3), TODAY, BookingStatus.CONFIRMED),
                        booking(2L, 11L, 2L, TODAY.minusDays(5), TODAY.minusDays(1), BookingStatus.CONFIRMED)));
        given(bookingService.completeBooking(any(Actor.class), eq(1L)))
                .willThrow(new InvalidStateTransitionException(1L, BookingStatus.CANCELLED, BookingStatus.COMPLETED));
        given(bookingService.completeBooking(any(Actor.class), eq(2L))).willReturn(null);

        job.completeFinishedStays();

        verify(bookingService).completeBooking(Actor.system(), 1L);
        verify(bookingService).completeBooking(Actor.system(), 2L);
    }

    @Test
    @DisplayName("a disabled job does nothing")
    void disabled() {
        ReflectionTestUtils.setField(job, "enabled", false);

        job.completeFinishedStays();

        verifyNoInteractions(bookingRepository, bookingService);
    }
}
