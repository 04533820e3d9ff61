package com.hotelhub.booking.job;

import com.hotelhub.booking.domain.access.Actor;
import com.hotelhub.booking.domain.model.Booking;
import com.hotelhub.booking.domain.model.Booking.BookingStatus;
import com.hotelhub.booking.domain.repository.BookingRepository;
import com.hotelhub.booking.domain.service.BookingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Scheduled job that completes confirmed bookings whose check-out date has been reached.
 * Each booking is completed in its own transaction; one failure does not stop the batch.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingCompletionJob {

    private final BookingRepository bookingRepository;
    private final BookingService bookingService;
    private final Clock clock;

    @Value("${hotel.booking.completion-job.enabled:true}")
    private boolean enabled;

    @Scheduled(fixedDelayString = "${hotel.booking.completion-job.interval-ms:3600000}",
            initialDelayString = "${hotel.booking.completion-job.initial-delay-ms:60000}")
    public void completeFinishedStays() {
        if (!enabled) return;
        LocalDate today = LocalDate.now(clock);
        List<Booking> due = bookingRepository.findByStatusAndCheckOutDateLessThanEqual(BookingStatus.CONFIRMED, today);
        if (due.isEmpty()) return;

        log.info("Completion job: {} confirmed booking(s) checked out by {}", due.size(), today);
        Actor system = Actor.system();
        int completed = 0;
        for (Booking booking : due) {
            try {
                bookingService.completeBooking(system, booking.getId());
                completed++;
            } catch (Exception e) {
                log.error("Completion failed for booking {}", booking.getId(), e);
            }
        }
        log.info("Completion job: completed {} of {} booking(s)", completed, due.size());
    }
}
