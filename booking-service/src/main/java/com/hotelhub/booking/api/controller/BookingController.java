package com.hotelhub.booking.api.controller;

import com.hotelhub.booking.api.dto.AvailabilityResponse;
import com.hotelhub.booking.api.dto.BookedDateRange;
import com.hotelhub.booking.api.dto.BookingResponse;
import com.hotelhub.booking.api.dto.CreateBookingRequest;
import com.hotelhub.booking.api.dto.ExtendBookingRequest;
import com.hotelhub.booking.api.dto.OfferSummary;
import com.hotelhub.booking.api.dto.UpdateBookingRequest;
import com.hotelhub.booking.domain.access.Actor;
import com.hotelhub.booking.domain.service.AvailabilityResult;
import com.hotelhub.booking.domain.service.BookingService;
import com.hotelhub.common.dto.BaseResponse;
import com.hotelhub.common.util.Constants;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

/**
 * REST controller for booking operations.
 * Caller identity comes from the X-User-Id / X-User-Role headers.
 */
@RestController
@RequestMapping("/api/v1/bookings")
@RequiredArgsConstructor
public class BookingController {

    private final BookingService bookingService;

    @PostMapping
    public ResponseEntity<BaseResponse<BookingResponse>> createBooking(
            @RequestHeader(Constants.HEADER_USER_ID) Long userId,
            @RequestHeader(Constants.HEADER_USER_ROLE) String role,
            @Valid @RequestBody CreateBookingRequest request) {
        BookingResponse response = bookingService.createBooking(RequestActors.from(userId, role), request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Booking created successfully", response));
    }

    @GetMapping("/my")
    public ResponseEntity<BaseResponse<List<BookingResponse>>> getMyBookings(
            @RequestHeader(Constants.HEADER_USER_ID) Long userId,
            @RequestHeader(Constants.HEADER_USER_ROLE) String role) {
        List<BookingResponse> response = bookingService.getMyBookings(RequestActors.from(userId, role));
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @GetMapping("/all")
    public ResponseEntity<BaseResponse<List<BookingResponse>>> getAllBookings(
            @RequestHeader(Constants.HEADER_USER_ID) Long userId,
            @RequestHeader(Constants.HEADER_USER_ROLE) String role,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "" + Constants.DEFAULT_PAGE_SIZE) int size) {
        List<BookingResponse> response = bookingService.getAllBookings(RequestActors.from(userId, role), page, size);
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<BookingResponse>> getBooking(
            @RequestHeader(Constants.HEADER_USER_ID) Long userId,
            @RequestHeader(Constants.HEADER_USER_ROLE) String role,
            @PathVariable Long id) {
        BookingResponse response = bookingService.getBooking(RequestActors.from(userId, role), id);
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @PutMapping("/{id}")
    public ResponseEntity<BaseResponse<BookingResponse>> updateBooking(
            @RequestHeader(Constants.HEADER_USER_ID) Long userId,
            @RequestHeader(Constants.HEADER_USER_ROLE) String role,
            @PathVariable Long id,
            @Valid @RequestBody UpdateBookingRequest request) {
        BookingResponse response = bookingService.updateBooking(RequestActors.from(userId, role), id, request);
        return ResponseEntity.ok(BaseResponse.success("Booking updated", response));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<BaseResponse<BookingResponse>> cancelBooking(
            @RequestHeader(Constants.HEADER_USER_ID) Long userId,
            @RequestHeader(Constants.HEADER_USER_ROLE) String role,
            @PathVariable Long id) {
        BookingResponse response = bookingService.cancelBooking(RequestActors.from(userId, role), id);
        return ResponseEntity.ok(BaseResponse.success("Booking cancelled", response));
    }

    @PostMapping("/{id}/confirm")
    public ResponseEntity<BaseResponse<BookingResponse>> confirmBooking(
            @RequestHeader(Constants.HEADER_USER_ID) Long userId,
            @RequestHeader(Constants.HEADER_USER_ROLE) String role,
            @PathVariable Long id) {
        BookingResponse response = bookingService.confirmBooking(RequestActors.from(userId, role), id);
        return ResponseEntity.ok(BaseResponse.success("Booking confirmed", response));
    }

    @PostMapping("/{id}/decline")
    public ResponseEntity<BaseResponse<BookingResponse>> declineBooking(
            @RequestHeader(Constants.HEADER_USER_ID) Long userId,
            @RequestHeader(Constants.HEADER_USER_ROLE) String role,
            @PathVariable Long id) {
        BookingResponse response = bookingService.declineBooking(RequestActors.from(userId, role), id);
        return ResponseEntity.ok(BaseResponse.success("Booking declined", response));
    }

    @PostMapping("/{id}/complete")
    public ResponseEntity<BaseResponse<BookingResponse>> completeBooking(
            @RequestHeader(Constants.HEADER_USER_ID) Long userId,
            @RequestHeader(Constants.HEADER_USER_ROLE) String role,
            @PathVariable Long id) {
        BookingResponse response = bookingService.completeBooking(RequestActors.from(userId, role), id);
        return ResponseEntity.ok(BaseResponse.success("Booking completed", response));
    }

    @PostMapping("/{id}/extend")
    public ResponseEntity<BaseResponse<BookingResponse>> extendBooking(
            @RequestHeader(Constants.HEADER_USER_ID) Long userId,
            @RequestHeader(Constants.HEADER_USER_ROLE) String role,
            @PathVariable Long id,
            @Valid @RequestBody ExtendBookingRequest request) {
        BookingResponse response = bookingService.extendBooking(RequestActors.from(userId, role), id, request.days());
        return ResponseEntity.ok(BaseResponse.success("Booking extended", response));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteBooking(
            @RequestHeader(Constants.HEADER_USER_ID) Long userId,
            @RequestHeader(Constants.HEADER_USER_ROLE) String role,
            @PathVariable Long id) {
        bookingService.deleteBooking(RequestActors.from(userId, role), id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/room/{roomId}/booked-dates")
    public ResponseEntity<BaseResponse<List<BookedDateRange>>> getBookedDates(
            @PathVariable Long roomId,
            @RequestParam(name = "start_date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        return ResponseEntity.ok(BaseResponse.success(bookingService.getBookedDates(roomId, startDate, endDate)));
    }

    @GetMapping("/room/{roomId}/offers")
    public ResponseEntity<BaseResponse<List<OfferSummary>>> getRoomOffers(@PathVariable Long roomId) {
        List<OfferSummary> offers = bookingService.getRoomOffers(roomId).stream()
                .map(OfferSummary::from)
                .toList();
        return ResponseEntity.ok(BaseResponse.success(offers));
    }

    @GetMapping("/room/{roomId}/availability")
    public ResponseEntity<BaseResponse<AvailabilityResponse>> checkAvailability(
            @PathVariable Long roomId,
            @RequestParam(name = "check_in") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate checkIn,
            @RequestParam(name = "check_out") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate checkOut) {
        AvailabilityResult result = bookingService.checkAvailability(roomId, checkIn, checkOut);
        return ResponseEntity.ok(BaseResponse.success(AvailabilityResponse.from(roomId, checkIn, checkOut, result)));
    }
}
