package com.hotelhub.booking.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingCompletedEvent {
    private Long bookingId;
    private Long userId;
    private Long roomId;
    private BigDecimal totalPrice;
    private int bonusPointsAwarded;
    private Instant timestamp;
}
