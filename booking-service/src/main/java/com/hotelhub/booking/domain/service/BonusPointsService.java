package com.hotelhub.booking.domain.service;

import com.hotelhub.booking.domain.model.Booking;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Loyalty points for completed stays: one point per full 10 of the booking total.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BonusPointsService {

    private static final BigDecimal CURRENCY_PER_POINT = BigDecimal.TEN;

    private final UserAccountService userAccountService;

    public int pointsFor(BigDecimal totalPrice) {
        return totalPrice.divide(CURRENCY_PER_POINT, 0, RoundingMode.FLOOR).intValueExact();
    }

    /**
     * Credits the booking owner once. The {@code bonusAwarded} flag is persisted with the booking,
     * so a repeated call for the same booking awards nothing.
     *
     * @return points credited by this call
     */
    public int awardForCompletion(Booking booking) {
        if (booking.isBonusAwarded()) {
            log.debug("Bonus for booking {} already awarded", booking.getId());
            return 0;
        }
        int points = pointsFor(booking.getTotalPrice());
        userAccountService.addBonusPoints(booking.getUserId(), points);
        booking.setBonusAwarded(true);
        log.info("Awarded {} bonus points to user {} for booking {}", points, booking.getUserId(), booking.getId());
        return points;
    }
}
