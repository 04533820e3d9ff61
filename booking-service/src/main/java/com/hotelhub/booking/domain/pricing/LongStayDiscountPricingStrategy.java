package com.hotelhub.booking.domain.pricing;

import com.hotelhub.booking.domain.model.Offer;
import com.hotelhub.booking.domain.model.Room;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Collection;

/**
 * Standard price, reduced by {@code discountRate} once the stay reaches {@code thresholdNights}.
 */
@Component("long-stay")
@RequiredArgsConstructor
public class LongStayDiscountPricingStrategy implements PricingStrategy {

    private final StandardPricingStrategy standardPricing;

    @Value("${hotel.booking.pricing.long-stay.threshold-nights:7}")
    private int thresholdNights;

    @Value("${hotel.booking.pricing.long-stay.discount-rate:0.10}")
    private BigDecimal discountRate;

    @Override
    public BigDecimal calculateTotal(Room room, LocalDate checkIn, LocalDate checkOut, Collection<Offer> offers) {
        BigDecimal total = standardPricing.calculateTotal(room, checkIn, checkOut, offers);
        long nights = StandardPricingStrategy.nightsBetween(checkIn, checkOut);
        if (nights < thresholdNights) {
            return total;
        }
        return total.multiply(BigDecimal.ONE.subtract(discountRate))
                .setScale(StandardPricingStrategy.CURRENCY_SCALE, RoundingMode.HALF_UP);
    }

    @Override
    public String getStrategyType() {
        return "LONG_STAY_DISCOUNT";
    }
}
