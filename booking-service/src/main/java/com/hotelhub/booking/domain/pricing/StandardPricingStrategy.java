package com.hotelhub.booking.domain.pricing;

import com.hotelhub.booking.domain.model.Offer;
import com.hotelhub.booking.domain.model.Room;
import com.hotelhub.common.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Collection;

/**
 * total = nights * pricePerNight + sum(bookable offer prices).
 */
@Component("standard")
public class StandardPricingStrategy implements PricingStrategy {

    static final int CURRENCY_SCALE = 2;

    @Override
    public BigDecimal calculateTotal(Room room, LocalDate checkIn, LocalDate checkOut, Collection<Offer> offers) {
        long nights = nightsBetween(checkIn, checkOut);
        BigDecimal base = room.getPricePerNight().multiply(BigDecimal.valueOf(nights));
        return base.add(offersTotal(room, offers)).setScale(CURRENCY_SCALE, RoundingMode.HALF_UP);
    }

    @Override
    public String getStrategyType() {
        return "STANDARD";
    }

    static long nightsBetween(LocalDate checkIn, LocalDate checkOut) {
        long nights = ChronoUnit.DAYS.between(checkIn, checkOut);
        if (nights <= 0) {
            throw new ValidationException("Check-out date must be after check-in date");
        }
        return nights;
    }

    private BigDecimal offersTotal(Room room, Collection<Offer> offers) {
        if (offers == null) {
            return BigDecimal.ZERO;
        }
        return offers.stream()
                .filter(offer -> offer.isBookableFor(room.getId()))
                .map(Offer::getPrice)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
