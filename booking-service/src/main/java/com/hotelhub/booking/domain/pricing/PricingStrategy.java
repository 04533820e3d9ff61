package com.hotelhub.booking.domain.pricing;

import com.hotelhub.booking.domain.model.Offer;
import com.hotelhub.booking.domain.model.Room;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;

/**
 * Strategy interface for the total price of a stay.
 *
 * Implementations (bean names):
 * - standard: nightly rate times nights plus offers
 * - long-stay: standard total with a discount above a night threshold
 */
public interface PricingStrategy {

    /**
     * @param offers offers selected for the booking; those no longer active or not valid for the room are skipped
     * @return total rounded to two decimals, half-up
     */
    BigDecimal calculateTotal(Room room, LocalDate checkIn, LocalDate checkOut, Collection<Offer> offers);

    String getStrategyType();
}
