package com.hotelhub.booking.domain.pricing;

import com.hotelhub.booking.domain.model.Offer;
import com.hotelhub.booking.domain.model.Room;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Map;

/**
 * Computes booking totals with the pricing strategy named in
 * {@code hotel.booking.pricing.strategy} (standard | long-stay).
 * Spring injects every {@link PricingStrategy} bean into the map, keyed by bean name.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PriceCalculator {

    private static final String DEFAULT_STRATEGY = "standard";

    private final Map<String, PricingStrategy> pricingStrategies;

    @Value("${hotel.booking.pricing.strategy:standard}")
    private String strategyType;

    @PostConstruct
    public void init() {
        log.info("Initialized PriceCalculator with strategy: {}", getPricingStrategy().getStrategyType());
    }

    public BigDecimal computePrice(Room room, LocalDate checkIn, LocalDate checkOut, Collection<Offer> offers) {
        return getPricingStrategy().calculateTotal(room, checkIn, checkOut, offers);
    }

    private PricingStrategy getPricingStrategy() {
        PricingStrategy strategy = pricingStrategies.get(strategyType.toLowerCase());
        if (strategy == null) {
            log.warn("Unknown pricing strategy: {}. Available strategies: {}. Defaulting to {}",
                    strategyType, pricingStrategies.keySet(), DEFAULT_STRATEGY);
            strategy = pricingStrategies.get(DEFAULT_STRATEGY);
            if (strategy == null) {
                throw new IllegalStateException(
                        "standard pricing strategy not found. Available strategies: " + pricingStrategies.keySet());
            }
        }
        return strategy;
    }
}
