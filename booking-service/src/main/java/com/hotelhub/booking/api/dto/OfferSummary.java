package com.hotelhub.booking.api.dto;

import com.hotelhub.booking.domain.model.Offer;

import java.math.BigDecimal;

public record OfferSummary(
        Long id,
        String name,
        BigDecimal price,
        Offer.OfferType offerType
) {
    public static OfferSummary from(Offer offer) {
        return new OfferSummary(offer.getId(), offer.getName(), offer.getPrice(), offer.getOfferType());
    }
}
