package com.hotelhub.booking.domain.repository;

import com.hotelhub.booking.domain.model.Offer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface OfferRepository extends JpaRepository<Offer, Long> {

    @Query("""
           SELECT DISTINCT o FROM Offer o LEFT JOIN o.roomIds rid
           WHERE o.active = true
             AND (o.offerType = :globalType OR rid = :roomId)
           ORDER BY o.name
           """)
    List<Offer> findActiveForRoom(@Param("roomId") Long roomId, @Param("globalType") Offer.OfferType globalType);
}
