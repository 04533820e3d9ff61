package com.hotelhub.booking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.Set;

/**
 * Paid add-on service (breakfast, spa, late checkout) that a guest can attach to a booking.
 * GLOBAL offers apply to every room; ROOM_SPECIFIC offers only to the rooms listed in {@code roomIds}.
 */
@Entity
@Table(name = "offers")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Offer {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "description", length = 500)
    private String description;

    @Column(name = "price", nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "offer_type", nullable = false, length = 20)
    private OfferType offerType = OfferType.GLOBAL;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "room_offers", joinColumns = @JoinColumn(name = "offer_id"))
    @Column(name = "room_id")
    private Set<Long> roomIds = new HashSet<>();

    public boolean isEligibleFor(Long roomId) {
        return offerType == OfferType.GLOBAL || roomIds.contains(roomId);
    }

    public boolean isBookableFor(Long roomId) {
        return active && isEligibleFor(roomId);
    }

    public enum OfferType {
        GLOBAL,
        ROOM_SPECIFIC
    }
}
