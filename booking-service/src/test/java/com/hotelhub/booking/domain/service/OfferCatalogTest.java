package com.hotelhub.booking.domain.service;

import com.hotelhub.booking.domain.model.Offer;
import com.hotelhub.booking.domain.model.Room;
import com.hotelhub.booking.domain.repository.OfferRepository;
import com.hotelhub.common.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;

import static com.hotelhub.booking.BookingFixtures.globalOffer;
import static com.hotelhub.booking.BookingFixtures.room;
import static com.hotelhub.booking.BookingFixtures.roomOffer;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class OfferCatalogTest {

    @Mock
    private OfferRepository offerRepository;

    @InjectMocks
    private OfferCatalog offerCatalog;

    private final Room room = room(1L, "100.00");

    @Test
    @DisplayName("offers for a room are the active global offers plus those linked to it")
    void getOffersFor_queriesGlobalAndLinkedOffers() {
        Offer breakfast = globalOffer(10L, "15.00");
        Offer butler = roomOffer(11L, "150.00", 1L);
        given(offerRepository.findActiveForRoom(1L, Offer.OfferType.GLOBAL)).willReturn(List.of(breakfast, butler));

        assertThat(offerCatalog.getOffersFor(1L)).containsExactly(breakfast, butler);
    }

    @Test
    @DisplayName("global and room-specific offers for the room are resolved in request order")
    void resolveSelection_bookableOffers() {
        Offer breakfast = globalOffer(10L, "15.00");
        Offer butler = roomOffer(11L, "150.00", 1L);
        given(offerRepository.findAllById(any())).willReturn(List.of(breakfast, butler));

        Set<Offer> selection = offerCatalog.resolveSelection(room, List.of(11L, 10L, 11L));

        assertThat(selection).containsExactly(butler, breakfast);
    }

    @Test
    @DisplayName("an unknown offer id rejects the selection")
    void resolveSelection_unknownId() {
        given(offerRepository.findAllById(any())).willReturn(List.of(globalOffer(10L, "15.00")));

        assertThatThrownBy(() -> offerCatalog.resolveSelection(room, List.of(10L, 99L)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Offer 99");
    }

    @Test
    @DisplayName("an inactive offer rejects the selection")
    void resolveSelection_inactive() {
        Offer retired = globalOffer(10L, "15.00");
        retired.setActive(false);
        given(offerRepository.findAllById(any())).willReturn(List.of(retired));

        assertThatThrownBy(() -> offerCatalog.resolveSelection(room, List.of(10L)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("an offer scoped to other rooms rejects the selection")
    void resolveSelection_otherRoom() {
        given(offerRepository.findAllById(any())).willReturn(List.of(roomOffer(11L, "150.00", 2L)));

        assertThatThrownBy(() -> offerCatalog.resolveSelection(room, List.of(11L)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("room R1");
    }

    @Test
    @DisplayName("an empty selection needs no lookup")
    void resolveSelection_empty() {
        assertThat(offerCatalog.resolveSelection(room, List.of())).isEmpty();
        assertThat(offerCatalog.resolveSelection(room, null)).isEmpty();
        verifyNoInteractions(offerRepository);
    }
}
