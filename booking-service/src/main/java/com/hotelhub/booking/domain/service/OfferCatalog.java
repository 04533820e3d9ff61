package com.hotelhub.booking.domain.service;

import com.hotelhub.booking.domain.model.Offer;
import com.hotelhub.booking.domain.model.Room;
import com.hotelhub.booking.domain.repository.OfferRepository;
import com.hotelhub.common.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Offer lookups for the booking engine.
 *
 * Selections are validated strictly: an id that is unknown, inactive, or scoped to other rooms
 * rejects the whole request instead of being dropped silently.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class OfferCatalog {

    private final OfferRepository offerRepository;

    /**
     * Active offers a guest may attach to a booking of this room: all global offers plus the
     * room-specific offers linked to it.
     */
    public List<Offer> getOffersFor(Long roomId) {
        return offerRepository.findActiveForRoom(roomId, Offer.OfferType.GLOBAL);
    }

    /**
     * Turns requested offer ids into offers bookable for {@code room}.
     *
     * @throws ValidationException when any id is not a bookable offer for the room
     */
    public Set<Offer> resolveSelection(Room room, Collection<Long> offerIds) {
        if (offerIds == null || offerIds.isEmpty()) {
            return new LinkedHashSet<>();
        }
        Set<Long> requested = new LinkedHashSet<>(offerIds);
        Map<Long, Offer> found = offerRepository.findAllById(requested).stream()
                .collect(Collectors.toMap(Offer::getId, Function.identity()));

        Set<Offer> selection = new LinkedHashSet<>();
        for (Long offerId : requested) {
            Offer offer = found.get(offerId);
            if (offer == null || !offer.isBookableFor(room.getId())) {
                log.warn("Rejected offer {} for room {}", offerId, room.getRoomNumber());
                throw new ValidationException(
                        String.format("Offer %d is not available for room %s", offerId, room.getRoomNumber()));
            }
            selection.add(offer);
        }
        return selection;
    }
}
