package com.hotelhub.booking.domain.pricing;

import com.hotelhub.booking.domain.model.Offer;
import com.hotelhub.booking.domain.model.Room;
import com.hotelhub.common.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static com.hotelhub.booking.BookingFixtures.globalOffer;
import static com.hotelhub.booking.BookingFixtures.room;
import static com.hotelhub.booking.BookingFixtures.roomOffer;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StandardPricingStrategyTest {

    private static final LocalDate JAN_1 = LocalDate.of(2027, 1, 1);
    private static final LocalDate JAN_4 = LocalDate.of(2027, 1, 4);

    private final StandardPricingStrategy strategy = new StandardPricingStrategy();

    @Test
    @DisplayName("3 nights at 100.00 cost 300.00")
    void nightsTimesRate() {
        BigDecimal total = strategy.calculateTotal(room(1L, "100.00"), JAN_1, JAN_4, List.of());

        assertThat(total).isEqualByComparingTo("300.00");
        assertThat(total.scale()).isEqualTo(2);
    }

    @Test
    @DisplayName("an eligible 25.00 offer adds to the room total once")
    void addsEligibleOffer() {
        BigDecimal total = strategy.calculateTotal(room(1L, "100.00"), JAN_1, JAN_4, List.of(globalOffer(10L, "25.00")));

        assertThat(total).isEqualByComparingTo("325.00");
    }

    @Test
    @DisplayName("inactive offers and offers scoped to other rooms are not charged")
    void skipsOffersThatAreNotBookable() {
        Offer retired = globalOffer(10L, "25.00");
        retired.setActive(false);
        Offer otherRoom = roomOffer(11L, "50.00", 2L);
        Offer thisRoom = roomOffer(12L, "40.00", 1L);

        BigDecimal total = strategy.calculateTotal(room(1L, "100.00"), JAN_1, JAN_4, List.of(retired, otherRoom, thisRoom));

        assertThat(total).isEqualByComparingTo("340.00");
    }

    @Test
    @DisplayName("fractional rates are rounded half-up to two decimals")
    void roundsHalfUp() {
        BigDecimal total = strategy.calculateTotal(room(1L, "33.335"), JAN_1, JAN_1.plusDays(1), null);

        assertThat(total).isEqualTo(new BigDecimal("33.34"));
    }

    @Test
    @DisplayName("zero nights is rejected")
    void rejectsZeroNights() {
        assertThatThrownBy(() -> strategy.calculateTotal(room(1L, "100.00"), JAN_1, JAN_1, List.of()))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("check-out before check-in is rejected")
    void rejectsReversedDates() {
        Room room = room(1L, "100.00");
        assertThatThrownBy(() -> strategy.calculateTotal(room, JAN_4, JAN_1, List.of()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("after check-in");
    }
}
