package com.hotelhub.booking.domain.repository;

import com.hotelhub.booking.domain.model.Booking;
import com.hotelhub.booking.domain.model.Booking.BookingStatus;
import com.hotelhub.booking.domain.model.Offer;
import com.hotelhub.booking.domain.model.Room;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the Flyway migrations against a real PostgreSQL and lets Hibernate validate the entities
 * against the resulting schema. Skipped when Docker is not available.
 */
@DataJpaTest(properties = {
        "spring.flyway.enabled=true",
        "spring.jpa.hibernate.ddl-auto=validate"
})
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Testcontainers(disabledWithoutDocker = true)
class SchemaMigrationIntegrationTest {

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("hotelhub")
            .withUsername("postgres")
            .withPassword("postgres");

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
    }

    @Autowired
    private RoomRepository roomRepository;

    @Autowired
    private OfferRepository offerRepository;

    @Autowired
    private BookingRepository bookingRepository;

    @Test
    @DisplayName("seed data: deluxe rooms get every offer, suites two extras, single rooms only global ones")
    void seededOffers() {
        Room single = roomRepository.findByRoomNumber("101").orElseThrow();
        Room suite = roomRepository.findByRoomNumber("301").orElseThrow();
        Room deluxe = roomRepository.findByRoomNumber("401").orElseThrow();

        assertThat(offerRepository.findActiveForRoom(single.getId(), Offer.OfferType.GLOBAL)).hasSize(6);
        assertThat(offerRepository.findActiveForRoom(suite.getId(), Offer.OfferType.GLOBAL)).hasSize(8);
        assertThat(offerRepository.findActiveForRoom(deluxe.getId(), Offer.OfferType.GLOBAL)).hasSize(10);
    }

    @Test
    @DisplayName("bookings persist against the migrated schema and lock with FOR UPDATE")
    void bookingRoundTrip() {
        Room room = roomRepository.findByIdForUpdate(
                roomRepository.findByRoomNumber("201").orElseThrow().getId()).orElseThrow();

        Booking saved = bookingRepository.saveAndFlush(Booking.builder()
                .userId(3L)
                .roomId(room.getId())
                .checkInDate(LocalDate.of(2027, 5, 1))
                .checkOutDate(LocalDate.of(2027, 5, 4))
                .guestsCount(2)
                .totalPrice(new BigDecimal("360.00"))
                .build());

        assertThat(saved.getStatus()).isEqualTo(BookingStatus.PENDING);
        assertThat(bookingRepository.findByIdForUpdate(saved.getId())).isPresent();
        assertThat(bookingRepository.findOverlapping(room.getId(), LocalDate.of(2027, 5, 3),
                LocalDate.of(2027, 5, 6), BookingStatus.roomBlocking())).hasSize(1);
    }
}
