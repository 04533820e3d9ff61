package com.hotelhub.booking.events;

import com.hotelhub.booking.domain.model.Booking;
import com.hotelhub.booking.domain.model.Booking.BookingStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.concurrent.CompletableFuture;

import static com.hotelhub.booking.BookingFixtures.booking;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class BookingEventPublisherTest {

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    @InjectMocks
    private BookingEventPublisher publisher;

    private final Booking booking = booking(8L, 42L, 3L,
            LocalDate.of(2027, 1, 1), LocalDate.of(2027, 1, 4), BookingStatus.COMPLETED);

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(publisher, "eventsEnabled", true);
        booking.setTotalPrice(new BigDecimal("325.00"));
    }

    @AfterEach
    void tearDown() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    @DisplayName("outside a transaction the completed event is sent right away, keyed by booking id")
    void publishCompleted_immediately() {
        given(kafkaTemplate.send(anyString(), anyString(), any())).willReturn(new CompletableFuture<>());

        publisher.publishBookingCompleted(booking, 32);

        ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq("booking-completed"), eq("8"), event.capture());
        assertThat(event.getValue()).isInstanceOfSatisfying(BookingCompletedEvent.class, e -> {
            assertThat(e.getBookingId()).isEqualTo(8L);
            assertThat(e.getUserId()).isEqualTo(42L);
            assertThat(e.getBonusPointsAwarded()).isEqualTo(32);
        });
    }

    @Test
    @DisplayName("inside a transaction the event waits for the commit")
    void publishConfirmed_afterCommit() {
        given(kafkaTemplate.send(anyString(), anyString(), any())).willReturn(new CompletableFuture<>());
        TransactionSynchronizationManager.initSynchronization();

        publisher.publishBookingConfirmed(booking);
        verify(kafkaTemplate, never()).send(anyString(), anyString(), any());

        TransactionSynchronizationManager.getSynchronizations().forEach(TransactionSynchronization::afterCommit);
        verify(kafkaTemplate).send(eq("booking-confirmed"), eq("8"), any(BookingConfirmedEvent.class));
    }

    @Test
    @DisplayName("a broker failure is logged and never reaches the caller")
    void sendFailure_isSwallowedAfterLogging() {
        CompletableFuture<SendResult<String, Object>> failed = new CompletableFuture<>();
        failed.completeExceptionally(new IllegalStateException("broker down"));
        given(kafkaTemplate.send(anyString(), anyString(), any())).willReturn(failed);

        assertThatCode(() -> publisher.publishBookingCancelled(booking, "Cancelled by guest"))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("nothing is sent while events are disabled")
    void disabled() {
        ReflectionTestUtils.setField(publisher, "eventsEnabled", false);

        publisher.publishBookingCancelled(booking, "Declined by staff");

        verifyNoInteractions(kafkaTemplate);
    }
}
