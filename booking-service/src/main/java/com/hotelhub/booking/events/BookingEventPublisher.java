package com.hotelhub.booking.events;

import com.hotelhub.booking.domain.model.Booking;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Kafka publisher for booking lifecycle events.
 *
 * Events are sent after the surrounding transaction commits, so a rolled-back transition never
 * produces an event. A failed send is logged and does not affect the booking.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingEventPublisher {

    static final String TOPIC_BOOKING_CONFIRMED = "booking-confirmed";
    static final String TOPIC_BOOKING_CANCELLED = "booking-cancelled";
    static final String TOPIC_BOOKING_COMPLETED = "booking-completed";

    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Value("${hotel.booking.events.enabled:true}")
    private boolean eventsEnabled;

    public void publishBookingConfirmed(Booking booking) {
        BookingConfirmedEvent event = BookingConfirmedEvent.builder()
                .bookingId(booking.getId())
                .userId(booking.getUserId())
                .roomId(booking.getRoomId())
                .checkInDate(booking.getCheckInDate())
                .checkOutDate(booking.getCheckOutDate())
                .totalPrice(booking.getTotalPrice())
                .timestamp(Instant.now())
                .build();

        publishAfterCommit(TOPIC_BOOKING_CONFIRMED, String.valueOf(booking.getId()), event);
    }

    public void publishBookingCancelled(Booking booking, String reason) {
        BookingCancelledEvent event = BookingCancelledEvent.builder()
                .bookingId(booking.getId())
                .userId(booking.getUserId())
                .roomId(booking.getRoomId())
                .checkInDate(booking.getCheckInDate())
                .checkOutDate(booking.getCheckOutDate())
                .reason(reason)
                .timestamp(Instant.now())
                .build();

        publishAfterCommit(TOPIC_BOOKING_CANCELLED, String.valueOf(booking.getId()), event);
    }

    public void publishBookingCompleted(Booking booking, int bonusPointsAwarded) {
        BookingCompletedEvent event = BookingCompletedEvent.builder()
                .bookingId(booking.getId())
                .userId(booking.getUserId())
                .roomId(booking.getRoomId())
                .totalPrice(booking.getTotalPrice())
                .bonusPointsAwarded(bonusPointsAwarded)
                .timestamp(Instant.now())
                .build();

        publishAfterCommit(TOPIC_BOOKING_COMPLETED, String.valueOf(booking.getId()), event);
    }

    private void publishAfterCommit(String topic, String key, Object event) {
        if (!eventsEnabled) {
            log.debug("Event publishing disabled, dropping event for topic {}: {}", topic, event);
            return;
        }
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    publishEvent(topic, key, event);
                }
            });
        } else {
            publishEvent(topic, key, event);
        }
    }

    private void publishEvent(String topic, String key, Object event) {
        log.info("Publishing event to topic {}: {}", topic, event);

        CompletableFuture<SendResult<String, Object>> future;
        try {
            future = kafkaTemplate.send(topic, key, event);
        } catch (RuntimeException e) {
            log.error("Failed to hand event to Kafka producer for topic {}", topic, e);
            return;
        }

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                log.info("Event published successfully to topic {}: offset={}",
                        topic, result.getRecordMetadata().offset());
            } else {
                log.error("Failed to publish event to topic {}", topic, ex);
            }
        });
    }
}
