package com.hotelhub.booking.domain.strategy;

import com.hotelhub.booking.domain.model.Room;
import com.hotelhub.booking.domain.repository.RoomRepository;
import com.hotelhub.common.exception.ResourceNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static com.hotelhub.booking.BookingFixtures.room;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class PessimisticRoomLockStrategyTest {

    @Mock
    private RoomRepository roomRepository;

    @InjectMocks
    private PessimisticRoomLockStrategy strategy;

    @Test
    @DisplayName("work runs against the row-locked room")
    void executesWithLockedRoom() {
        Room room = room(3L, "100.00");
        given(roomRepository.findByIdForUpdate(3L)).willReturn(Optional.of(room));

        String result = strategy.executeWithRoomLock(3L, locked -> locked.getRoomNumber());

        assertThat(result).isEqualTo("R3");
        verify(roomRepository).findByIdForUpdate(3L);
        verify(roomRepository, never()).findByIdWithVersionIncrement(3L);
    }

    @Test
    @DisplayName("a missing room fails before any work runs")
    void missingRoom() {
        given(roomRepository.findByIdForUpdate(9L)).willReturn(Optional.empty());

        assertThatThrownBy(() -> strategy.executeWithRoomLock(9L, room -> {
            throw new AssertionError("work must not run");
        })).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("strategy type")
    void strategyType() {
        assertThat(strategy.getStrategyType()).isEqualTo("PESSIMISTIC_LOCK");
    }
}
