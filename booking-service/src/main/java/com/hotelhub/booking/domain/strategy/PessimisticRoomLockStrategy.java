package com.hotelhub.booking.domain.strategy;

import com.hotelhub.booking.domain.model.Room;
import com.hotelhub.booking.domain.repository.RoomRepository;
import com.hotelhub.common.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.function.Function;

/**
 * Room lock using SELECT FOR UPDATE.
 *
 * Flow:
 * 1. Lock the room row (other writers for the room wait here)
 * 2. Check availability and write the booking
 * 3. Commit (releases the lock)
 */
@Slf4j
@Component("pessimistic")
@RequiredArgsConstructor
public class PessimisticRoomLockStrategy implements RoomLockStrategy {

    private final RoomRepository roomRepository;

    @Override
    @Transactional
    public <T> T executeWithRoomLock(Long roomId, Function<Room, T> work) {
        Room room = roomRepository.findByIdForUpdate(roomId)
                .orElseThrow(() -> new ResourceNotFoundException("Room", roomId));
        log.debug("Acquired row lock on room {}", roomId);
        return work.apply(room);
    }

    @Override
    public String getStrategyType() {
        return "PESSIMISTIC_LOCK";
    }
}
