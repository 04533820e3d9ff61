package com.hotelhub.booking.domain.strategy;

import com.hotelhub.booking.domain.model.Room;
import com.hotelhub.booking.domain.repository.RoomRepository;
import com.hotelhub.common.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.function.Function;

/**
 * Room lock using the room's @Version column.
 *
 * The room is loaded with OPTIMISTIC_FORCE_INCREMENT, so every booking write bumps the room version
 * on commit. Of two concurrent writers only the first commits; the second fails with
 * OptimisticLockingFailureException and is retried from scratch (up to 3 attempts), at which point
 * its availability check sees the committed booking.
 */
@Slf4j
@Component("optimistic")
@RequiredArgsConstructor
public class OptimisticRoomLockStrategy implements RoomLockStrategy {

    private final RoomRepository roomRepository;

    @Override
    @Retryable(
            retryFor = OptimisticLockingFailureException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 50, multiplier = 2)
    )
    @Transactional
    public <T> T executeWithRoomLock(Long roomId, Function<Room, T> work) {
        Room room = roomRepository.findByIdWithVersionIncrement(roomId)
                .orElseThrow(() -> new ResourceNotFoundException("Room", roomId));
        log.debug("Writing against room {} at version {}", roomId, room.getVersion());
        return work.apply(room);
    }

    @Override
    public String getStrategyType() {
        return "OPTIMISTIC_LOCK";
    }
}
