package com.hotelhub.booking.domain.strategy;

import com.hotelhub.booking.domain.model.Room;

import java.util.function.Function;

/**
 * Runs a booking write for one room as a single transaction in which no other writer for the same
 * room can interleave its availability check.
 *
 * Implementations (bean names):
 * - pessimistic: SELECT FOR UPDATE on the room row
 * - optimistic: version bump on the room row, retried on conflict
 */
public interface RoomLockStrategy {

    /**
     * Loads the room under the strategy's lock and applies {@code work} in the same transaction.
     *
     * @param roomId room whose bookings are checked and written
     * @param work   check-then-write unit; receives the locked room
     * @return whatever {@code work} returns
     */
    <T> T executeWithRoomLock(Long roomId, Function<Room, T> work);

    /**
     * @return Strategy type (PESSIMISTIC_LOCK, OPTIMISTIC_LOCK)
     */
    String getStrategyType();
}
