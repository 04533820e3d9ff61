package com.hotelhub.booking.domain.repository;

import com.hotelhub.booking.domain.model.Room;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * Repository for rooms. Provides the two room-level locks used around booking writes.
 */
public interface RoomRepository extends JpaRepository<Room, Long> {

    Optional<Room> findByRoomNumber(String roomNumber);

    List<Room> findAllByOrderByRoomNumberAsc();

    /**
     * SELECT ... FOR UPDATE on the room row. Held until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Room r WHERE r.id = :id")
    Optional<Room> findByIdForUpdate(@Param("id") Long id);

    /**
     * Loads the room and schedules a version bump at commit, so two transactions that both
     * read the same version cannot both commit.
     */
    @Lock(LockModeType.OPTIMISTIC_FORCE_INCREMENT)
    @Query("SELECT r FROM Room r WHERE r.id = :id")
    Optional<Room> findByIdWithVersionIncrement(@Param("id") Long id);
}
