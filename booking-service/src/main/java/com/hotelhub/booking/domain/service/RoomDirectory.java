package com.hotelhub.booking.domain.service;

import com.hotelhub.booking.domain.model.Room;
import com.hotelhub.booking.domain.repository.RoomRepository;
import com.hotelhub.common.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Read access to room records. Room CRUD belongs to the hotel administration module.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class RoomDirectory {

    private final RoomRepository roomRepository;

    public Room getRoom(Long roomId) {
        return roomRepository.findById(roomId)
                .orElseThrow(() -> new ResourceNotFoundException("Room", roomId));
    }

    public List<Room> listRooms() {
        return roomRepository.findAllByOrderByRoomNumberAsc();
    }
}
