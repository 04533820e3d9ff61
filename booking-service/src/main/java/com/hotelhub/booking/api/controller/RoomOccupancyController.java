package com.hotelhub.booking.api.controller;

import com.hotelhub.booking.api.dto.RoomOccupancyResponse;
import com.hotelhub.booking.domain.service.RoomOccupancyService;
import com.hotelhub.common.dto.BaseResponse;
import com.hotelhub.common.util.Constants;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/v1/rooms")
@RequiredArgsConstructor
public class RoomOccupancyController {

    private final RoomOccupancyService roomOccupancyService;

    @GetMapping("/occupancy")
    public ResponseEntity<BaseResponse<List<RoomOccupancyResponse>>> getOccupancy(
            @RequestHeader(Constants.HEADER_USER_ID) Long userId,
            @RequestHeader(Constants.HEADER_USER_ROLE) String role,
            @RequestParam(name = "as_of", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        List<RoomOccupancyResponse> response =
                roomOccupancyService.roomOccupancy(RequestActors.from(userId, role), asOf);
        return ResponseEntity.ok(BaseResponse.success(response));
    }
}
