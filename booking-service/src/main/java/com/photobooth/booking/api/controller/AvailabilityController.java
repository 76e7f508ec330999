package com.photobooth.booking.api.controller;

import com.photobooth.booking.api.dto.AvailabilityResponse;
import com.photobooth.booking.domain.model.Booking;
import com.photobooth.booking.domain.service.AvailabilityService;
import com.photobooth.common.dto.BaseResponse;
import com.photobooth.common.util.Constants;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/v1/availability")
@RequiredArgsConstructor
public class AvailabilityController {

    private final AvailabilityService availabilityService;

    @GetMapping
    public ResponseEntity<BaseResponse<AvailabilityResponse>> checkAvailability(
            @RequestParam Instant start,
            @RequestParam(defaultValue = "" + Constants.DEFAULT_DURATION_MINUTES) long durationMinutes,
            @RequestParam(required = false) String packageId) {
        List<Booking> conflicts = availabilityService.findConflicts(start, durationMinutes, packageId);
        Instant end = start.plus(Duration.ofMinutes(Math.max(0, durationMinutes)));
        return ResponseEntity.ok(BaseResponse.success(AvailabilityResponse.of(start, end, packageId, conflicts)));
    }
}
