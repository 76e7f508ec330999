package com.photobooth.booking.api.controller;

import com.photobooth.booking.api.dto.BookingResponse;
import com.photobooth.booking.api.dto.StatusChangeRequest;
import com.photobooth.booking.api.dto.ValidationResult;
import com.photobooth.booking.domain.model.Booking;
import com.photobooth.booking.domain.model.Booking.BookingStatus;
import com.photobooth.booking.domain.service.BookingFilter;
import com.photobooth.booking.domain.service.BookingService;
import com.photobooth.booking.domain.service.BookingStatusService;
import com.photobooth.booking.validation.BookingDraft;
import com.photobooth.booking.validation.BookingDraftValidator;
import com.photobooth.common.dto.BaseResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * REST controller for booking operations.
 */
@RestController
@RequestMapping("/api/v1/bookings")
@RequiredArgsConstructor
public class BookingController {

    private final BookingService bookingService;
    private final BookingStatusService statusService;
    private final BookingDraftValidator draftValidator;

    @PostMapping
    public ResponseEntity<BaseResponse<BookingResponse>> createBooking(@RequestBody BookingDraft draft) {
        Booking booking = bookingService.createBooking(draft);
        return ResponseEntity.ok(BaseResponse.success("Booking created successfully", BookingResponse.from(booking)));
    }

    @PostMapping("/validate")
    public ResponseEntity<BaseResponse<ValidationResult>> validateDraft(@RequestBody BookingDraft draft) {
        return ResponseEntity.ok(BaseResponse.success(ValidationResult.of(draftValidator.validate(draft))));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<BookingResponse>> getBooking(@PathVariable String id) {
        return ResponseEntity.ok(BaseResponse.success(BookingResponse.from(bookingService.getBooking(id))));
    }

    @GetMapping
    public ResponseEntity<BaseResponse<List<BookingResponse>>> listBookings(
            @RequestParam(required = false) Instant from,
            @RequestParam(required = false) Instant to,
            @RequestParam(required = false) List<String> status,
            @RequestParam(required = false) String packageId,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String sortBy,
            @RequestParam(required = false) String sortDir,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer page) {
        Set<BookingStatus> statuses = status == null ? Set.of() : status.stream()
                .filter(s -> !s.isBlank())
                .map(BookingStatus::fromValue)
                .collect(Collectors.toSet());

        BookingFilter filter = BookingFilter.builder()
                .from(from)
                .to(to)
                .statuses(statuses)
                .packageId(packageId)
                .search(search)
                .sortBy(BookingFilter.SortField.parse(sortBy))
                .sortDir(BookingFilter.SortDirection.parse(sortDir))
                .limit(limit)
                .page(page)
                .build();

        List<BookingResponse> response = bookingService.listBookings(filter).stream()
                .map(BookingResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @PostMapping("/{id}/status")
    public ResponseEntity<BaseResponse<BookingResponse>> changeStatus(
            @PathVariable String id,
            @Valid @RequestBody StatusChangeRequest request) {
        Booking booking = statusService.applyStatus(id, request.status(), request.reason());
        return ResponseEntity.ok(BaseResponse.success("Booking status updated", BookingResponse.from(booking)));
    }
}
