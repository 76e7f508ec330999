package com.photobooth.booking.api.dto;

import com.photobooth.booking.domain.model.Booking;
import com.photobooth.booking.domain.model.StatusChange;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public record BookingResponse(
        String id,
        Instant createdAt,
        Instant updatedAt,
        Instant start,
        Instant end,
        Integer durationMinutes,
        String packageId,
        Map<String, Object> customer,
        Booking.BookingStatus status,
        List<StatusChange> statusHistory,
        BigDecimal price,
        String notes
) {
    public static BookingResponse from(Booking booking) {
        return new BookingResponse(
                booking.getId(),
                booking.getCreatedAt(),
                booking.getUpdatedAt(),
                booking.getStart(),
                booking.getEnd(),
                booking.getDurationMinutes(),
                booking.getPackageId(),
                booking.getCustomer(),
                booking.getStatus(),
                booking.getStatusHistory(),
                booking.getPrice(),
                booking.getNotes()
        );
    }
}
