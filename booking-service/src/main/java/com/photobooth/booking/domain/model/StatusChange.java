package com.photobooth.booking.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * One entry of a booking's status audit trail.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatusChange(
        Booking.BookingStatus status,
        Instant at,
        String reason
) {
}
