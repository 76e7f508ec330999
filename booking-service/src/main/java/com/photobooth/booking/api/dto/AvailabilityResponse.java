package com.photobooth.booking.api.dto;

import com.photobooth.booking.domain.model.Booking;

import java.time.Instant;
import java.util.List;

/**
 * Availability of one candidate slot, with the bookings that block it.
 */
public record AvailabilityResponse(
        Instant start,
        Instant end,
        String packageId,
        boolean available,
        List<ConflictView> conflicts
) {
    public static AvailabilityResponse of(Instant start, Instant end, String packageId, List<Booking> conflicts) {
        List<ConflictView> views = conflicts.stream().map(ConflictView::from).toList();
        return new AvailabilityResponse(start, end, packageId, views.isEmpty(), views);
    }

    public record ConflictView(String id, Instant start, Instant end, String packageId, Booking.BookingStatus status) {
        static ConflictView from(Booking booking) {
            return new ConflictView(booking.getId(), booking.getStart(), booking.getEnd(),
                    booking.getPackageId(), booking.getStatus());
        }
    }
}
