package com.photobooth.booking.domain.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Half-open interval {@code [start, end)}. Two slots that only touch do not overlap.
 */
public record TimeSlot(Instant start, Instant end) {

    public static TimeSlot of(Instant start, long durationMinutes) {
        return new TimeSlot(start, start.plus(Duration.ofMinutes(durationMinutes)));
    }

    public boolean overlaps(TimeSlot other) {
        return start.isBefore(other.end) && end.isAfter(other.start);
    }

    /**
     * Length in whole minutes, rounded half-up, at least 1 and saturating at {@link Integer#MAX_VALUE}.
     */
    public int roundedMinutes() {
        long millis = Duration.between(start, end).toMillis();
        return saturatedMinutes(Math.round(millis / 60_000.0));
    }

    public static int saturatedMinutes(long minutes) {
        return (int) Math.min(Integer.MAX_VALUE, Math.max(1, minutes));
    }
}
