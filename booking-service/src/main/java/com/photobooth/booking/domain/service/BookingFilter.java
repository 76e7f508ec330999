package com.photobooth.booking.domain.service;

import com.photobooth.booking.domain.model.Booking;
import com.photobooth.booking.domain.model.Booking.BookingStatus;
import lombok.Builder;

import java.time.Instant;
import java.util.Comparator;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;

/**
 * Criteria for listing bookings. Every criterion is optional.
 *
 * @param from     keep bookings ending after this instant
 * @param to       keep bookings starting before this instant
 * @param statuses keep bookings in one of these statuses; empty keeps all
 * @param page     1-based page number, used only with {@code limit}
 */
@Builder
public record BookingFilter(
        Instant from,
        Instant to,
        Set<BookingStatus> statuses,
        String packageId,
        String search,
        SortField sortBy,
        SortDirection sortDir,
        Integer limit,
        Integer page
) {
    public BookingFilter {
        statuses = statuses == null ? Set.of() : Set.copyOf(statuses);
        sortBy = sortBy == null ? SortField.START : sortBy;
        sortDir = sortDir == null ? SortDirection.ASC : sortDir;
    }

    public static BookingFilter all() {
        return BookingFilter.builder().build();
    }

    public enum SortField {
        START(Booking::getStart),
        CREATED_AT(Booking::getCreatedAt),
        UPDATED_AT(Booking::getUpdatedAt);

        private final Function<Booking, Instant> key;

        SortField(Function<Booking, Instant> key) {
            this.key = key;
        }

        public Comparator<Booking> comparator() {
            return Comparator.comparing(key, Comparator.nullsLast(Comparator.naturalOrder()));
        }

        /**
         * Accepts {@code start}, {@code createdAt} and {@code updatedAt}; anything else sorts by start.
         */
        public static SortField parse(String value) {
            if (value == null) {
                return START;
            }
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "createdat", "created_at" -> CREATED_AT;
                case "updatedat", "updated_at" -> UPDATED_AT;
                default -> START;
            };
        }
    }

    public enum SortDirection {
        ASC,
        DESC;

        public static SortDirection parse(String value) {
            return value != null && value.trim().equalsIgnoreCase("desc") ? DESC : ASC;
        }
    }
}
