package com.photobooth.booking.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonValue;
import com.photobooth.common.exception.InvalidInputException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * A photobooth reservation: a time interval, a package reference, the customer's
 * contact details and the full audit trail of status assignments.
 *
 * Instances handed out by services are copies; mutating one never affects the store
 * until it is written back through {@link com.photobooth.booking.domain.repository.BookingRepository}.
 */
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"id", "createdAt", "updatedAt", "start", "end", "durationMinutes", "packageId",
        "customer", "status", "statusHistory", "price", "notes"})
public class Booking {
    private String id;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant start;
    private Instant end;
    private Integer durationMinutes;
    private String packageId;
    private Map<String, Object> customer;
    private BookingStatus status;
    private List<StatusChange> statusHistory;
    private BigDecimal price;
    private String notes;

    @JsonIgnore
    public TimeSlot getSlot() {
        return new TimeSlot(start, end);
    }

    @JsonIgnore
    public Optional<StatusChange> getLastStatusChange() {
        if (statusHistory == null || statusHistory.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(statusHistory.get(statusHistory.size() - 1));
    }

    /**
     * Deep enough copy for value semantics: history list and customer map are duplicated,
     * their elements are immutable or treated as such.
     */
    public Booking copy() {
        return toBuilder()
                .statusHistory(statusHistory == null ? null : new ArrayList<>(statusHistory))
                .customer(customer == null ? null : new LinkedHashMap<>(customer))
                .build();
    }

    public enum BookingStatus {
        DRAFT,
        BOOKED,
        CONFIRMED,
        CANCELLED,
        COMPLETED;

        @JsonValue
        public String getValue() {
            return name().toLowerCase(Locale.ROOT);
        }

        /**
         * Lenient lookup used when repairing stored data: unknown values map to empty.
         */
        public static Optional<BookingStatus> find(String value) {
            if (value == null) {
                return Optional.empty();
            }
            String wanted = value.trim();
            return Arrays.stream(values())
                    .filter(s -> s.getValue().equals(wanted))
                    .findFirst();
        }

        /**
         * Strict lookup for caller-supplied values.
         */
        @JsonCreator
        public static BookingStatus fromValue(String value) {
            return find(value == null ? null : value.toLowerCase(Locale.ROOT))
                    .orElseThrow(() -> new InvalidInputException("Invalid status: " + value));
        }
    }
}
