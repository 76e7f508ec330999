package com.photobooth.booking.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.photobooth.booking.domain.model.Booking;
import com.photobooth.booking.domain.model.Booking.BookingStatus;
import com.photobooth.booking.domain.model.StatusChange;
import com.photobooth.booking.domain.model.TimeSlot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Translates the stored JSON representation of bookings into canonical {@link Booking}s.
 *
 * Stored data is a best-effort cache that other writers may have corrupted, so every entry
 * is repaired on its own: an entry that cannot be repaired is logged and dropped, the rest of
 * the batch survives. Normalizing already-normalized data changes nothing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingNormalizer {

    private static final TypeReference<LinkedHashMap<String, Object>> CUSTOMER_TYPE = new TypeReference<>() {
    };

    private final TimestampParser timestampParser;
    private final BookingIdGenerator idGenerator;
    private final ObjectMapper objectMapper;

    /**
     * Parses a stored collection. Missing or unparsable content is an empty collection.
     */
    public List<Booking> normalizeAll(String json) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.error("Failed to parse stored bookings, treating collection as empty", e);
            return new ArrayList<>();
        }
        if (root == null || !root.isArray()) {
            log.warn("Stored bookings are not a JSON array, treating collection as empty");
            return new ArrayList<>();
        }
        List<JsonNode> entries = new ArrayList<>(root.size());
        root.forEach(entries::add);
        return normalizeAll(entries);
    }

    public List<Booking> normalizeAll(List<JsonNode> rawList) {
        if (rawList == null) {
            return new ArrayList<>();
        }
        List<Booking> normalized = new ArrayList<>(rawList.size());
        for (int i = 0; i < rawList.size(); i++) {
            JsonNode entry = rawList.get(i);
            if (entry == null || !entry.isObject()) {
                log.warn("Skipping non-object booking entry at index {}", i);
                continue;
            }
            try {
                normalize(entry, i).ifPresent(normalized::add);
            } catch (RuntimeException e) {
                log.warn("Failed to normalize booking at index {}, skipping", i, e);
            }
        }
        if (normalized.size() < rawList.size()) {
            log.warn("Dropped {} of {} stored booking(s) during normalization",
                    rawList.size() - normalized.size(), rawList.size());
        }
        return normalized;
    }

    public JsonNode toRaw(Booking booking) {
        return objectMapper.valueToTree(booking);
    }

    private Optional<Booking> normalize(JsonNode e, int index) {
        Optional<Instant> start = timestampParser.parse(e.get("start"));
        Optional<Instant> end = timestampParser.parse(e.get("end"));
        if (start.isEmpty() || end.isEmpty()) {
            log.warn("Skipping booking with invalid start/end at index {}: start={}, end={}",
                    index, e.get("start"), e.get("end"));
            return Optional.empty();
        }
        if (!end.get().isAfter(start.get())) {
            log.warn("Skipping booking at index {}: end {} is not after start {}", index, end.get(), start.get());
            return Optional.empty();
        }

        Instant createdAt = timestampParser.parse(e.get("createdAt")).orElse(start.get());
        Instant updatedAt = timestampParser.parse(e.get("updatedAt")).orElse(createdAt);
        if (updatedAt.isBefore(createdAt)) {
            updatedAt = createdAt;
        }

        BookingStatus status = textOf(e, "status")
                .flatMap(BookingStatus::find)
                .orElse(BookingStatus.BOOKED);

        return Optional.of(Booking.builder()
                .id(textOf(e, "id").filter(id -> !id.isBlank()).orElseGet(idGenerator::nextId))
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .start(start.get())
                .end(end.get())
                .durationMinutes(durationOf(e.get("durationMinutes"), start.get(), end.get()))
                .packageId(textOf(e, "packageId").filter(p -> !p.isEmpty()).orElse(null))
                .customer(customerOf(e.get("customer")))
                .status(status)
                .statusHistory(historyOf(e.get("statusHistory"), status, createdAt, updatedAt))
                .price(priceOf(e.get("price")))
                .notes(textOf(e, "notes").orElse(null))
                .build());
    }

    private int durationOf(JsonNode node, Instant start, Instant end) {
        if (node != null && node.isNumber()) {
            double minutes = node.asDouble();
            if (Double.isFinite(minutes) && minutes > 0 && minutes <= Integer.MAX_VALUE) {
                return TimeSlot.saturatedMinutes(Math.round(minutes));
            }
        }
        return new TimeSlot(start, end).roundedMinutes();
    }

    private List<StatusChange> historyOf(JsonNode node, BookingStatus status, Instant createdAt, Instant updatedAt) {
        List<StatusChange> history = new ArrayList<>();
        if (node != null && node.isArray()) {
            Instant previous = null;
            for (JsonNode entry : node) {
                Instant at = timestampParser.parse(entry.get("at")).orElse(createdAt);
                if (previous != null && at.isBefore(previous)) {
                    at = previous;
                }
                BookingStatus entryStatus = textOf(entry, "status")
                        .flatMap(BookingStatus::find)
                        .orElse(status);
                String reason = textOf(entry, "reason").orElse(null);
                history.add(new StatusChange(entryStatus, at, reason));
                previous = at;
            }
        }
        if (history.isEmpty()) {
            return new ArrayList<>(Collections.singletonList(new StatusChange(status, createdAt, null)));
        }
        StatusChange last = history.get(history.size() - 1);
        if (last.status() != status) {
            Instant at = updatedAt.isBefore(last.at()) ? last.at() : updatedAt;
            history.add(new StatusChange(status, at, null));
        }
        return history;
    }

    private Map<String, Object> customerOf(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        return objectMapper.convertValue(node, CUSTOMER_TYPE);
    }

    private BigDecimal priceOf(JsonNode node) {
        if (node == null || !node.isNumber()) {
            return null;
        }
        if (node.isFloatingPointNumber() && !Double.isFinite(node.asDouble())) {
            return null;
        }
        return node.decimalValue();
    }

    private static Optional<String> textOf(JsonNode node, String field) {
        if (node == null) {
            return Optional.empty();
        }
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? Optional.of(value.asText()) : Optional.empty();
    }
}
