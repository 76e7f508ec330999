package com.photobooth.booking.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.photobooth.booking.domain.model.Booking;
import com.photobooth.booking.domain.model.Booking.BookingStatus;
import com.photobooth.booking.domain.model.StatusChange;
import com.photobooth.booking.support.BookingFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class BookingNormalizerTest {

    private final Clock clock = BookingFixtures.fixedClock();
    private final ObjectMapper objectMapper = BookingFixtures.objectMapper();
    private final BookingNormalizer normalizer =
            new BookingNormalizer(new TimestampParser(clock), new BookingIdGenerator(), objectMapper);

    @Test
    @DisplayName("missing, blank, unparsable and non-array content is an empty collection")
    void normalizeAll_emptyInputs() {
        assertThat(normalizer.normalizeAll((String) null)).isEmpty();
        assertThat(normalizer.normalizeAll("  ")).isEmpty();
        assertThat(normalizer.normalizeAll("{not json")).isEmpty();
        assertThat(normalizer.normalizeAll("{\"id\": \"b1\"}")).isEmpty();
    }

    @Test
    @DisplayName("entries without a usable interval are dropped, the rest survive")
    void normalizeAll_dropsBadEntries() {
        String json = """
                [
                  {"id": "ok", "start": "2026-05-01T09:00:00Z", "end": "2026-05-01T10:00:00Z"},
                  {"id": "no-end", "start": "2026-05-01T09:00:00Z"},
                  {"id": "garbage", "start": "soon", "end": "later"},
                  {"id": "reversed", "start": "2026-05-01T10:00:00Z", "end": "2026-05-01T09:00:00Z"},
                  42,
                  null
                ]
                """;

        List<Booking> result = normalizer.normalizeAll(json);

        assertThat(result).extracting(Booking::getId).containsExactly("ok");
    }

    @Test
    @DisplayName("loose values are coerced into canonical form")
    void normalizeAll_coercions() {
        String json = """
                [{"start": "2026-05-01 9:00", "end": 1777629600000, "status": "mystery",
                  "packageId": "", "price": 249.99, "customer": "not a map", "durationMinutes": -5}]
                """;

        Booking booking = normalizer.normalizeAll(json).get(0);

        assertThat(booking.getId()).isNotBlank();
        assertThat(booking.getStart()).isEqualTo(Instant.parse("2026-05-01T09:00:00Z"));
        assertThat(booking.getEnd()).isEqualTo(Instant.ofEpochMilli(1777629600000L));
        assertThat(booking.getDurationMinutes()).isEqualTo(60);
        assertThat(booking.getStatus()).isEqualTo(BookingStatus.BOOKED);
        assertThat(booking.getPackageId()).isNull();
        assertThat(booking.getCustomer()).isNull();
        assertThat(booking.getPrice()).isEqualByComparingTo("249.99");
        assertThat(booking.getCreatedAt()).isEqualTo(booking.getStart());
        assertThat(booking.getStatusHistory()).containsExactly(
                new StatusChange(BookingStatus.BOOKED, booking.getCreatedAt(), null));
    }

    @Test
    @DisplayName("history is repaired to be ordered and to end in the current status")
    void normalizeAll_repairsHistory() {
        String json = """
                [{"id": "b1", "start": "2026-05-01T09:00:00Z", "end": "2026-05-01T10:00:00Z",
                  "createdAt": "2026-04-01T00:00:00Z", "updatedAt": "2026-04-03T00:00:00Z",
                  "status": "cancelled",
                  "statusHistory": [
                    {"status": "booked", "at": "2026-04-02T00:00:00Z"},
                    {"status": "confirmed", "at": "2026-03-01T00:00:00Z", "reason": "paid"}
                  ]}]
                """;

        List<StatusChange> history = normalizer.normalizeAll(json).get(0).getStatusHistory();

        assertThat(history).extracting(StatusChange::status)
                .containsExactly(BookingStatus.BOOKED, BookingStatus.CONFIRMED, BookingStatus.CANCELLED);
        assertThat(history.get(1).at()).isEqualTo(history.get(0).at());
        assertThat(history.get(1).reason()).isEqualTo("paid");
        assertThat(history.get(2).at()).isEqualTo(Instant.parse("2026-04-03T00:00:00Z"));
    }

    @Test
    @DisplayName("normalizing already-normalized data changes nothing")
    void normalizeAll_idempotent() throws Exception {
        String json = """
                [{"id": "b1", "start": "2026-05-01T09:00", "end": "2026-05-01T11:30",
                  "status": "confirmed", "customer": {"name": "Jane"}, "notes": "balloons"},
                 {"id": "b2", "start": "2026-05-02T09:00:00Z", "end": "2026-05-02T10:00:00Z", "price": "12"}]
                """;

        List<Booking> once = normalizer.normalizeAll(json);
        List<JsonNode> raw = once.stream().map(normalizer::toRaw).collect(Collectors.toList());
        List<Booking> twice = normalizer.normalizeAll(raw);

        assertThat(objectMapper.writeValueAsString(twice)).isEqualTo(objectMapper.writeValueAsString(once));
    }

    @Test
    @DisplayName("a stored duration too large for minutes is recomputed from the interval")
    void normalizeAll_oversizedDuration() {
        String json = """
                [{"id": "b1", "start": "2026-05-01T09:00:00Z", "end": "2026-05-01T10:00:00Z", "durationMinutes": 1e12}]
                """;

        Booking once = normalizer.normalizeAll(json).get(0);
        Booking twice = normalizer.normalizeAll(List.of(normalizer.toRaw(once))).get(0);

        assertThat(once.getDurationMinutes()).isEqualTo(60);
        assertThat(twice.getDurationMinutes()).isEqualTo(60);
    }
}
