package com.photobooth.booking.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the loosely typed timestamps found in stored records and drafts into instants.
 *
 * Accepted forms: ISO-8601 instants, offset or zoned date-times, local date-times
 * ({@code T} or a single space as separator) and bare dates, both read in the clock's zone,
 * and epoch milliseconds.
 */
@Component
@RequiredArgsConstructor
public class TimestampParser {

    private static final Pattern DATE_SPACE_TIME =
            Pattern.compile("^(\\d{4}-\\d{2}-\\d{2}) (\\d{1,2}:\\d{2}(?::\\d{2})?)(.*)$");
    private static final Pattern SINGLE_DIGIT_HOUR =
            Pattern.compile("^(\\d{4}-\\d{2}-\\d{2}T)(\\d:\\d{2}.*)$");

    private final Clock clock;

    public Optional<Instant> parse(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Optional.empty();
        }
        if (node.isNumber()) {
            double millis = node.asDouble();
            return Double.isFinite(millis) ? fromEpochMillis(node.asLong()) : Optional.empty();
        }
        if (node.isTextual()) {
            return parseText(node.asText());
        }
        return Optional.empty();
    }

    public Optional<Instant> parse(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Instant instant) {
            return Optional.of(instant);
        }
        if (value instanceof Date date) {
            return Optional.of(date.toInstant());
        }
        if (value instanceof Number number) {
            double millis = number.doubleValue();
            return Double.isFinite(millis) ? fromEpochMillis(number.longValue()) : Optional.empty();
        }
        if (value instanceof CharSequence text) {
            return parseText(text.toString());
        }
        return Optional.empty();
    }

    /**
     * Joins a form's separate date and time fields into one parseable value.
     */
    public Optional<Instant> parse(String date, String time) {
        return parseText(date.trim() + "T" + time.trim());
    }

    private Optional<Instant> parseText(String raw) {
        String text = raw.trim();
        if (text.isEmpty()) {
            return Optional.empty();
        }
        Matcher spaced = DATE_SPACE_TIME.matcher(text);
        if (spaced.matches()) {
            text = spaced.group(1) + "T" + spaced.group(2) + spaced.group(3);
        }
        Matcher shortHour = SINGLE_DIGIT_HOUR.matcher(text);
        if (shortHour.matches()) {
            text = shortHour.group(1) + "0" + shortHour.group(2);
        }

        for (Function<String, Instant> reader : readers()) {
            try {
                return Optional.of(reader.apply(text));
            } catch (DateTimeException e) {
                continue;
            }
        }
        return Optional.empty();
    }

    private List<Function<String, Instant>> readers() {
        return List.of(
                Instant::parse,
                text -> OffsetDateTime.parse(text).toInstant(),
                text -> ZonedDateTime.parse(text, DateTimeFormatter.ISO_ZONED_DATE_TIME).toInstant(),
                text -> LocalDateTime.parse(text).atZone(clock.getZone()).toInstant(),
                text -> LocalDate.parse(text).atStartOfDay(clock.getZone()).toInstant());
    }

    private Optional<Instant> fromEpochMillis(long millis) {
        try {
            return Optional.of(Instant.ofEpochMilli(millis));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }
}
