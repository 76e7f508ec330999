package com.photobooth.booking.domain.service;

import com.photobooth.booking.domain.model.Booking;
import com.photobooth.booking.domain.model.Booking.BookingStatus;
import com.photobooth.booking.domain.model.StatusChange;
import com.photobooth.booking.domain.model.TimeSlot;
import com.photobooth.booking.domain.repository.BookingRepository;
import com.photobooth.booking.exception.BookingValidationException;
import com.photobooth.booking.exception.SlotUnavailableException;
import com.photobooth.booking.validation.BookingDraft;
import com.photobooth.booking.validation.BookingDraftValidator;
import com.photobooth.booking.validation.DraftValues;
import com.photobooth.common.exception.InvalidInputException;
import com.photobooth.common.exception.ResourceNotFoundException;
import com.photobooth.common.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Service for managing bookings: creation from a validated draft, lookup and listing.
 * Status changes go through {@link BookingStatusService}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingService {

    private final BookingRepository bookingRepository;
    private final BookingDraftValidator draftValidator;
    private final AvailabilityService availabilityService;
    private final TimestampParser timestampParser;
    private final BookingIdGenerator idGenerator;
    private final Clock clock;

    @Value("${photobooth.booking.default-duration-minutes:30}")
    private int defaultDurationMinutes = 30;

    /**
     * Validates the draft, checks the slot against bookings of the same package and appends
     * the new booking.
     *
     * @throws BookingValidationException when the draft has validation errors
     * @throws SlotUnavailableException   when the slot overlaps an active booking
     */
    public Booking createBooking(BookingDraft draft) {
        List<String> errors = draftValidator.validate(draft);
        if (!errors.isEmpty()) {
            log.warn("Rejected booking draft with {} validation error(s)", errors.size());
            throw new BookingValidationException(errors);
        }

        Instant start = draftValidator.resolveStart(draft)
                .orElseThrow(() -> new InvalidInputException("Booking start could not be resolved"));
        Instant end = resolveEnd(draft, start);
        String packageId = DraftValues.trimmedText(draft.packageId())
                .or(() -> DraftValues.trimmedText(draft.packageName()))
                .orElse(null);

        TimeSlot slot = new TimeSlot(start, end);
        checkDuration(slot);

        List<Booking> conflicts = availabilityService.findConflicts(slot, packageId);
        if (!conflicts.isEmpty()) {
            List<String> ids = conflicts.stream().map(Booking::getId).collect(Collectors.toList());
            log.warn("Slot {} - {} for package {} conflicts with {}", start, end, packageId, ids);
            throw new SlotUnavailableException(start, end, ids);
        }

        BookingStatus status = DraftValues.trimmedText(draft.status())
                .map(BookingStatus::fromValue)
                .orElse(BookingStatus.BOOKED);
        String reason = DraftValues.trimmedText(draft.statusReason()).orElse(null);
        Instant now = clock.instant();

        List<StatusChange> history = new ArrayList<>();
        history.add(new StatusChange(status, now, reason));

        Booking booking = Booking.builder()
                .id(idGenerator.nextId())
                .createdAt(now)
                .updatedAt(now)
                .start(start)
                .end(end)
                .durationMinutes(slot.roundedMinutes())
                .packageId(packageId)
                .customer(customerOf(draft))
                .status(status)
                .statusHistory(history)
                .price(priceOf(draft.price()))
                .notes(DraftValues.trimmedText(draft.notes()).orElse(null))
                .build();

        Booking saved = bookingRepository.append(booking);
        log.info("Created booking {} for package {} from {} to {}", saved.getId(), packageId, start, end);
        return saved;
    }

    public Booking getBooking(String id) {
        return bookingRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", id));
    }

    public List<Booking> listBookings(BookingFilter filter) {
        BookingFilter f = filter == null ? BookingFilter.all() : filter;
        Comparator<Booking> order = f.sortBy().comparator();
        if (f.sortDir() == BookingFilter.SortDirection.DESC) {
            order = order.reversed();
        }

        Stream<Booking> matching = bookingRepository.findAll().stream()
                .filter(b -> f.from() == null || b.getEnd().isAfter(f.from()))
                .filter(b -> f.to() == null || b.getStart().isBefore(f.to()))
                .filter(b -> f.statuses().isEmpty() || f.statuses().contains(b.getStatus()))
                .filter(b -> f.packageId() == null || f.packageId().equals(b.getPackageId()))
                .filter(b -> matchesSearch(b, f.search()))
                .sorted(order);

        if (f.limit() != null) {
            int limit = Math.max(1, f.limit());
            int page = f.page() == null ? 1 : Math.max(1, f.page());
            matching = matching.skip((long) (page - 1) * limit).limit(limit);
        }
        return matching.collect(Collectors.toList());
    }

    private Instant resolveEnd(BookingDraft draft, Instant start) {
        Optional<Instant> explicitEnd = timestampParser.parse(draft.end()).filter(e -> e.isAfter(start));
        if (explicitEnd.isPresent()) {
            return explicitEnd.get();
        }
        long minutes = DraftValues.positiveInteger(draft.duration()).orElse((long) defaultDurationMinutes);
        return start.plus(Duration.ofMinutes(minutes));
    }

    /**
     * An explicit end replaces the requested duration, so the resolved interval is bounded again here.
     */
    private void checkDuration(TimeSlot slot) {
        long seconds = Duration.between(slot.start(), slot.end()).getSeconds();
        if (seconds < Constants.MIN_DURATION_MINUTES * 60L) {
            log.warn("Rejected booking of {}s, shorter than the minimum", seconds);
            throw new BookingValidationException(List.of(BookingDraftValidator.DURATION_TOO_SHORT));
        }
        if (seconds > Constants.MAX_DURATION_MINUTES * 60L) {
            log.warn("Rejected booking of {}s, longer than the maximum", seconds);
            throw new BookingValidationException(List.of(BookingDraftValidator.DURATION_TOO_LONG));
        }
    }

    private Map<String, Object> customerOf(BookingDraft draft) {
        Map<String, Object> customer = new LinkedHashMap<>();
        if (draft.customer() instanceof Map<?, ?> supplied) {
            supplied.forEach((k, v) -> customer.put(String.valueOf(k), v));
            return customer;
        }
        customer.put("name", DraftValues.displayName(draft));
        DraftValues.trimmedText(draft.email()).ifPresent(v -> customer.put("email", v));
        DraftValues.trimmedText(draft.phone()).ifPresent(v -> customer.put("phone", v));
        DraftValues.positiveInteger(draft.guests()).ifPresent(v -> customer.put("guests", v));
        DraftValues.trimmedText(draft.venue()).ifPresent(v -> customer.put("venue", v));
        DraftValues.trimmedText(draft.address()).ifPresent(v -> customer.put("address", v));
        return customer;
    }

    private BigDecimal priceOf(Object price) {
        if (price instanceof BigDecimal decimal) {
            return decimal;
        }
        if (price instanceof Number number) {
            double value = number.doubleValue();
            return Double.isFinite(value) ? new BigDecimal(number.toString()) : null;
        }
        if (DraftValues.isNonEmptyString(price)) {
            try {
                return new BigDecimal(((String) price).trim());
            } catch (NumberFormatException e) {
                throw new InvalidInputException("Invalid price: " + price, e);
            }
        }
        return null;
    }

    private boolean matchesSearch(Booking booking, String search) {
        if (search == null || search.isBlank()) {
            return true;
        }
        String needle = search.trim().toLowerCase(Locale.ROOT);
        Map<String, Object> customer = booking.getCustomer() == null ? Map.of() : booking.getCustomer();
        return Stream.of(booking.getId(), customer.get("name"), customer.get("email"), customer.get("phone"))
                .filter(Objects::nonNull)
                .map(v -> String.valueOf(v).toLowerCase(Locale.ROOT))
                .anyMatch(v -> v.contains(needle));
    }
}
