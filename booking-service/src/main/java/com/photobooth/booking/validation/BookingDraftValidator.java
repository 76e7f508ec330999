package com.photobooth.booking.validation;

import com.photobooth.booking.domain.service.TimestampParser;
import com.photobooth.common.util.Constants;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import static com.photobooth.booking.validation.DraftValues.isNonEmptyString;
import static com.photobooth.booking.validation.DraftValues.isPresent;

/**
 * Checks a {@link BookingDraft} before it becomes a booking.
 *
 * Every rule runs on every call, so the result lists all problems at once; an empty list
 * means the draft is acceptable. Never throws on malformed input.
 */
@Component
@RequiredArgsConstructor
public class BookingDraftValidator {

    static final String INVALID_NAME = "Please provide a valid name.";
    static final String INVALID_EMAIL = "Please provide a valid email address.";
    static final String INVALID_PHONE = "Please provide a valid phone number.";
    static final String INVALID_START = "Please select a valid start date and time.";
    static final String START_TOO_SOON = "Booking time must be at least 10 minutes in the future.";
    static final String START_TOO_FAR = "Booking date is too far in the future.";
    static final String INVALID_DURATION = "Duration must be a positive whole number of minutes.";
    public static final String DURATION_TOO_SHORT = "Duration must be at least 5 minutes.";
    public static final String DURATION_TOO_LONG = "Duration must be less than 24 hours.";
    static final String MISSING_DURATION = "Please specify a duration for the booking.";
    static final String INVALID_GUESTS = "Guest count must be a positive whole number.";
    static final String TOO_MANY_GUESTS = "Guest count is unrealistically large.";
    static final String MISSING_GUESTS = "Please specify the number of guests.";
    static final String MISSING_PACKAGE = "Please select a package.";
    static final String INVALID_VENUE = "Please provide a valid venue or address.";
    static final String INVALID_ADDRESS = "Please provide a valid address.";
    static final String TERMS_NOT_ACCEPTED = "You must accept the terms and conditions to proceed.";
    static final String NOTES_TOO_LONG = "Notes are too long.";

    private static final int MAX_EMAIL_LENGTH = 254;
    private static final Pattern LOCAL_PART = Pattern.compile("^[A-Za-z0-9!#$%&'*+/=?^_`{|}~.-]+$");
    private static final Pattern DOMAIN_LABEL = Pattern.compile("^[A-Za-z0-9-]{1,63}$");
    private static final Pattern TLD = Pattern.compile("^[A-Za-z]{2,63}$");
    private static final Pattern PHONE_SEPARATORS = Pattern.compile("[\\s\\-().]");
    private static final Pattern DIGITS = Pattern.compile("^\\d+$");
    private static final int MIN_PHONE_DIGITS = 7;
    private static final int MAX_PHONE_DIGITS = 15;

    private final Clock clock;
    private final TimestampParser timestampParser;

    public List<String> validate(BookingDraft draft) {
        BookingDraft d = draft == null ? BookingDraft.of(null) : draft;
        List<String> errors = new ArrayList<>();

        if (DraftValues.displayName(d).length() < 2) {
            errors.add(INVALID_NAME);
        }
        if (!isNonEmptyString(d.email()) || !isValidEmail((String) d.email())) {
            errors.add(INVALID_EMAIL);
        }
        if (!isNonEmptyString(d.phone()) || !isValidPhone((String) d.phone())) {
            errors.add(INVALID_PHONE);
        }

        validateStart(d, errors);
        validateDuration(d.duration(), errors);
        validateGuests(d.guests(), errors);

        if (!isNonEmptyString(d.packageId()) && !isNonEmptyString(d.packageName())) {
            errors.add(MISSING_PACKAGE);
        }
        if (d.venue() != null) {
            if (!isNonEmptyString(d.venue()) && !isNonEmptyString(d.address())) {
                errors.add(INVALID_VENUE);
            }
        } else if (d.address() != null && !isNonEmptyString(d.address())) {
            errors.add(INVALID_ADDRESS);
        }

        if (!DraftValues.isAccepted(d.terms())) {
            errors.add(TERMS_NOT_ACCEPTED);
        }
        if (isNonEmptyString(d.notes()) && ((String) d.notes()).length() > Constants.MAX_NOTES_LENGTH) {
            errors.add(NOTES_TOO_LONG);
        }
        return errors;
    }

    /**
     * Start of the requested slot: {@code start}, else {@code date} and {@code time} combined,
     * else {@code date} alone.
     */
    public Optional<Instant> resolveStart(BookingDraft draft) {
        if (isPresent(draft.start())) {
            return timestampParser.parse(draft.start());
        }
        if (isPresent(draft.date()) && isPresent(draft.time())) {
            if (isNonEmptyString(draft.date()) && isNonEmptyString(draft.time())) {
                return timestampParser.parse((String) draft.date(), (String) draft.time());
            }
            return Optional.empty();
        }
        if (isPresent(draft.date())) {
            return timestampParser.parse(draft.date());
        }
        return Optional.empty();
    }

    public static boolean isValidEmail(String email) {
        String trimmed = email.trim();
        if (trimmed.isEmpty() || trimmed.length() > MAX_EMAIL_LENGTH) {
            return false;
        }
        int at = trimmed.indexOf('@');
        if (at <= 0 || at != trimmed.lastIndexOf('@') || at == trimmed.length() - 1) {
            return false;
        }
        String local = trimmed.substring(0, at);
        String domain = trimmed.substring(at + 1);

        if (local.startsWith(".") || local.endsWith(".") || local.contains("..")
                || !LOCAL_PART.matcher(local).matches()) {
            return false;
        }

        String[] labels = domain.split("\\.", -1);
        if (labels.length < 2) {
            return false;
        }
        for (String label : labels) {
            if (!DOMAIN_LABEL.matcher(label).matches() || label.startsWith("-") || label.endsWith("-")) {
                return false;
            }
        }
        return TLD.matcher(labels[labels.length - 1]).matches();
    }

    public static boolean isValidPhone(String phone) {
        String trimmed = phone.trim();
        if (trimmed.isEmpty()) {
            return false;
        }
        long plusCount = trimmed.chars().filter(c -> c == '+').count();
        if (plusCount > 1 || (plusCount == 1 && !trimmed.startsWith("+"))) {
            return false;
        }
        String digits = PHONE_SEPARATORS.matcher(trimmed).replaceAll("").replaceFirst("^\\+", "");
        if (!DIGITS.matcher(digits).matches()) {
            return false;
        }
        return digits.length() >= MIN_PHONE_DIGITS && digits.length() <= MAX_PHONE_DIGITS;
    }

    private void validateStart(BookingDraft draft, List<String> errors) {
        Optional<Instant> start = resolveStart(draft);
        if (start.isEmpty()) {
            errors.add(INVALID_START);
            return;
        }
        Instant now = clock.instant();
        if (start.get().isBefore(now.plus(Duration.ofMinutes(Constants.MIN_LEAD_MINUTES)))) {
            errors.add(START_TOO_SOON);
        }
        if (start.get().isAfter(now.plus(Duration.ofDays(Constants.MAX_ADVANCE_DAYS)))) {
            errors.add(START_TOO_FAR);
        }
    }

    private void validateDuration(Object duration, List<String> errors) {
        if (duration == null || "".equals(duration)) {
            errors.add(MISSING_DURATION);
            return;
        }
        Optional<Long> minutes = DraftValues.positiveInteger(duration);
        if (minutes.isEmpty()) {
            errors.add(INVALID_DURATION);
            return;
        }
        if (minutes.get() < Constants.MIN_DURATION_MINUTES) {
            errors.add(DURATION_TOO_SHORT);
        }
        if (minutes.get() > Constants.MAX_DURATION_MINUTES) {
            errors.add(DURATION_TOO_LONG);
        }
    }

    private void validateGuests(Object guests, List<String> errors) {
        if (guests == null || "".equals(guests)) {
            errors.add(MISSING_GUESTS);
            return;
        }
        Optional<Long> count = DraftValues.positiveInteger(guests);
        if (count.isEmpty()) {
            errors.add(INVALID_GUESTS);
        } else if (count.get() > Constants.MAX_GUESTS) {
            errors.add(TOO_MANY_GUESTS);
        }
    }
}
