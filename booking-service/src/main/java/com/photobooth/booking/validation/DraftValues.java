package com.photobooth.booking.validation;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Coercions for the untyped values of a {@link BookingDraft}.
 */
public final class DraftValues {
    private DraftValues() {
        // Utility class
    }

    private static final Pattern DIGITS = Pattern.compile("^\\d+$");
    private static final Set<String> ACCEPTED = Set.of("true", "1", "yes", "y", "on");

    public static boolean isNonEmptyString(Object value) {
        return value instanceof String s && !s.trim().isEmpty();
    }

    /**
     * Blank strings, {@code false} and zero count as absent, like an unchecked form field.
     */
    public static boolean isPresent(Object value) {
        if (value == null || Boolean.FALSE.equals(value)) {
            return false;
        }
        if (value instanceof String s) {
            return !s.isEmpty();
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0;
        }
        return true;
    }

    /**
     * A strictly positive whole number given as a JSON number or a string of digits.
     */
    public static Optional<Long> positiveInteger(Object value) {
        if (value instanceof Number n) {
            BigDecimal decimal = toDecimal(n);
            if (decimal == null || decimal.signum() <= 0 || decimal.stripTrailingZeros().scale() > 0) {
                return Optional.empty();
            }
            try {
                return Optional.of(decimal.longValueExact());
            } catch (ArithmeticException e) {
                // beyond the long range, read the same way as an oversized string
                return Optional.of(Long.MAX_VALUE);
            }
        }
        if (value instanceof String s && DIGITS.matcher(s).matches()) {
            try {
                long parsed = Long.parseLong(s);
                return parsed > 0 ? Optional.of(parsed) : Optional.empty();
            } catch (NumberFormatException e) {
                // more digits than a long holds
                return Optional.of(Long.MAX_VALUE);
            }
        }
        return Optional.empty();
    }

    public static boolean isAccepted(Object value) {
        if (Boolean.TRUE.equals(value)) {
            return true;
        }
        if (value instanceof String s) {
            return ACCEPTED.contains(s.trim().toLowerCase(Locale.ROOT));
        }
        if (value instanceof Number n) {
            BigDecimal decimal = toDecimal(n);
            return decimal != null && decimal.compareTo(BigDecimal.ONE) == 0;
        }
        return false;
    }

    /**
     * Display name: {@code fullName}, else {@code firstName} and {@code lastName} joined, else {@code name}.
     */
    public static String displayName(BookingDraft draft) {
        if (isNonEmptyString(draft.fullName())) {
            return ((String) draft.fullName()).trim();
        }
        if (isNonEmptyString(draft.firstName()) || isNonEmptyString(draft.lastName())) {
            StringBuilder name = new StringBuilder();
            if (isNonEmptyString(draft.firstName())) {
                name.append(((String) draft.firstName()).trim());
            }
            if (isNonEmptyString(draft.lastName())) {
                if (name.length() > 0) {
                    name.append(' ');
                }
                name.append(((String) draft.lastName()).trim());
            }
            return name.toString();
        }
        if (isNonEmptyString(draft.name())) {
            return ((String) draft.name()).trim();
        }
        return "";
    }

    public static Optional<String> trimmedText(Object value) {
        return isNonEmptyString(value) ? Optional.of(((String) value).trim()) : Optional.empty();
    }

    private static BigDecimal toDecimal(Number n) {
        if (n instanceof BigDecimal decimal) {
            return decimal;
        }
        if (n instanceof Double || n instanceof Float) {
            double d = n.doubleValue();
            return Double.isFinite(d) ? BigDecimal.valueOf(d) : null;
        }
        return new BigDecimal(n.toString());
    }
}
