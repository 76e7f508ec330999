package com.photobooth.booking.exception;

import com.photobooth.common.exception.BusinessException;
import lombok.Getter;

import java.util.List;

/**
 * Thrown when a booking is created from a draft that fails validation.
 * Carries every validation message, not only the first.
 */
@Getter
public class BookingValidationException extends BusinessException {

    public static final String ERROR_CODE = "VALIDATION_ERROR";

    private final List<String> errors;

    public BookingValidationException(List<String> errors) {
        super("Booking draft is invalid: " + String.join(" ", errors), ERROR_CODE);
        this.errors = List.copyOf(errors);
    }
}
