package com.photobooth.booking.exception;

import com.photobooth.common.exception.BusinessException;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

/**
 * Thrown when the requested slot overlaps an active booking of the same package.
 */
@Getter
public class SlotUnavailableException extends BusinessException {

    public static final String ERROR_CODE = "SLOT_UNAVAILABLE";

    private final List<String> conflictingIds;

    public SlotUnavailableException(Instant start, Instant end, List<String> conflictingIds) {
        super(String.format("Requested slot %s - %s is already booked", start, end), ERROR_CODE);
        this.conflictingIds = List.copyOf(conflictingIds);
    }
}
