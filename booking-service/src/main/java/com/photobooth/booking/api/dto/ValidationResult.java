package com.photobooth.booking.api.dto;

import java.util.List;

public record ValidationResult(boolean valid, List<String> errors) {
    public static ValidationResult of(List<String> errors) {
        return new ValidationResult(errors.isEmpty(), List.copyOf(errors));
    }
}
