package com.photobooth.booking.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record StatusChangeRequest(
        @NotBlank(message = "Status is required")
        String status,

        @Size(max = 500, message = "Reason must be at most 500 characters")
        String reason
) {
}
