package com.photobooth.booking.pricing;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigDecimal;

/**
 * A selected add-on. Quantity is floored and at least 1 when priced.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AddOnLine(
        String id,
        String name,
        BigDecimal price,
        BigDecimal quantity
) {
    public static AddOnLine of(BigDecimal price, int quantity) {
        return new AddOnLine(null, null, price, BigDecimal.valueOf(quantity));
    }
}
