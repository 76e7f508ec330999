package com.photobooth.booking.pricing;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;

import java.math.BigDecimal;
import java.util.List;

/**
 * Immutable pricing input for one package selection. Missing components price as zero.
 */
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public record PackageQuote(
        String packageId,
        BigDecimal basePrice,
        BigDecimal travelFee,
        List<AddOnLine> addOns,
        Adjustment discount,
        Adjustment tax,
        Adjustment deposit
) {
    public PackageQuote {
        addOns = addOns == null ? List.of() : List.copyOf(addOns);
        discount = discount == null ? Adjustment.NONE : discount;
        tax = tax == null ? Adjustment.NONE : tax;
    }
}
