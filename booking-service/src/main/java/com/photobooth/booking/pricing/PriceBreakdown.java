package com.photobooth.booking.pricing;

import java.math.BigDecimal;

/**
 * Staged price of a package selection. Every amount is non-negative with two decimals;
 * {@code total} is what the customer owes, {@code depositAmount} is the part due up front.
 */
public record PriceBreakdown(
        BigDecimal base,
        BigDecimal travel,
        BigDecimal addonsTotal,
        BigDecimal subtotalBeforeDiscountAndTax,
        BigDecimal discountAmount,
        BigDecimal taxedBase,
        BigDecimal taxAmount,
        BigDecimal total,
        BigDecimal depositAmount
) {
}
