package com.photobooth.booking.pricing;

import com.photobooth.common.util.Constants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Computes the price breakdown of a package selection.
 *
 * Pipeline: base + add-ons + travel = subtotal, minus discount = taxed base, plus tax = total.
 * Negative or missing components count as zero, a discount never exceeds the subtotal and
 * percentages are clamped to [0, 100]. Intermediate values stay exact; each output amount is
 * rounded half-up to cents on the way out.
 *
 * A percentage deposit is taken from the taxed base (after discount, before tax) so the deposit
 * does not move when the tax rate does.
 */
@Slf4j
@Service
public class PricingService {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public PriceBreakdown computeBreakdown(PackageQuote quote) {
        if (quote == null) {
            return zero();
        }

        BigDecimal base = nonNegative(quote.basePrice());
        BigDecimal travel = nonNegative(quote.travelFee());
        BigDecimal addonsTotal = quote.addOns().stream()
                .filter(Objects::nonNull)
                .map(a -> nonNegative(a.price()).multiply(quantityOf(a.quantity())))
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        BigDecimal subtotal = base.add(addonsTotal).add(travel);
        BigDecimal discountAmount = discountOf(quote.discount(), subtotal);
        BigDecimal taxedBase = subtotal.subtract(discountAmount);
        BigDecimal taxAmount = taxOf(quote.tax(), taxedBase);
        BigDecimal total = taxedBase.add(taxAmount).max(BigDecimal.ZERO);
        BigDecimal depositAmount = quote.deposit() == null
                ? BigDecimal.ZERO
                : computeDeposit(taxedBase, quote.deposit());

        log.debug("Priced package {}: subtotal={}, discount={}, tax={}, total={}",
                quote.packageId(), subtotal, discountAmount, taxAmount, total);

        return new PriceBreakdown(
                money(base),
                money(travel),
                money(addonsTotal),
                money(subtotal),
                money(discountAmount),
                money(taxedBase),
                money(taxAmount),
                money(total),
                money(depositAmount));
    }

    /**
     * Deposit over a post-discount, pre-tax base: a percentage of it, or a fixed amount.
     */
    public BigDecimal computeDeposit(BigDecimal taxedBase, Adjustment deposit) {
        if (deposit == null) {
            return BigDecimal.ZERO;
        }
        if (deposit.isPercent()) {
            return percentOf(nonNegative(taxedBase), deposit.value());
        }
        return nonNegative(deposit.value());
    }

    private BigDecimal discountOf(Adjustment discount, BigDecimal subtotal) {
        BigDecimal amount = discount.isPercent()
                ? percentOf(subtotal, discount.value())
                : nonNegative(discount.value());
        return amount.min(subtotal);
    }

    private BigDecimal taxOf(Adjustment tax, BigDecimal taxedBase) {
        return tax.isPercent()
                ? percentOf(taxedBase, tax.value())
                : nonNegative(tax.value());
    }

    private static BigDecimal percentOf(BigDecimal amount, BigDecimal percent) {
        BigDecimal clamped = nonNegative(percent).min(HUNDRED);
        return amount.multiply(clamped).movePointLeft(2);
    }

    private static BigDecimal quantityOf(BigDecimal quantity) {
        if (quantity == null) {
            return BigDecimal.ONE;
        }
        return quantity.setScale(0, RoundingMode.FLOOR).max(BigDecimal.ONE);
    }

    private static BigDecimal nonNegative(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value.max(BigDecimal.ZERO);
    }

    private static BigDecimal money(BigDecimal value) {
        return value.setScale(Constants.MONEY_SCALE, RoundingMode.HALF_UP);
    }

    private static PriceBreakdown zero() {
        BigDecimal zero = money(BigDecimal.ZERO);
        return new PriceBreakdown(zero, zero, zero, zero, zero, zero, zero, zero, zero);
    }
}
