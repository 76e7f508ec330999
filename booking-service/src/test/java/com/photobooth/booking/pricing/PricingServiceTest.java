package com.photobooth.booking.pricing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.photobooth.booking.support.BookingFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PricingServiceTest {

    private final PricingService pricingService = new PricingService();
    private final ObjectMapper objectMapper = BookingFixtures.objectMapper();

    private static BigDecimal money(String value) {
        return new BigDecimal(value);
    }

    @Test
    @DisplayName("percent discount and tax: 100 + 2x20 less 10% plus 8% = 136.08")
    void computeBreakdown_example() throws Exception {
        // given
        PackageQuote quote = objectMapper.readValue("""
                {"basePrice": 100,
                 "addOns": [{"price": 20, "quantity": 2}],
                 "discount": {"type": "percent", "value": 10},
                 "tax": {"type": "percent", "value": 8}}
                """, PackageQuote.class);

        // when
        PriceBreakdown breakdown = pricingService.computeBreakdown(quote);

        // then
        assertThat(breakdown.addonsTotal()).isEqualTo(money("40.00"));
        assertThat(breakdown.subtotalBeforeDiscountAndTax()).isEqualTo(money("140.00"));
        assertThat(breakdown.discountAmount()).isEqualTo(money("14.00"));
        assertThat(breakdown.taxedBase()).isEqualTo(money("126.00"));
        assertThat(breakdown.taxAmount()).isEqualTo(money("10.08"));
        assertThat(breakdown.total()).isEqualTo(money("136.08"));
        assertThat(breakdown.depositAmount()).isEqualTo(money("0.00"));
    }

    @Test
    @DisplayName("a fixed discount larger than the subtotal is capped at the subtotal")
    void computeBreakdown_discountCapped() {
        PackageQuote quote = PackageQuote.builder()
                .basePrice(money("50"))
                .travelFee(money("25"))
                .discount(Adjustment.fixed(money("500")))
                .tax(Adjustment.fixed(money("3.50")))
                .build();

        PriceBreakdown breakdown = pricingService.computeBreakdown(quote);

        assertThat(breakdown.discountAmount()).isEqualTo(money("75.00"));
        assertThat(breakdown.taxedBase()).isEqualTo(money("0.00"));
        assertThat(breakdown.total()).isEqualTo(money("3.50"));
        assertThat(breakdown.total()).isGreaterThanOrEqualTo(breakdown.taxAmount());
    }

    @Test
    @DisplayName("negative amounts count as zero and percentages are clamped to 100")
    void computeBreakdown_clamping() {
        PackageQuote quote = PackageQuote.builder()
                .basePrice(money("-10"))
                .addOns(List.of(AddOnLine.of(money("-5"), 3), AddOnLine.of(money("15"), 1)))
                .discount(Adjustment.percent(money("150")))
                .tax(Adjustment.percent(money("-5")))
                .build();

        PriceBreakdown breakdown = pricingService.computeBreakdown(quote);

        assertThat(breakdown.base()).isEqualTo(money("0.00"));
        assertThat(breakdown.addonsTotal()).isEqualTo(money("15.00"));
        assertThat(breakdown.discountAmount()).isEqualTo(money("15.00"));
        assertThat(breakdown.taxAmount()).isEqualTo(money("0.00"));
        assertThat(breakdown.total()).isEqualTo(money("0.00"));
    }

    @Test
    @DisplayName("add-on quantity is floored, at least 1, and defaults to 1")
    void computeBreakdown_quantities() {
        PackageQuote quote = PackageQuote.builder()
                .addOns(List.of(
                        new AddOnLine("a", "Props", money("10"), money("2.7")),
                        new AddOnLine("b", "Album", money("30"), money("0")),
                        new AddOnLine("c", "Guestbook", money("5"), null)))
                .build();

        assertThat(pricingService.computeBreakdown(quote).addonsTotal()).isEqualTo(money("55.00"));
    }

    @Test
    @DisplayName("percent deposit is taken from the discounted base, before tax")
    void computeBreakdown_deposit() {
        PackageQuote quote = PackageQuote.builder()
                .basePrice(money("200"))
                .discount(Adjustment.fixed(money("50")))
                .tax(Adjustment.percent(money("20")))
                .deposit(Adjustment.percent(money("25")))
                .build();

        PriceBreakdown breakdown = pricingService.computeBreakdown(quote);

        assertThat(breakdown.total()).isEqualTo(money("180.00"));
        assertThat(breakdown.depositAmount()).isEqualTo(money("37.50"));
        assertThat(pricingService.computeDeposit(money("150"), Adjustment.fixed(money("-20"))))
                .isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    @DisplayName("a missing quote prices as zero")
    void computeBreakdown_null() {
        assertThat(pricingService.computeBreakdown(null).total()).isEqualTo(money("0.00"));
    }

    @Test
    @DisplayName("rounding happens once, on output")
    void computeBreakdown_roundsHalfUp() {
        PackageQuote quote = PackageQuote.builder()
                .basePrice(money("10.005"))
                .tax(Adjustment.percent(money("10")))
                .build();

        PriceBreakdown breakdown = pricingService.computeBreakdown(quote);

        assertThat(breakdown.base()).isEqualTo(money("10.01"));
        assertThat(breakdown.taxAmount()).isEqualTo(money("1.00"));
        assertThat(breakdown.total()).isEqualTo(money("11.01"));
    }
}
