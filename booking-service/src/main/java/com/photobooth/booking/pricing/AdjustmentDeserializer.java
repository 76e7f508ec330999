package com.photobooth.booking.pricing;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.Locale;

/**
 * Reads {@code number | {type, value}} into an {@link Adjustment}.
 *
 * A bare number is a fixed amount, {@code type} "percent" (or "percentage") is a percentage and
 * anything else is fixed. The value may also be named {@code amount}. Unreadable values are zero.
 */
public class AdjustmentDeserializer extends StdDeserializer<Adjustment> {

    public AdjustmentDeserializer() {
        super(Adjustment.class);
    }

    @Override
    public Adjustment deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonNode node = parser.readValueAsTree();
        if (node == null || node.isNull()) {
            return Adjustment.NONE;
        }
        if (node.isNumber() || node.isTextual()) {
            return Adjustment.fixed(amountOf(node));
        }
        if (!node.isObject()) {
            return Adjustment.NONE;
        }
        JsonNode value = node.hasNonNull("value") ? node.get("value") : node.get("amount");
        String type = node.path("type").asText("").trim().toLowerCase(Locale.ROOT);
        boolean percent = type.equals("percent") || type.equals("percentage");
        return percent ? Adjustment.percent(amountOf(value)) : Adjustment.fixed(amountOf(value));
    }

    @Override
    public Adjustment getNullValue(DeserializationContext context) {
        return Adjustment.NONE;
    }

    static BigDecimal amountOf(JsonNode node) {
        if (node == null || node.isNull()) {
            return BigDecimal.ZERO;
        }
        if (node.isNumber()) {
            if (node.isFloatingPointNumber() && !Double.isFinite(node.asDouble())) {
                return BigDecimal.ZERO;
            }
            return node.decimalValue();
        }
        if (node.isTextual()) {
            try {
                return new BigDecimal(node.asText().trim());
            } catch (NumberFormatException e) {
                return BigDecimal.ZERO;
            }
        }
        return BigDecimal.ZERO;
    }
}
