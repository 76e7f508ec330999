package com.photobooth.booking.pricing;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.math.BigDecimal;

/**
 * A discount, tax or deposit: either a fixed amount or a percentage.
 * Catalog data may send a bare number (fixed) or {@code {type, value}}; both are resolved here once.
 */
@JsonDeserialize(using = AdjustmentDeserializer.class)
public record Adjustment(Type type, BigDecimal value) {

    public static final Adjustment NONE = fixed(BigDecimal.ZERO);

    public enum Type {
        FIXED,
        PERCENT
    }

    public Adjustment {
        type = type == null ? Type.FIXED : type;
        value = value == null ? BigDecimal.ZERO : value;
    }

    public static Adjustment fixed(BigDecimal amount) {
        return new Adjustment(Type.FIXED, amount);
    }

    public static Adjustment percent(BigDecimal value) {
        return new Adjustment(Type.PERCENT, value);
    }

    @JsonIgnore
    public boolean isPercent() {
        return type == Type.PERCENT;
    }
}
