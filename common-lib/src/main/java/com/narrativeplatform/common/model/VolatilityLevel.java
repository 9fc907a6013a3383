package com.narrativeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Volatility bucket reported in {@code market_state.volatility}. */
public enum VolatilityLevel {
    LOW("Low"),
    MODERATE("Moderate"),
    HIGH("High"),
    VERY_HIGH("Very High");

    private final String label;

    VolatilityLevel(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static VolatilityLevel fromLabel(String raw) {
        return Labels.parse(VolatilityLevel.class, raw, c -> new String[] { c.label, c.name() });
    }
}
