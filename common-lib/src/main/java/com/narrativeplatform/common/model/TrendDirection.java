package com.narrativeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Price trend label reported in {@code market_state.trend}. */
public enum TrendDirection {
    UPTREND("Uptrend"),
    SIDEWAYS("Sideways"),
    DOWNTREND("Downtrend");

    private final String label;

    TrendDirection(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static TrendDirection fromLabel(String raw) {
        return Labels.parse(TrendDirection.class, raw, c -> new String[] { c.label, c.name() });
    }
}
