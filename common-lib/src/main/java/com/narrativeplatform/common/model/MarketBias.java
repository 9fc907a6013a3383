package com.narrativeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Direction of the composite score after the dead-zone is applied. */
public enum MarketBias {
    BULLISH("Bullish"),
    NEUTRAL("Neutral"),
    BEARISH("Bearish");

    private final String label;

    MarketBias(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static MarketBias fromLabel(String raw) {
        return Labels.parse(MarketBias.class, raw, c -> new String[] { c.label, c.name() });
    }
}
