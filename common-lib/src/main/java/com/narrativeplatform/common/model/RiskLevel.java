package com.narrativeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Risk bucket reported in {@code market_state.risk_level}. */
public enum RiskLevel {
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High");

    private final String label;

    RiskLevel(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static RiskLevel fromLabel(String raw) {
        return Labels.parse(RiskLevel.class, raw, c -> new String[] { c.label, c.name() });
    }
}
