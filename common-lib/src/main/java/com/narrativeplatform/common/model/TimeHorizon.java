package com.narrativeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Holding period the investor has in mind. Rendered as context only. */
public enum TimeHorizon {
    SHORT_TERM("Short-term"),
    MEDIUM_TERM("Medium-term"),
    LONG_TERM("Long-term");

    private final String label;

    TimeHorizon(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static TimeHorizon fromLabel(String raw) {
        return Labels.parse(TimeHorizon.class, raw, c -> new String[] { c.label, c.name() });
    }
}
