package com.narrativeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How much conviction the composite score carries. Derived from |composite|
 * and downgraded one level when the underlying signals conflict.
 */
public enum SignalStrength {
    STRONG("Strong"),
    MODERATE("Moderate"),
    WEAK("Weak");

    private final String label;

    SignalStrength(String label) {
        this.label = label;
    }

    /** One level weaker; {@link #WEAK} stays {@link #WEAK}. */
    public SignalStrength downgrade() {
        return switch (this) {
            case STRONG   -> MODERATE;
            case MODERATE -> WEAK;
            case WEAK     -> WEAK;
        };
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static SignalStrength fromLabel(String raw) {
        return Labels.parse(SignalStrength.class, raw, c -> new String[] { c.label, c.name() });
    }
}
