package com.narrativeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Tone applied to the narrative text, ordered from most restrained to most
 * assertive. {@link #ordinal()} is the intensity step.
 */
public enum LanguageIntensity {
    VERY_CAUTIOUS("very_cautious"),
    CAUTIOUS("cautious"),
    NEUTRAL("neutral"),
    CONFIDENT("confident"),
    VERY_CONFIDENT("very_confident");

    private final String label;

    LanguageIntensity(String label) {
        this.label = label;
    }

    public boolean isLessIntenseThan(LanguageIntensity other) {
        return ordinal() < other.ordinal();
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static LanguageIntensity fromLabel(String raw) {
        return Labels.parse(LanguageIntensity.class, raw, c -> new String[] { c.label, c.name() });
    }
}
