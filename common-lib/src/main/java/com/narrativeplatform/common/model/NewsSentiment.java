package com.narrativeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Aggregated news tone reported in {@code market_state.news_sentiment}. */
public enum NewsSentiment {
    POSITIVE("Positive"),
    NEUTRAL("Neutral"),
    NEGATIVE("Negative");

    private final String label;

    NewsSentiment(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static NewsSentiment fromLabel(String raw) {
        return Labels.parse(NewsSentiment.class, raw, c -> new String[] { c.label, c.name() });
    }
}
