package com.narrativeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Engine output. Value-equal for value-equal {@link NarrativeRequest}s. */
public record NarrativeResult(
    @JsonProperty("signals") MarketSignals signals,
    @JsonProperty("narrative") NarrativeOutput narrative,
    @JsonProperty("reasoning") ReasoningTrace reasoning
) {}
