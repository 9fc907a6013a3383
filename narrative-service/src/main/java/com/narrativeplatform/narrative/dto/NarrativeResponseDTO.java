package com.narrativeplatform.narrative.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.narrativeplatform.common.model.MarketSignals;
import com.narrativeplatform.common.model.MarketState;
import com.narrativeplatform.common.model.NarrativeOutput;
import com.narrativeplatform.common.model.ReasoningTrace;

import java.time.Instant;

/** {@code degraded} is set when no usable signal source was supplied. */
public record NarrativeResponseDTO(
    @JsonProperty("status") String status,
    @JsonProperty("symbol") String symbol,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("degraded") boolean degraded,
    @JsonProperty("market_state") MarketState marketState,
    @JsonProperty("signals") MarketSignals signals,
    @JsonProperty("narrative") NarrativeOutput narrative,
    @JsonProperty("reasoning") ReasoningTrace reasoning
) {
    public static final String STATUS_SUCCESS = "success";
}
