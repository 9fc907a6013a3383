package com.narrativeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MarketSignals(
    @JsonProperty("market_bias") MarketBias marketBias,
    @JsonProperty("signal_strength") SignalStrength signalStrength
) {}
