package com.narrativeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Fully resolved engine input. Built by the calling layer once per request. */
public record NarrativeRequest(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("market_state") MarketState marketState,
    @JsonProperty("normalized_signals") NormalizedSignals normalizedSignals,
    @JsonProperty("investor_profile") InvestorProfile investorProfile
) {
    public static NarrativeRequest of(String symbol, MarketState marketState,
                                      NormalizedSignals normalizedSignals,
                                      InvestorProfile investorProfile) {
        return new NarrativeRequest(symbol, marketState, normalizedSignals, investorProfile);
    }
}
