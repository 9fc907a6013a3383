package com.narrativeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Human-readable market context resolved by the data-fetch layer. The engine
 * only reads it to phrase the narrative; the calling layer echoes it back.
 *
 * <p>{@code confidence} is a 0–100 percentage and may be {@code null} when the
 * caller leaves it to the engine.
 */
public record MarketState(
    @JsonProperty("trend") TrendDirection trend,
    @JsonProperty("confidence") Double confidence,
    @JsonProperty("risk_level") RiskLevel riskLevel,
    @JsonProperty("volatility") VolatilityLevel volatility,
    @JsonProperty("news_sentiment") NewsSentiment newsSentiment
) {
    public MarketState withConfidence(Double value) {
        return new MarketState(trend, value, riskLevel, volatility, newsSentiment);
    }

    public MarketState withNewsSentiment(NewsSentiment value) {
        return new MarketState(trend, confidence, riskLevel, volatility, value);
    }
}
