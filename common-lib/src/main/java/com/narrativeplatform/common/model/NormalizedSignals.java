package com.narrativeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The four evidence sources, each already normalized to [-1, 1] by the caller.
 * Range checks happen in {@link com.narrativeplatform.common.signal.SignalAggregator}.
 */
public record NormalizedSignals(
    @JsonProperty("trend") double trend,
    @JsonProperty("news") double news,
    @JsonProperty("risk") double risk,
    @JsonProperty("volatility") double volatility
) {
    public static NormalizedSignals of(double trend, double news, double risk, double volatility) {
        return new NormalizedSignals(trend, news, risk, volatility);
    }

    /** All four sources at 0.0: no evidence in either direction. */
    public static NormalizedSignals neutral() {
        return new NormalizedSignals(0.0, 0.0, 0.0, 0.0);
    }

    /** Values in trend, news, risk, volatility order. */
    public double[] values() {
        return new double[] { trend, news, risk, volatility };
    }
}
