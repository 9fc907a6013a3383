package com.narrativeplatform.common.config;

import com.narrativeplatform.common.exception.ConfigurationException;

/**
 * Per-source weights for the composite score.
 *
 * <p>Each weight must lie in [0, 1] and the four must sum to 1.0 within
 * {@value #SUM_TOLERANCE}. Non-negative weights keep the composite monotone in
 * every signal.
 */
public record SignalWeights(double trend, double news, double risk, double volatility) {

    static final double SUM_TOLERANCE = 1e-6;

    public static final SignalWeights DEFAULT = new SignalWeights(0.35, 0.25, 0.20, 0.20);

    public double sum() {
        return trend + news + risk + volatility;
    }

    /**
     * @throws ConfigurationException when a weight is out of range or the sum is not 1.0
     */
    public SignalWeights validate() {
        requireUnit("trend", trend);
        requireUnit("news", news);
        requireUnit("risk", risk);
        requireUnit("volatility", volatility);
        double sum = sum();
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new ConfigurationException("SignalWeights",
                String.format("weights must sum to 1.0 but sum to %.6f (trend=%.4f news=%.4f risk=%.4f volatility=%.4f)",
                    sum, trend, news, risk, volatility));
        }
        return this;
    }

    private static void requireUnit(String name, double weight) {
        if (Double.isNaN(weight) || weight < 0.0 || weight > 1.0) {
            throw new ConfigurationException("SignalWeights",
                "weight '" + name + "' must be in [0, 1] but was " + weight);
        }
    }
}
