package com.narrativeplatform.common.config;

import com.narrativeplatform.common.reasoning.LanguageIntensityTable;

import java.util.Objects;

/**
 * Immutable, process-wide engine configuration. Loaded once at startup and
 * passed explicitly into every stage; nothing in the engine reads global state.
 *
 * <p>Always construct through {@link #of}, which validates every part and
 * throws {@link com.narrativeplatform.common.exception.ConfigurationException}
 * on the first violation.
 */
public record EngineConfiguration(
    SignalWeights weights,
    ClassificationThresholds thresholds,
    LanguageIntensityTable intensityTable
) {
    public static EngineConfiguration of(SignalWeights weights,
                                         ClassificationThresholds thresholds,
                                         LanguageIntensityTable intensityTable) {
        Objects.requireNonNull(weights, "weights");
        Objects.requireNonNull(thresholds, "thresholds");
        Objects.requireNonNull(intensityTable, "intensityTable");
        return new EngineConfiguration(weights.validate(), thresholds.validate(), intensityTable.validate());
    }

    public static EngineConfiguration defaults() {
        return of(SignalWeights.DEFAULT, ClassificationThresholds.DEFAULT, LanguageIntensityTable.defaults());
    }
}
