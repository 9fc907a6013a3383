package com.narrativeplatform.common.config;

import com.narrativeplatform.common.exception.ConfigurationException;

/**
 * Cut-offs used by {@link com.narrativeplatform.common.classifier.BiasAndStrengthClassifier}.
 *
 * <pre>
 *   |composite| &lt;= deadZone  → Neutral bias
 *   |composite| &gt;= strong    → Strong
 *   |composite| &gt;= moderate  → Moderate
 *   otherwise                 → Weak
 * </pre>
 *
 * Required ordering: {@code 0 <= deadZone < moderate <= strong <= 1}.
 */
public record ClassificationThresholds(double deadZone, double strong, double moderate) {

    public static final ClassificationThresholds DEFAULT = new ClassificationThresholds(0.05, 0.5, 0.2);

    public ClassificationThresholds validate() {
        if (Double.isNaN(deadZone) || Double.isNaN(strong) || Double.isNaN(moderate)) {
            throw new ConfigurationException("ClassificationThresholds", "thresholds must be numbers");
        }
        if (deadZone < 0.0 || deadZone >= moderate || moderate > strong || strong > 1.0) {
            throw new ConfigurationException("ClassificationThresholds",
                String.format("expected 0 <= deadZone < moderate <= strong <= 1 but got deadZone=%s moderate=%s strong=%s",
                    deadZone, moderate, strong));
        }
        return this;
    }
}
