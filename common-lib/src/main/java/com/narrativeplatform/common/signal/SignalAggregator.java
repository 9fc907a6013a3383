package com.narrativeplatform.common.signal;

import com.narrativeplatform.common.config.SignalWeights;
import com.narrativeplatform.common.exception.InputRangeException;
import com.narrativeplatform.common.model.CompositeResult;
import com.narrativeplatform.common.model.NormalizedSignals;

/**
 * Combines the four normalized signals into one composite score.
 *
 * <pre>
 *   composite  = Σ(weight_i × signal_i)               → [-1, 1]
 *   confidence = ((composite + 1) / 2) × 100           → [0, 100]
 * </pre>
 *
 * <p>Weights are assumed validated ({@link SignalWeights#validate()}) when the
 * configuration was loaded; only the signals are checked here. Conflict is
 * delegated to {@link ConflictDetector}.
 */
public final class SignalAggregator {

    private SignalAggregator() {}

    /**
     * @throws InputRangeException when any signal is NaN or outside [-1, 1]
     */
    public static CompositeResult aggregate(NormalizedSignals signals, SignalWeights weights) {
        if (signals == null) {
            throw new InputRangeException("SignalAggregator", "normalized signals are required");
        }
        requireInRange("trend", signals.trend());
        requireInRange("news", signals.news());
        requireInRange("risk", signals.risk());
        requireInRange("volatility", signals.volatility());

        double composite = signals.trend()      * weights.trend()
                         + signals.news()       * weights.news()
                         + signals.risk()       * weights.risk()
                         + signals.volatility() * weights.volatility();

        // clamp for floating-point safety
        composite = Math.max(-1.0, Math.min(1.0, composite));
        double confidence = Math.max(0.0, Math.min(100.0, ((composite + 1.0) / 2.0) * 100.0));

        return new CompositeResult(composite, confidence, ConflictDetector.detect(signals));
    }

    private static void requireInRange(String name, double value) {
        if (Double.isNaN(value) || value < -1.0 || value > 1.0) {
            throw new InputRangeException("SignalAggregator",
                "signal '" + name + "' must be in [-1, 1] but was " + value);
        }
    }
}
