package com.narrativeplatform.common.classifier;

import com.narrativeplatform.common.config.ClassificationThresholds;
import com.narrativeplatform.common.model.MarketBias;
import com.narrativeplatform.common.model.SignalStrength;

/**
 * Maps a composite score to a {@link MarketBias} and a {@link SignalStrength}.
 *
 * <p>Rules:
 * <ol>
 *   <li>composite &gt; deadZone → BULLISH; composite &lt; −deadZone → BEARISH; else NEUTRAL</li>
 *   <li>|composite| ≥ strong → STRONG; ≥ moderate → MODERATE; else WEAK</li>
 *   <li>conflicting signals downgrade strength by one level, so a conflicting
 *       input is never STRONG</li>
 * </ol>
 */
public final class BiasAndStrengthClassifier {

    private BiasAndStrengthClassifier() {}

    public static Classification classify(double composite, boolean conflicting,
                                          ClassificationThresholds thresholds) {
        return new Classification(
            bias(composite, thresholds),
            strength(composite, conflicting, thresholds));
    }

    static MarketBias bias(double composite, ClassificationThresholds thresholds) {
        if (composite >  thresholds.deadZone()) return MarketBias.BULLISH;
        if (composite < -thresholds.deadZone()) return MarketBias.BEARISH;
        return MarketBias.NEUTRAL;
    }

    static SignalStrength strength(double composite, boolean conflicting,
                                   ClassificationThresholds thresholds) {
        double magnitude = Math.abs(composite);
        SignalStrength strength;
        if (magnitude >= thresholds.strong())        strength = SignalStrength.STRONG;
        else if (magnitude >= thresholds.moderate()) strength = SignalStrength.MODERATE;
        else                                         strength = SignalStrength.WEAK;
        return conflicting ? strength.downgrade() : strength;
    }
}
