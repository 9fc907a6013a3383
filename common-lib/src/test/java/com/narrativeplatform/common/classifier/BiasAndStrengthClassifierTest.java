package com.narrativeplatform.common.classifier;

import com.narrativeplatform.common.config.ClassificationThresholds;
import com.narrativeplatform.common.model.MarketBias;
import com.narrativeplatform.common.model.SignalStrength;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Boundary checks for {@link BiasAndStrengthClassifier} with default thresholds
 * (deadZone 0.05, moderate 0.2, strong 0.5).
 */
class BiasAndStrengthClassifierTest {

    private static final ClassificationThresholds T = ClassificationThresholds.DEFAULT;

    @Nested
    @DisplayName("bias")
    class BiasTests {

        @Test
        @DisplayName("0.22 → BULLISH")
        void bullish() {
            assertEquals(MarketBias.BULLISH, BiasAndStrengthClassifier.classify(0.22, false, T).bias());
        }

        @Test
        @DisplayName("-0.3 → BEARISH")
        void bearish() {
            assertEquals(MarketBias.BEARISH, BiasAndStrengthClassifier.classify(-0.3, false, T).bias());
        }

        @Test
        @DisplayName("exactly ±deadZone → NEUTRAL")
        void deadZoneEdges() {
            assertEquals(MarketBias.NEUTRAL, BiasAndStrengthClassifier.classify(0.05, false, T).bias());
            assertEquals(MarketBias.NEUTRAL, BiasAndStrengthClassifier.classify(-0.05, false, T).bias());
        }

        @Test
        @DisplayName("just outside deadZone → directional")
        void justOutside() {
            assertEquals(MarketBias.BULLISH, BiasAndStrengthClassifier.classify(0.0501, false, T).bias());
            assertEquals(MarketBias.BEARISH, BiasAndStrengthClassifier.classify(-0.0501, false, T).bias());
        }

        @Test
        @DisplayName("0 → NEUTRAL / WEAK")
        void zero() {
            Classification c = BiasAndStrengthClassifier.classify(0.0, false, T);
            assertEquals(MarketBias.NEUTRAL, c.bias());
            assertEquals(SignalStrength.WEAK, c.strength());
        }
    }

    @Nested
    @DisplayName("strength")
    class StrengthTests {

        @Test
        @DisplayName("|composite| at strong threshold → STRONG")
        void strongBoundary() {
            assertEquals(SignalStrength.STRONG, BiasAndStrengthClassifier.classify(0.5, false, T).strength());
            assertEquals(SignalStrength.STRONG, BiasAndStrengthClassifier.classify(-0.5, false, T).strength());
        }

        @Test
        @DisplayName("|composite| at moderate threshold → MODERATE")
        void moderateBoundary() {
            assertEquals(SignalStrength.MODERATE, BiasAndStrengthClassifier.classify(0.2, false, T).strength());
            assertEquals(SignalStrength.MODERATE, BiasAndStrengthClassifier.classify(-0.49, false, T).strength());
        }

        @Test
        @DisplayName("below moderate → WEAK")
        void weak() {
            assertEquals(SignalStrength.WEAK, BiasAndStrengthClassifier.classify(0.19, false, T).strength());
        }

        @Test
        @DisplayName("conflict downgrades one level")
        void conflictDowngrades() {
            assertEquals(SignalStrength.MODERATE, BiasAndStrengthClassifier.classify(0.8, true, T).strength());
            assertEquals(SignalStrength.WEAK, BiasAndStrengthClassifier.classify(0.3, true, T).strength());
            assertEquals(SignalStrength.WEAK, BiasAndStrengthClassifier.classify(0.1, true, T).strength());
        }

        @Test
        @DisplayName("conflict does not change bias")
        void conflictKeepsBias() {
            assertEquals(MarketBias.BULLISH, BiasAndStrengthClassifier.classify(0.8, true, T).bias());
        }

        @Test
        @DisplayName("conflicting ⇒ never STRONG, across the whole range")
        void conflictNeverStrong() {
            for (int i = -100; i <= 100; i++) {
                double composite = i / 100.0;
                assertNotEquals(SignalStrength.STRONG,
                    BiasAndStrengthClassifier.classify(composite, true, T).strength(),
                    "composite=" + composite);
            }
        }

        @Test
        @DisplayName("custom thresholds are honoured")
        void customThresholds() {
            ClassificationThresholds tight = new ClassificationThresholds(0.01, 0.3, 0.1);
            Classification c = BiasAndStrengthClassifier.classify(0.31, false, tight);
            assertEquals(SignalStrength.STRONG, c.strength());
            assertEquals(MarketBias.BULLISH, c.bias());
        }
    }
}
