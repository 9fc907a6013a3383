package com.narrativeplatform.common.signal;

import com.narrativeplatform.common.config.SignalWeights;
import com.narrativeplatform.common.exception.InputRangeException;
import com.narrativeplatform.common.model.CompositeResult;
import com.narrativeplatform.common.model.NormalizedSignals;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verification of {@link SignalAggregator} under the default weights
 * (trend 0.35, news 0.25, risk 0.20, volatility 0.20).
 */
class SignalAggregatorTest {

    private static final SignalWeights WEIGHTS = SignalWeights.DEFAULT;
    private static final double[] GRID = { -1.0, -0.6, -0.25, 0.0, 0.3, 0.75, 1.0 };

    // ── composite & confidence ────────────────────────────────────────────

    @Nested
    @DisplayName("aggregate(): composite and confidence")
    class CompositeTests {

        @Test
        @DisplayName("worked example → composite 0.22, confidence 61.0")
        void workedExample() {
            CompositeResult result = SignalAggregator.aggregate(
                NormalizedSignals.of(0.6, 0.2, -0.1, -0.1), WEIGHTS);

            assertEquals(0.22, result.composite(), 1e-9);
            assertEquals(61.0, result.confidence(), 1e-9);
        }

        @Test
        @DisplayName("all signals 0 → composite 0, confidence 50, not conflicting")
        void allZero() {
            CompositeResult result = SignalAggregator.aggregate(NormalizedSignals.neutral(), WEIGHTS);

            assertEquals(0.0, result.composite());
            assertEquals(50.0, result.confidence());
            assertFalse(result.conflicting());
        }

        @Test
        @DisplayName("all +1 → composite 1, confidence 100")
        void allMax() {
            CompositeResult result = SignalAggregator.aggregate(NormalizedSignals.of(1, 1, 1, 1), WEIGHTS);
            assertEquals(1.0, result.composite(), 1e-9);
            assertEquals(100.0, result.confidence(), 1e-9);
        }

        @Test
        @DisplayName("all -1 → composite -1, confidence 0")
        void allMin() {
            CompositeResult result = SignalAggregator.aggregate(NormalizedSignals.of(-1, -1, -1, -1), WEIGHTS);
            assertEquals(-1.0, result.composite(), 1e-9);
            assertEquals(0.0, result.confidence(), 1e-9);
        }

        @Test
        @DisplayName("every grid tuple stays within [-1,1] and [0,100]")
        void rangeHoldsAcrossGrid() {
            for (double t : GRID) for (double n : GRID) for (double r : GRID) for (double v : GRID) {
                CompositeResult result = SignalAggregator.aggregate(NormalizedSignals.of(t, n, r, v), WEIGHTS);
                assertTrue(result.composite() >= -1.0 && result.composite() <= 1.0,
                    "composite out of range for " + t + "," + n + "," + r + "," + v);
                assertTrue(result.confidence() >= 0.0 && result.confidence() <= 100.0,
                    "confidence out of range for " + t + "," + n + "," + r + "," + v);
            }
        }

        @Test
        @DisplayName("confidence is the linear rescale of composite")
        void confidenceIsRescale() {
            CompositeResult result = SignalAggregator.aggregate(NormalizedSignals.of(-0.4, 0.9, 0.1, -0.7), WEIGHTS);
            assertEquals(((result.composite() + 1.0) / 2.0) * 100.0, result.confidence(), 1e-9);
        }

        @Test
        @DisplayName("custom weights are honoured")
        void customWeights() {
            SignalWeights trendOnly = new SignalWeights(1.0, 0.0, 0.0, 0.0);
            CompositeResult result = SignalAggregator.aggregate(NormalizedSignals.of(0.4, -1, -1, -1), trendOnly);
            assertEquals(0.4, result.composite(), 1e-9);
        }
    }

    // ── monotonicity ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("monotonicity")
    class MonotonicityTests {

        @Test
        @DisplayName("raising trend 0.0 → 0.6 never lowers composite")
        void trendIncrease() {
            double previous = Double.NEGATIVE_INFINITY;
            for (int step = 0; step <= 6; step++) {
                double trend = step / 10.0;
                double composite = SignalAggregator.aggregate(
                    NormalizedSignals.of(trend, 0.2, -0.1, -0.1), WEIGHTS).composite();
                assertTrue(composite >= previous, "composite dropped at trend=" + trend);
                previous = composite;
            }
        }

        @Test
        @DisplayName("raising any single signal never lowers composite")
        void eachSignalIncrease() {
            for (int index = 0; index < 4; index++) {
                for (double low : GRID) for (double high : GRID) {
                    if (high < low) continue;
                    double[] base = { 0.1, -0.3, 0.5, -0.8 };
                    double[] raised = base.clone();
                    base[index] = low;
                    raised[index] = high;
                    double before = SignalAggregator.aggregate(of(base), WEIGHTS).composite();
                    double after  = SignalAggregator.aggregate(of(raised), WEIGHTS).composite();
                    assertTrue(after >= before, "signal " + index + " raised " + low + "→" + high);
                }
            }
        }

        private NormalizedSignals of(double[] v) {
            return NormalizedSignals.of(v[0], v[1], v[2], v[3]);
        }
    }

    // ── input validation ──────────────────────────────────────────────────

    @Nested
    @DisplayName("input validation")
    class ValidationTests {

        @Test
        @DisplayName("signal above 1 → InputRangeException")
        void aboveRange() {
            InputRangeException e = assertThrows(InputRangeException.class,
                () -> SignalAggregator.aggregate(NormalizedSignals.of(1.01, 0, 0, 0), WEIGHTS));
            assertTrue(e.getMessage().contains("trend"));
        }

        @Test
        @DisplayName("signal below -1 → InputRangeException")
        void belowRange() {
            assertThrows(InputRangeException.class,
                () -> SignalAggregator.aggregate(NormalizedSignals.of(0, 0, 0, -1.5), WEIGHTS));
        }

        @Test
        @DisplayName("NaN signal → InputRangeException")
        void nanSignal() {
            assertThrows(InputRangeException.class,
                () -> SignalAggregator.aggregate(NormalizedSignals.of(0, Double.NaN, 0, 0), WEIGHTS));
        }

        @Test
        @DisplayName("null signals → InputRangeException")
        void nullSignals() {
            assertThrows(InputRangeException.class, () -> SignalAggregator.aggregate(null, WEIGHTS));
        }

        @Test
        @DisplayName("bounds themselves are accepted")
        void boundsAccepted() {
            assertDoesNotThrow(() -> SignalAggregator.aggregate(NormalizedSignals.of(-1, 1, -1, 1), WEIGHTS));
        }
    }
}
