package com.narrativeplatform.narrative.signal;

import com.narrativeplatform.common.model.MarketState;
import com.narrativeplatform.common.model.NewsSentiment;
import com.narrativeplatform.common.model.NormalizedSignals;
import com.narrativeplatform.common.model.RiskLevel;
import com.narrativeplatform.common.model.TrendDirection;
import com.narrativeplatform.common.model.VolatilityLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MarketStateSignalMapperTest {

    @Nested
    @DisplayName("labels → signals")
    class ToSignalsTests {

        @Test
        @DisplayName("bullish calm state maps to +1 / +1 / +0.3 / +0.2")
        void bullishCalm() {
            NormalizedSignals signals = MarketStateSignalMapper.toSignals(new MarketState(
                TrendDirection.UPTREND, null, RiskLevel.LOW, VolatilityLevel.LOW, NewsSentiment.POSITIVE));

            assertEquals(NormalizedSignals.of(1.0, 1.0, 0.3, 0.2), signals);
        }

        @Test
        @DisplayName("bearish turbulent state maps to -1 / -1 / -0.3 / -0.4")
        void bearishTurbulent() {
            NormalizedSignals signals = MarketStateSignalMapper.toSignals(new MarketState(
                TrendDirection.DOWNTREND, 70.0, RiskLevel.HIGH, VolatilityLevel.VERY_HIGH, NewsSentiment.NEGATIVE));

            assertEquals(NormalizedSignals.of(-1.0, -1.0, -0.3, -0.4), signals);
        }

        @Test
        @DisplayName("middle labels map to zero")
        void middleLabels() {
            assertEquals(0.0, MarketStateSignalMapper.trendSignal(TrendDirection.SIDEWAYS));
            assertEquals(0.0, MarketStateSignalMapper.newsSignal(NewsSentiment.NEUTRAL));
            assertEquals(0.0, MarketStateSignalMapper.riskSignal(RiskLevel.MEDIUM));
            assertEquals(0.0, MarketStateSignalMapper.volatilitySignal(VolatilityLevel.MODERATE));
            assertEquals(-0.2, MarketStateSignalMapper.volatilitySignal(VolatilityLevel.HIGH));
        }
    }

    @Nested
    @DisplayName("signals → missing labels")
    class DescribeTests {

        @Test
        @DisplayName("every volatility label survives a round trip through its signal")
        void volatilityRoundTrip() {
            for (VolatilityLevel level : VolatilityLevel.values()) {
                assertEquals(level, MarketStateSignalMapper.describeVolatility(
                    MarketStateSignalMapper.volatilitySignal(level)));
            }
        }

        @Test
        @DisplayName("null state is fully described from signals")
        void nullState() {
            MarketState state = MarketStateSignalMapper.describe(null, NormalizedSignals.of(0.8, -0.5, -0.25, 0.05));

            assertEquals(TrendDirection.UPTREND, state.trend());
            assertEquals(NewsSentiment.NEGATIVE, state.newsSentiment());
            assertEquals(RiskLevel.HIGH, state.riskLevel());
            assertEquals(VolatilityLevel.MODERATE, state.volatility());
            assertNull(state.confidence());
        }

        @Test
        @DisplayName("labels the caller supplied are kept even when signals disagree")
        void keepsSuppliedLabels() {
            MarketState partial = new MarketState(TrendDirection.DOWNTREND, 42.0, null, null, null);

            MarketState state = MarketStateSignalMapper.describe(partial, NormalizedSignals.of(1.0, 0.0, 0.0, 0.0));

            assertEquals(TrendDirection.DOWNTREND, state.trend());
            assertEquals(42.0, state.confidence());
            assertEquals(NewsSentiment.NEUTRAL, state.newsSentiment());
            assertEquals(RiskLevel.MEDIUM, state.riskLevel());
        }

        @Test
        @DisplayName("values inside the ±0.1 band read as the middle label")
        void band() {
            assertEquals(TrendDirection.SIDEWAYS, MarketStateSignalMapper.describeTrend(0.1));
            assertEquals(TrendDirection.SIDEWAYS, MarketStateSignalMapper.describeTrend(-0.1));
            assertEquals(TrendDirection.UPTREND, MarketStateSignalMapper.describeTrend(0.11));
        }
    }
}
