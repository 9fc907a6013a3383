package com.narrativeplatform.narrative.signal;

import com.narrativeplatform.common.model.MarketState;
import com.narrativeplatform.common.model.NewsSentiment;
import com.narrativeplatform.common.model.NormalizedSignals;
import com.narrativeplatform.common.model.RiskLevel;
import com.narrativeplatform.common.model.TrendDirection;
import com.narrativeplatform.common.model.VolatilityLevel;

/**
 * Converts between {@link MarketState} labels and {@link NormalizedSignals}.
 *
 * <pre>
 *   trend       Uptrend +1.0   Sideways 0.0   Downtrend -1.0
 *   news        Positive +1.0  Neutral 0.0    Negative -1.0
 *   risk        Low +0.3       Medium 0.0     High -0.3
 *   volatility  Low +0.2       Moderate 0.0   High -0.2   Very High -0.4
 * </pre>
 *
 * <p>The reverse direction ({@link #describe}) is used only to label sources
 * the caller left out, so that the narrative never describes a state the
 * signals contradict.
 */
public final class MarketStateSignalMapper {

    static final double LABEL_BAND          = 0.1;
    static final double VERY_HIGH_VOL_BAND  = 0.3;

    private MarketStateSignalMapper() {}

    /** Requires trend, risk level, volatility and news sentiment to be set. */
    public static NormalizedSignals toSignals(MarketState state) {
        return NormalizedSignals.of(
            trendSignal(state.trend()),
            newsSignal(state.newsSentiment()),
            riskSignal(state.riskLevel()),
            volatilitySignal(state.volatility()));
    }

    public static double trendSignal(TrendDirection trend) {
        return switch (trend) {
            case UPTREND   -> 1.0;
            case SIDEWAYS  -> 0.0;
            case DOWNTREND -> -1.0;
        };
    }

    public static double newsSignal(NewsSentiment sentiment) {
        return switch (sentiment) {
            case POSITIVE -> 1.0;
            case NEUTRAL  -> 0.0;
            case NEGATIVE -> -1.0;
        };
    }

    public static double riskSignal(RiskLevel risk) {
        return switch (risk) {
            case LOW    -> 0.3;
            case MEDIUM -> 0.0;
            case HIGH   -> -0.3;
        };
    }

    public static double volatilitySignal(VolatilityLevel volatility) {
        return switch (volatility) {
            case LOW       -> 0.2;
            case MODERATE  -> 0.0;
            case HIGH      -> -0.2;
            case VERY_HIGH -> -0.4;
        };
    }

    /**
     * Fills every missing label of {@code partial} from the matching signal.
     * Labels already present are kept. {@code partial} may be {@code null}.
     */
    public static MarketState describe(MarketState partial, NormalizedSignals signals) {
        MarketState base = partial != null ? partial : new MarketState(null, null, null, null, null);
        return new MarketState(
            base.trend() != null ? base.trend() : describeTrend(signals.trend()),
            base.confidence(),
            base.riskLevel() != null ? base.riskLevel() : describeRisk(signals.risk()),
            base.volatility() != null ? base.volatility() : describeVolatility(signals.volatility()),
            base.newsSentiment() != null ? base.newsSentiment() : describeNews(signals.news()));
    }

    static TrendDirection describeTrend(double value) {
        if (value > LABEL_BAND)  return TrendDirection.UPTREND;
        if (value < -LABEL_BAND) return TrendDirection.DOWNTREND;
        return TrendDirection.SIDEWAYS;
    }

    static NewsSentiment describeNews(double value) {
        if (value > LABEL_BAND)  return NewsSentiment.POSITIVE;
        if (value < -LABEL_BAND) return NewsSentiment.NEGATIVE;
        return NewsSentiment.NEUTRAL;
    }

    // Higher risk pulls the signal negative.
    static RiskLevel describeRisk(double value) {
        if (value > LABEL_BAND)  return RiskLevel.LOW;
        if (value < -LABEL_BAND) return RiskLevel.HIGH;
        return RiskLevel.MEDIUM;
    }

    static VolatilityLevel describeVolatility(double value) {
        if (value > LABEL_BAND)          return VolatilityLevel.LOW;
        if (value < -VERY_HIGH_VOL_BAND) return VolatilityLevel.VERY_HIGH;
        if (value < -LABEL_BAND)         return VolatilityLevel.HIGH;
        return VolatilityLevel.MODERATE;
    }
}
