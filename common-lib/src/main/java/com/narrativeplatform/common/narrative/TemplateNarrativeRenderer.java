package com.narrativeplatform.common.narrative;

import com.narrativeplatform.common.model.InvestorProfile;
import com.narrativeplatform.common.model.LanguageIntensity;
import com.narrativeplatform.common.model.MarketBias;
import com.narrativeplatform.common.model.MarketState;
import com.narrativeplatform.common.model.NarrativeOutput;
import com.narrativeplatform.common.model.NewsSentiment;
import com.narrativeplatform.common.model.PrimaryGoal;
import com.narrativeplatform.common.model.RiskLevel;
import com.narrativeplatform.common.model.SignalStrength;
import com.narrativeplatform.common.model.TimeHorizon;
import com.narrativeplatform.common.model.VolatilityLevel;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic slot-filling {@link NarrativeRenderer}.
 *
 * <h3>Headline</h3>
 * <pre>
 *   "{Clear|Moderate|Mixed} {Bias} Outlook with {RiskLevel} Risk"
 * </pre>
 *
 * <h3>Body (seven sentences, in order)</h3>
 * <ol>
 *   <li>trend and composite confidence</li>
 *   <li>signal agreement or conflict</li>
 *   <li>news sentiment relative to the bias</li>
 *   <li>risk and volatility framing</li>
 *   <li>guidance for the investor's primary goal under the bias</li>
 *   <li>time-horizon context</li>
 *   <li>recommendation hint toned by {@link LanguageIntensity}</li>
 * </ol>
 *
 * <p>All formatting uses {@link Locale#ROOT}; identical inputs give identical text.
 * Stateless and thread-safe.
 */
public class TemplateNarrativeRenderer implements NarrativeRenderer {

    public static final String NAME = "template";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public NarrativeOutput render(NarrativeInputs inputs) {
        MarketState state = inputs.marketState();
        InvestorProfile profile = inputs.investorProfile();

        String headline = String.format(Locale.ROOT, "%s %s Outlook with %s Risk",
            strengthAdjective(inputs.strength()), inputs.bias().label(), state.riskLevel().label());

        List<String> sentences = new ArrayList<>(7);
        sentences.add(String.format(Locale.ROOT, "%s is currently in %s, with the combined signals at %d%% confidence.",
            inputs.symbol(), trendPhrase(state), Math.round(inputs.composite().confidence())));
        sentences.add(alignmentSentence(inputs));
        sentences.add(String.format(Locale.ROOT, "Recent news sentiment is %s, %s the technical outlook.",
            lower(state.newsSentiment().label()), newsRelation(state.newsSentiment(), inputs.bias())));
        sentences.add(String.format(Locale.ROOT, "Risk is %s and volatility is %s, %s.",
            lower(state.riskLevel().label()), lower(state.volatility().label()),
            isTurbulent(state) ? "which calls for careful position sizing"
                               : "which provides a stable backdrop for moves"));
        sentences.add(goalSentence(inputs.bias(), profile.primaryGoal(), inputs.strength()));
        sentences.add(horizonSentence(profile.timeHorizon()));
        sentences.add(recommendationSentence(inputs.intensity(), inputs.bias()));

        return new NarrativeOutput(headline, String.join(" ", sentences), profile.type().label());
    }

    // ── slots ─────────────────────────────────────────────────────────────

    static String strengthAdjective(SignalStrength strength) {
        return switch (strength) {
            case STRONG   -> "Clear";
            case MODERATE -> "Moderate";
            case WEAK     -> "Mixed";
        };
    }

    private static String trendPhrase(MarketState state) {
        return switch (state.trend()) {
            case UPTREND   -> "an uptrend";
            case DOWNTREND -> "a downtrend";
            case SIDEWAYS  -> "a sideways range";
        };
    }

    private static String alignmentSentence(NarrativeInputs inputs) {
        String strength = lower(inputs.strength().label());
        if (inputs.composite().conflicting()) {
            return "Market signals show conflicting patterns, suggesting " + strength
                + " conviction in the current direction.";
        }
        return "The underlying signals broadly agree, giving " + strength
            + " evidence of " + lower(inputs.bias().label()) + " momentum.";
    }

    private static String newsRelation(NewsSentiment news, MarketBias bias) {
        if (news == NewsSentiment.NEUTRAL) {
            return "offering little direction for";
        }
        boolean agrees = (news == NewsSentiment.POSITIVE && bias == MarketBias.BULLISH)
                      || (news == NewsSentiment.NEGATIVE && bias == MarketBias.BEARISH);
        return agrees ? "supporting" : "diverging from";
    }

    private static boolean isTurbulent(MarketState state) {
        return state.riskLevel() == RiskLevel.HIGH
            || state.volatility() == VolatilityLevel.HIGH
            || state.volatility() == VolatilityLevel.VERY_HIGH;
    }

    private static String goalSentence(MarketBias bias, PrimaryGoal goal, SignalStrength strength) {
        return switch (bias) {
            case BULLISH -> switch (goal) {
                case GROWTH -> "For growth-oriented investors, this bias could present upside opportunity, "
                    + "though confirmation is advised given " + lower(strength.label()) + " signal strength.";
                case INCOME -> "For income-focused strategies, the firmer tone may provide entry points "
                    + "for covered calls or other income-generating tactics.";
                case CAPITAL_PRESERVATION -> "The bullish setup sits uneasily with capital preservation objectives; "
                    + "consider waiting for confirmation or hedging exposure.";
                case SPECULATIVE -> "For speculative positioning, the bullish tilt favors short-dated upside trades "
                    + "with predefined exits.";
            };
            case BEARISH -> switch (goal) {
                case GROWTH -> "Growth investors may treat this weakness as a future buying opportunity, "
                    + "but only while the fundamentals stay intact.";
                case INCOME -> "For income-focused strategies, favor holdings whose payouts are well covered "
                    + "while prices soften.";
                case CAPITAL_PRESERVATION -> "The bearish backdrop aligns with capital preservation goals; "
                    + "reduce exposure or consider defensive positioning.";
                case SPECULATIVE -> "For speculative positioning, the bearish tilt favors hedges or short exposure "
                    + "with strict stop levels.";
            };
            case NEUTRAL -> switch (goal) {
                case GROWTH -> "Growth investors may find better entry points once a clearer direction emerges.";
                case INCOME -> "For income-focused strategies, a range-bound market suits collecting yield "
                    + "rather than chasing price moves.";
                case CAPITAL_PRESERVATION -> "A flat backdrop supports capital preservation goals; "
                    + "keep allocations steady and avoid unnecessary turnover.";
                case SPECULATIVE -> "The current market state suggests caution before initiating large positions; "
                    + "wait for clearer directional signals.";
            };
        };
    }

    private static String horizonSentence(TimeHorizon horizon) {
        return switch (horizon) {
            case SHORT_TERM  -> "Over a short-term horizon, day-to-day swings can outweigh this reading.";
            case MEDIUM_TERM -> "Over a medium-term horizon, this reading is worth revisiting as new data arrives.";
            case LONG_TERM   -> "Over a long-term horizon, this reading matters less than the underlying fundamentals.";
        };
    }

    private static String recommendationSentence(LanguageIntensity intensity, MarketBias bias) {
        String action = switch (bias) {
            case BULLISH -> "adding exposure";
            case BEARISH -> "reducing exposure";
            case NEUTRAL -> "changing positions";
        };
        return switch (intensity) {
            case VERY_CONFIDENT -> "Conditions strongly favor " + action + " now.";
            case CONFIDENT      -> "Conditions favor " + action + " in measured steps.";
            case NEUTRAL        -> "Conditions allow " + action + ", though position sizes should stay moderate.";
            case CAUTIOUS       -> "If " + action + ", keep position sizes small and stage entries over time.";
            case VERY_CAUTIOUS  -> "Wait for clearer market direction before " + action + ".";
        };
    }

    private static String lower(String label) {
        return label.toLowerCase(Locale.ROOT);
    }
}
