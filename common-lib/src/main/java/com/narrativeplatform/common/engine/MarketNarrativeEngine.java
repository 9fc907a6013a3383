package com.narrativeplatform.common.engine;

import com.narrativeplatform.common.classifier.BiasAndStrengthClassifier;
import com.narrativeplatform.common.classifier.Classification;
import com.narrativeplatform.common.config.EngineConfiguration;
import com.narrativeplatform.common.exception.InputRangeException;
import com.narrativeplatform.common.model.CompositeResult;
import com.narrativeplatform.common.model.InvestorProfile;
import com.narrativeplatform.common.model.LanguageIntensity;
import com.narrativeplatform.common.model.MarketSignals;
import com.narrativeplatform.common.model.MarketState;
import com.narrativeplatform.common.model.NarrativeOutput;
import com.narrativeplatform.common.model.NarrativeRequest;
import com.narrativeplatform.common.model.NarrativeResult;
import com.narrativeplatform.common.model.ReasoningTrace;
import com.narrativeplatform.common.narrative.NarrativeInputs;
import com.narrativeplatform.common.narrative.NarrativeRenderer;
import com.narrativeplatform.common.reasoning.InvestorProfileReasoner;
import com.narrativeplatform.common.signal.SignalAggregator;

import java.util.Objects;

/**
 * Market narrative reasoning pipeline.
 *
 * <pre>
 *   SignalAggregator (+ ConflictDetector)
 *     → BiasAndStrengthClassifier
 *     → InvestorProfileReasoner
 *     → NarrativeRenderer
 * </pre>
 *
 * <p>Every stage is a pure function of its inputs and the immutable
 * {@link EngineConfiguration}. The engine performs no I/O, does not log and
 * reads no clock, so concurrent calls need no coordination and identical
 * requests produce equal results (given a deterministic renderer).
 */
public final class MarketNarrativeEngine {

    private static final String COMPONENT = "MarketNarrativeEngine";

    private final EngineConfiguration configuration;
    private final NarrativeRenderer renderer;

    public MarketNarrativeEngine(EngineConfiguration configuration, NarrativeRenderer renderer) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.renderer      = Objects.requireNonNull(renderer, "renderer");
    }

    public EngineConfiguration configuration() {
        return configuration;
    }

    public NarrativeRenderer renderer() {
        return renderer;
    }

    /**
     * @throws InputRangeException when a signal is out of range or a required
     *         field of the request is missing
     */
    public NarrativeResult generate(NarrativeRequest request) {
        validate(request);
        InvestorProfile profile = request.investorProfile();

        CompositeResult composite = SignalAggregator.aggregate(request.normalizedSignals(), configuration.weights());
        Classification classification = BiasAndStrengthClassifier.classify(
            composite.composite(), composite.conflicting(), configuration.thresholds());
        LanguageIntensity intensity = InvestorProfileReasoner.adjust(
            classification.bias(), classification.strength(), profile.type(), configuration.intensityTable());

        NarrativeOutput narrative = renderer.render(new NarrativeInputs(
            request.symbol(), classification.bias(), classification.strength(), intensity,
            composite, request.marketState(), profile));

        return new NarrativeResult(
            new MarketSignals(classification.bias(), classification.strength()),
            narrative,
            new ReasoningTrace(composite.composite(), composite.confidence(), composite.conflicting(),
                intensity, profile.type().riskTolerance()));
    }

    private static void validate(NarrativeRequest request) {
        if (request == null) {
            throw new InputRangeException(COMPONENT, "request is required");
        }
        if (request.symbol() == null || request.symbol().isBlank()) {
            throw new InputRangeException(COMPONENT, "symbol is required");
        }
        InvestorProfile profile = request.investorProfile();
        if (profile == null || profile.type() == null || profile.timeHorizon() == null
                || profile.primaryGoal() == null) {
            throw new InputRangeException(COMPONENT, "investor profile requires type, time_horizon and primary_goal");
        }
        MarketState state = request.marketState();
        if (state == null || state.trend() == null || state.riskLevel() == null
                || state.volatility() == null || state.newsSentiment() == null) {
            throw new InputRangeException(COMPONENT,
                "market state requires trend, risk_level, volatility and news_sentiment");
        }
    }
}
