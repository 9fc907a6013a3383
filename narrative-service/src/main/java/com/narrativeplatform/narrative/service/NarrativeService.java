package com.narrativeplatform.narrative.service;

import com.narrativeplatform.common.engine.MarketNarrativeEngine;
import com.narrativeplatform.common.exception.InputRangeException;
import com.narrativeplatform.common.model.InvestorProfile;
import com.narrativeplatform.common.model.InvestorType;
import com.narrativeplatform.common.model.MarketState;
import com.narrativeplatform.common.model.NarrativeRequest;
import com.narrativeplatform.common.model.NarrativeResult;
import com.narrativeplatform.common.model.NewsSentiment;
import com.narrativeplatform.common.model.NormalizedSignals;
import com.narrativeplatform.common.model.PrimaryGoal;
import com.narrativeplatform.common.model.RiskLevel;
import com.narrativeplatform.common.model.TimeHorizon;
import com.narrativeplatform.common.model.TrendDirection;
import com.narrativeplatform.common.model.VolatilityLevel;
import com.narrativeplatform.common.trace.TraceContextUtil;
import com.narrativeplatform.narrative.dto.NarrativeRequestDTO;
import com.narrativeplatform.narrative.dto.NarrativeResponseDTO;
import com.narrativeplatform.narrative.signal.MarketStateSignalMapper;
import com.narrativeplatform.narrative.signal.SymbolHashSentimentSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Calling layer around {@link MarketNarrativeEngine}.
 *
 * <p>Per request: validates the symbol, applies profile defaults, picks the
 * signal source, runs the engine on a bounded-elastic worker and attaches the
 * response timestamp. Signal source precedence:
 * <ol>
 *   <li>{@code SUPPLIED}: the caller's {@code normalized_signals}; missing
 *       market-state labels are described from them.</li>
 *   <li>{@code DERIVED}: mapped from {@code market_state} when trend, risk level
 *       and volatility are present; absent news sentiment comes from
 *       {@link SymbolHashSentimentSource}.</li>
 *   <li>{@code NEUTRAL}: all-zero signals, response flagged {@code degraded}.</li>
 * </ol>
 */
@Service
public class NarrativeService {

    private static final Logger log = LoggerFactory.getLogger(NarrativeService.class);

    private static final Pattern SYMBOL_PATTERN = Pattern.compile("[A-Z0-9.\\-]{1,20}");

    private static final double MIN_CONFIDENCE = 0.0;
    private static final double MAX_CONFIDENCE = 100.0;

    enum SignalSource { SUPPLIED, DERIVED, NEUTRAL }

    private final MarketNarrativeEngine engine;
    private final Clock clock;

    public NarrativeService(MarketNarrativeEngine engine, Clock clock) {
        this.engine = engine;
        this.clock  = clock;
    }

    public Mono<NarrativeResponseDTO> generate(NarrativeRequestDTO request) {
        return Mono.deferContextual(ctx -> {
            String traceId = TraceContextUtil.getTraceId(ctx);
            return Mono.fromCallable(() -> process(request, traceId))
                .subscribeOn(Schedulers.boundedElastic());
        });
    }

    NarrativeResponseDTO process(NarrativeRequestDTO request, String traceId) {
        if (request == null) {
            throw new IllegalArgumentException("request body is required");
        }
        String symbol = normalizeSymbol(request.symbol());
        InvestorProfile profile = resolveProfile(request.investorProfile());

        TraceContextUtil.withMdc(traceId, () ->
            log.info("[Narrative] Request received. symbol={} type={} horizon={} goal={}",
                symbol, profile.type().label(), profile.timeHorizon().label(), profile.primaryGoal().label()));

        MarketState partial = parseMarketState(request.marketState());
        SignalSource source;
        NormalizedSignals signals;
        MarketState state;

        if (request.normalizedSignals() != null) {
            source  = SignalSource.SUPPLIED;
            signals = request.normalizedSignals().toSignals();
            state   = MarketStateSignalMapper.describe(partial, signals);
        } else if (isDerivable(partial)) {
            source = SignalSource.DERIVED;
            state  = partial.newsSentiment() != null ? partial : withHashedSentiment(partial, symbol, traceId);
            signals = MarketStateSignalMapper.toSignals(state);
        } else {
            source  = SignalSource.NEUTRAL;
            signals = NormalizedSignals.neutral();
            state   = MarketStateSignalMapper.describe(partial, signals);
        }
        boolean degraded = source == SignalSource.NEUTRAL;

        TraceContextUtil.withMdc(traceId, () -> {
            if (degraded) {
                log.warn("[Narrative] No usable signals or market state, using neutral signals. symbol={}", symbol);
            } else {
                log.info("[Narrative] Signal source={} symbol={} signals={}", source, symbol, signals);
            }
        });

        NarrativeResult result = engine.generate(NarrativeRequest.of(symbol, state, signals, profile));
        if (state.confidence() == null) {
            state = state.withConfidence(result.reasoning().confidence());
        }

        TraceContextUtil.withMdc(traceId, () ->
            log.info("[Narrative] Narrative generated. symbol={} bias={} strength={} intensity={} confidence={} "
                     + "conflicting={} renderer={}",
                symbol, result.signals().marketBias().label(), result.signals().signalStrength().label(),
                result.reasoning().languageIntensity().label(),
                String.format(Locale.ROOT, "%.1f", result.reasoning().confidence()),
                result.reasoning().conflicting(), engine.renderer().name()));

        return new NarrativeResponseDTO(NarrativeResponseDTO.STATUS_SUCCESS, symbol, clock.instant(), degraded,
            state, result.signals(), result.narrative(), result.reasoning());
    }

    /**
     * Trims and upper-cases the symbol.
     *
     * @throws IllegalArgumentException when the result is not 1–20 letters,
     *         digits, dots or hyphens
     */
    public static String normalizeSymbol(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("symbol is required");
        }
        String symbol = raw.trim().toUpperCase(Locale.ROOT);
        if (!SYMBOL_PATTERN.matcher(symbol).matches()) {
            throw new IllegalArgumentException(
                "invalid symbol '" + raw.trim() + "': expected 1-20 letters, digits, '.' or '-'");
        }
        return symbol;
    }

    /** Missing fields default to Balanced / Medium-term / Growth. */
    static InvestorProfile resolveProfile(NarrativeRequestDTO.InvestorProfileDTO dto) {
        if (dto == null) {
            return InvestorProfile.of(InvestorType.BALANCED, TimeHorizon.MEDIUM_TERM, PrimaryGoal.GROWTH);
        }
        return InvestorProfile.of(
            parseOr(dto.type(), InvestorType::fromLabel, InvestorType.BALANCED),
            parseOr(dto.timeHorizon(), TimeHorizon::fromLabel, TimeHorizon.MEDIUM_TERM),
            parseOr(dto.primaryGoal(), PrimaryGoal::fromLabel, PrimaryGoal.GROWTH));
    }

    /**
     * Absent labels stay {@code null}; present but unknown labels, and a
     * confidence outside [0, 100], are rejected.
     */
    static MarketState parseMarketState(NarrativeRequestDTO.MarketStateDTO dto) {
        if (dto == null) {
            return null;
        }
        Double confidence = dto.confidence();
        if (confidence != null && !(confidence >= MIN_CONFIDENCE && confidence <= MAX_CONFIDENCE)) {
            throw new InputRangeException("MarketState",
                "confidence must be within [0, 100] but was " + confidence);
        }
        return new MarketState(
            parseOr(dto.trend(), TrendDirection::fromLabel, null),
            confidence,
            parseOr(dto.riskLevel(), RiskLevel::fromLabel, null),
            parseOr(dto.volatility(), VolatilityLevel::fromLabel, null),
            parseOr(dto.newsSentiment(), NewsSentiment::fromLabel, null));
    }

    private static boolean isDerivable(MarketState state) {
        return state != null && state.trend() != null && state.riskLevel() != null && state.volatility() != null;
    }

    private static MarketState withHashedSentiment(MarketState state, String symbol, String traceId) {
        NewsSentiment sentiment = SymbolHashSentimentSource.sentimentFor(symbol);
        int strength = SymbolHashSentimentSource.strengthFor(symbol);
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[Narrative] News sentiment not supplied, using symbol hash. symbol={} sentiment={} strength={}",
                symbol, sentiment.label(), strength));
        return state.withNewsSentiment(sentiment);
    }

    private static <T> T parseOr(String raw, Function<String, T> parser, T fallback) {
        return raw == null || raw.isBlank() ? fallback : parser.apply(raw);
    }
}
