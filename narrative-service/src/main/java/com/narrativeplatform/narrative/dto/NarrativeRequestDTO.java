package com.narrativeplatform.narrative.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.narrativeplatform.common.model.NormalizedSignals;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of {@code POST /api/v1/narrative/generate}. Labels stay raw strings so
 * the service can apply defaults before parsing; every section is optional
 * except {@code symbol}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NarrativeRequestDTO(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("market_state") MarketStateDTO marketState,
    @JsonProperty("normalized_signals") SignalsDTO normalizedSignals,
    @JsonProperty("investor_profile") InvestorProfileDTO investorProfile
) {

    /**
     * Caller-normalized signals. Members are boxed so an absent or {@code null}
     * source is seen as missing instead of silently reading 0.0.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SignalsDTO(
        @JsonProperty("trend") Double trend,
        @JsonProperty("news") Double news,
        @JsonProperty("risk") Double risk,
        @JsonProperty("volatility") Double volatility
    ) {
        public static SignalsDTO of(double trend, double news, double risk, double volatility) {
            return new SignalsDTO(trend, news, risk, volatility);
        }

        /**
         * @throws IllegalArgumentException when any of the four sources is missing
         */
        public NormalizedSignals toSignals() {
            List<String> missing = new ArrayList<>();
            if (trend == null)      missing.add("trend");
            if (news == null)       missing.add("news");
            if (risk == null)       missing.add("risk");
            if (volatility == null) missing.add("volatility");
            if (!missing.isEmpty()) {
                throw new IllegalArgumentException(
                    "normalized_signals requires trend, news, risk and volatility; missing " + missing);
            }
            return NormalizedSignals.of(trend, news, risk, volatility);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MarketStateDTO(
        @JsonProperty("trend") String trend,
        @JsonProperty("confidence") Double confidence,
        @JsonProperty("risk_level") String riskLevel,
        @JsonProperty("volatility") String volatility,
        @JsonProperty("news_sentiment") String newsSentiment
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record InvestorProfileDTO(
        @JsonProperty("type") String type,
        @JsonProperty("time_horizon") String timeHorizon,
        @JsonProperty("primary_goal") String primaryGoal
    ) {}
}
