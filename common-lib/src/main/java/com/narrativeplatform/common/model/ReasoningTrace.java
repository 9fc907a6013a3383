package com.narrativeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Intermediate values behind a narrative, reported alongside it for transparency. */
public record ReasoningTrace(
    @JsonProperty("composite") double composite,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("conflicting") boolean conflicting,
    @JsonProperty("language_intensity") LanguageIntensity languageIntensity,
    @JsonProperty("investor_risk_tolerance") RiskLevel investorRiskTolerance
) {}
