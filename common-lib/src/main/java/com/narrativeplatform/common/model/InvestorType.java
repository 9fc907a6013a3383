package com.narrativeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Investor risk appetite. Drives the language-intensity lookup; each type also
 * reports the risk tolerance it stands for.
 */
public enum InvestorType {
    CONSERVATIVE("Conservative", RiskLevel.LOW),
    BALANCED("Balanced", RiskLevel.MEDIUM),
    AGGRESSIVE("Aggressive", RiskLevel.HIGH);

    private final String label;
    private final RiskLevel riskTolerance;

    InvestorType(String label, RiskLevel riskTolerance) {
        this.label = label;
        this.riskTolerance = riskTolerance;
    }

    public RiskLevel riskTolerance() {
        return riskTolerance;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static InvestorType fromLabel(String raw) {
        return Labels.parse(InvestorType.class, raw, c -> new String[] { c.label, c.name() });
    }
}
