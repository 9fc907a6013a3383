package com.narrativeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record InvestorProfile(
    @JsonProperty("type") InvestorType type,
    @JsonProperty("time_horizon") TimeHorizon timeHorizon,
    @JsonProperty("primary_goal") PrimaryGoal primaryGoal
) {
    public static InvestorProfile of(InvestorType type, TimeHorizon timeHorizon, PrimaryGoal primaryGoal) {
        return new InvestorProfile(type, timeHorizon, primaryGoal);
    }
}
