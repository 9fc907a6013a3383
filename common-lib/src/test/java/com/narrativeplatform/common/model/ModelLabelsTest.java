package com.narrativeplatform.common.model;

import com.narrativeplatform.common.exception.InputRangeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/** Label parsing for the enumerated request vocabulary. */
class ModelLabelsTest {

    @Test
    @DisplayName("investor type parses case-insensitively")
    void investorType() {
        assertEquals(InvestorType.CONSERVATIVE, InvestorType.fromLabel("conservative"));
        assertEquals(InvestorType.AGGRESSIVE, InvestorType.fromLabel(" Aggressive "));
        assertEquals(RiskLevel.LOW, InvestorType.CONSERVATIVE.riskTolerance());
    }

    @Test
    @DisplayName("unknown investor type → InputRangeException")
    void unknownInvestorType() {
        InputRangeException e = assertThrows(InputRangeException.class, () -> InvestorType.fromLabel("Reckless"));
        assertEquals("InvestorType", e.getComponent());
    }

    @Test
    @DisplayName("time horizon accepts label and snake_case spellings")
    void timeHorizon() {
        assertEquals(TimeHorizon.SHORT_TERM, TimeHorizon.fromLabel("Short-term"));
        assertEquals(TimeHorizon.MEDIUM_TERM, TimeHorizon.fromLabel("medium_term"));
        assertEquals(TimeHorizon.LONG_TERM, TimeHorizon.fromLabel("LONG_TERM"));
    }

    @Test
    @DisplayName("primary goal accepts legacy aliases")
    void primaryGoalAliases() {
        assertEquals(PrimaryGoal.CAPITAL_PRESERVATION, PrimaryGoal.fromLabel("Capital Preservation"));
        assertEquals(PrimaryGoal.CAPITAL_PRESERVATION, PrimaryGoal.fromLabel("Capital Protection"));
        assertEquals(PrimaryGoal.SPECULATIVE, PrimaryGoal.fromLabel("Trading"));
        assertEquals(PrimaryGoal.INCOME, PrimaryGoal.fromLabel("income"));
    }

    @Test
    @DisplayName("unknown or blank goal → InputRangeException")
    void unknownGoal() {
        assertThrows(InputRangeException.class, () -> PrimaryGoal.fromLabel("Retirement"));
        assertThrows(InputRangeException.class, () -> PrimaryGoal.fromLabel("  "));
        assertThrows(InputRangeException.class, () -> PrimaryGoal.fromLabel(null));
    }

    @Test
    @DisplayName("multi-word market labels round-trip through label()")
    void multiWordLabels() {
        assertEquals("Very High", VolatilityLevel.VERY_HIGH.label());
        assertEquals(VolatilityLevel.VERY_HIGH, VolatilityLevel.fromLabel("very high"));
        assertEquals(VolatilityLevel.VERY_HIGH, VolatilityLevel.fromLabel("VERY_HIGH"));
    }

    @Test
    @DisplayName("strength downgrade bottoms out at WEAK")
    void downgrade() {
        assertEquals(SignalStrength.MODERATE, SignalStrength.STRONG.downgrade());
        assertEquals(SignalStrength.WEAK, SignalStrength.MODERATE.downgrade());
        assertEquals(SignalStrength.WEAK, SignalStrength.WEAK.downgrade());
    }
}
