package com.narrativeplatform.common.narrative;

import com.narrativeplatform.common.model.CompositeResult;
import com.narrativeplatform.common.model.InvestorProfile;
import com.narrativeplatform.common.model.LanguageIntensity;
import com.narrativeplatform.common.model.MarketBias;
import com.narrativeplatform.common.model.MarketState;
import com.narrativeplatform.common.model.SignalStrength;

/** Everything a {@link NarrativeRenderer} may draw on. */
public record NarrativeInputs(
    String symbol,
    MarketBias bias,
    SignalStrength strength,
    LanguageIntensity intensity,
    CompositeResult composite,
    MarketState marketState,
    InvestorProfile investorProfile
) {}
