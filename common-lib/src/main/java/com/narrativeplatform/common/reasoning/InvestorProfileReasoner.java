package com.narrativeplatform.common.reasoning;

import com.narrativeplatform.common.exception.InputRangeException;
import com.narrativeplatform.common.model.InvestorType;
import com.narrativeplatform.common.model.LanguageIntensity;
import com.narrativeplatform.common.model.MarketBias;
import com.narrativeplatform.common.model.SignalStrength;

/**
 * Resolves the narrative tone for an investor.
 *
 * <p>Intensity is a pure table lookup keyed by strength and investor type. Bias is
 * part of the contract but does not select the cell; time horizon and goal are
 * rendered as context and never reach this class.
 */
public final class InvestorProfileReasoner {

    private InvestorProfileReasoner() {}

    public static LanguageIntensity adjust(MarketBias bias, SignalStrength strength,
                                           InvestorType type, LanguageIntensityTable table) {
        if (bias == null) {
            throw new InputRangeException("InvestorProfileReasoner", "market bias is required");
        }
        if (strength == null) {
            throw new InputRangeException("InvestorProfileReasoner", "signal strength is required");
        }
        if (type == null) {
            throw new InputRangeException("InvestorProfileReasoner", "investor type is required");
        }
        return table.lookup(strength, type);
    }
}
