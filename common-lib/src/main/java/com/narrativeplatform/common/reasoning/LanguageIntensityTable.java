package com.narrativeplatform.common.reasoning;

import com.narrativeplatform.common.exception.ConfigurationException;
import com.narrativeplatform.common.model.InvestorType;
import com.narrativeplatform.common.model.LanguageIntensity;
import com.narrativeplatform.common.model.SignalStrength;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Lookup grid of {@link SignalStrength} × {@link InvestorType} → {@link LanguageIntensity}.
 *
 * <p>Default grid:
 * <pre>
 *              Conservative    Balanced    Aggressive
 *   Strong     cautious        confident   very_confident
 *   Moderate   very_cautious   neutral     confident
 *   Weak       very_cautious   cautious    neutral
 * </pre>
 *
 * <p>{@link #validate()} requires all nine cells and, per row, strictly increasing
 * intensity from Conservative to Balanced to Aggressive.
 */
public record LanguageIntensityTable(Map<SignalStrength, Map<InvestorType, LanguageIntensity>> entries) {

    public LanguageIntensityTable {
        EnumMap<SignalStrength, Map<InvestorType, LanguageIntensity>> copy = new EnumMap<>(SignalStrength.class);
        if (entries != null) {
            entries.forEach((strength, row) -> {
                EnumMap<InvestorType, LanguageIntensity> rowCopy = new EnumMap<>(InvestorType.class);
                if (row != null) {
                    rowCopy.putAll(row);
                }
                copy.put(strength, Collections.unmodifiableMap(rowCopy));
            });
        }
        entries = Collections.unmodifiableMap(copy);
    }

    public static LanguageIntensityTable defaults() {
        Map<SignalStrength, Map<InvestorType, LanguageIntensity>> grid = new EnumMap<>(SignalStrength.class);
        grid.put(SignalStrength.STRONG, row(
            LanguageIntensity.CAUTIOUS, LanguageIntensity.CONFIDENT, LanguageIntensity.VERY_CONFIDENT));
        grid.put(SignalStrength.MODERATE, row(
            LanguageIntensity.VERY_CAUTIOUS, LanguageIntensity.NEUTRAL, LanguageIntensity.CONFIDENT));
        grid.put(SignalStrength.WEAK, row(
            LanguageIntensity.VERY_CAUTIOUS, LanguageIntensity.CAUTIOUS, LanguageIntensity.NEUTRAL));
        return new LanguageIntensityTable(grid);
    }

    public static Map<InvestorType, LanguageIntensity> row(LanguageIntensity conservative,
                                                           LanguageIntensity balanced,
                                                           LanguageIntensity aggressive) {
        Map<InvestorType, LanguageIntensity> row = new EnumMap<>(InvestorType.class);
        row.put(InvestorType.CONSERVATIVE, conservative);
        row.put(InvestorType.BALANCED, balanced);
        row.put(InvestorType.AGGRESSIVE, aggressive);
        return row;
    }

    public LanguageIntensity lookup(SignalStrength strength, InvestorType type) {
        Map<InvestorType, LanguageIntensity> row = entries.get(strength);
        LanguageIntensity intensity = row != null ? row.get(type) : null;
        if (intensity == null) {
            throw new ConfigurationException("LanguageIntensityTable",
                "no entry for strength=" + strength + " type=" + type);
        }
        return intensity;
    }

    /**
     * @throws ConfigurationException when a cell is missing or a row is not
     *         strictly increasing across investor types
     */
    public LanguageIntensityTable validate() {
        for (SignalStrength strength : SignalStrength.values()) {
            for (InvestorType type : InvestorType.values()) {
                lookup(strength, type);
            }
            LanguageIntensity conservative = lookup(strength, InvestorType.CONSERVATIVE);
            LanguageIntensity balanced     = lookup(strength, InvestorType.BALANCED);
            LanguageIntensity aggressive   = lookup(strength, InvestorType.AGGRESSIVE);
            if (!conservative.isLessIntenseThan(balanced) || !balanced.isLessIntenseThan(aggressive)) {
                throw new ConfigurationException("LanguageIntensityTable",
                    "row " + strength + " must dampen Conservative and amplify Aggressive relative to Balanced, got "
                        + conservative + " / " + balanced + " / " + aggressive);
            }
        }
        return this;
    }
}
