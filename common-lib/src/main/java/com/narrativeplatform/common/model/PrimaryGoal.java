package com.narrativeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What the investor is optimising for. Selects the guidance sentence in the
 * narrative; does not change language intensity.
 *
 * <p>{@code "Capital Protection"} and {@code "Trading"} are accepted as aliases
 * of {@link #CAPITAL_PRESERVATION} and {@link #SPECULATIVE}.
 */
public enum PrimaryGoal {
    GROWTH("Growth"),
    INCOME("Income"),
    CAPITAL_PRESERVATION("Capital Preservation", "Capital Protection"),
    SPECULATIVE("Speculative", "Trading");

    private final String label;
    private final String[] aliases;

    PrimaryGoal(String label, String... aliases) {
        this.label = label;
        this.aliases = aliases;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static PrimaryGoal fromLabel(String raw) {
        return Labels.parse(PrimaryGoal.class, raw, c -> {
            String[] accepted = new String[c.aliases.length + 2];
            accepted[0] = c.label;
            accepted[1] = c.name();
            System.arraycopy(c.aliases, 0, accepted, 2, c.aliases.length);
            return accepted;
        });
    }
}
