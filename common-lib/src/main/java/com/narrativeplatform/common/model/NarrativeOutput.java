package com.narrativeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Rendered narrative. Every {@link com.narrativeplatform.common.narrative.NarrativeRenderer}
 * produces this shape. {@code body} is serialized as {@code text}.
 */
public record NarrativeOutput(
    @JsonProperty("headline") String headline,
    @JsonProperty("text") String body,
    @JsonProperty("investor_type") String investorType
) {}
