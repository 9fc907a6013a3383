package com.narrativeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Output of signal aggregation.
 *
 * <ul>
 *   <li>{@code composite}   weighted sum of the normalized signals, in [-1, 1]</li>
 *   <li>{@code confidence}  {@code ((composite + 1) / 2) * 100}, in [0, 100]</li>
 *   <li>{@code conflicting} true when the signal directions have no clear majority</li>
 * </ul>
 */
public record CompositeResult(
    @JsonProperty("composite") double composite,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("conflicting") boolean conflicting
) {}
