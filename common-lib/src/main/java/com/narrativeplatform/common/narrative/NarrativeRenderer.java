package com.narrativeplatform.common.narrative;

import com.narrativeplatform.common.model.NarrativeOutput;

/**
 * Strategy contract for turning classified signals into narrative text.
 *
 * <p>Implementations must:
 * <ul>
 *   <li>accept the full {@link NarrativeInputs} and return a {@link NarrativeOutput}
 *       with headline, a 5–7 sentence body and the investor type label</li>
 *   <li>never return {@code null}</li>
 *   <li>hold no per-request state, so one instance can serve concurrent calls</li>
 * </ul>
 *
 * <p>Current implementations: {@link TemplateNarrativeRenderer} (deterministic,
 * default) and the generative renderer in narrative-service. The active one is
 * chosen by configuration and injected into
 * {@link com.narrativeplatform.common.engine.MarketNarrativeEngine}, so upstream
 * stages never branch on it.
 */
public interface NarrativeRenderer {

    NarrativeOutput render(NarrativeInputs inputs);

    /** Short identifier reported in logs, e.g. {@code "template"}. */
    String name();
}
