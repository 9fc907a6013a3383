package com.narrativeplatform.narrative.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bound from {@code narrative.engine.*}. Defaults mirror the engine defaults so
 * an empty configuration file still yields a valid engine.
 *
 * <p>{@code intensity} is optional. When present it must define all nine cells,
 * keyed by strength then investor type, e.g.
 * {@code narrative.engine.intensity.strong.conservative=cautious}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "narrative.engine")
public class NarrativeEngineProperties {

    private Weights weights = new Weights();
    private Thresholds thresholds = new Thresholds();
    private Map<String, Map<String, String>> intensity = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class Weights {
        private double trend = 0.35;
        private double news = 0.25;
        private double risk = 0.20;
        private double volatility = 0.20;
    }

    @Getter
    @Setter
    public static class Thresholds {
        private double deadZone = 0.05;
        private double strong = 0.5;
        private double moderate = 0.2;
    }
}
