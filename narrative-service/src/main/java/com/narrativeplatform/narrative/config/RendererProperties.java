package com.narrativeplatform.narrative.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Bound from {@code narrative.renderer.*}. */
@Getter
@Setter
@ConfigurationProperties(prefix = "narrative.renderer")
public class RendererProperties {

    /** {@code template} or {@code generative}. */
    private String type = "template";
    private Generative generative = new Generative();

    @Getter
    @Setter
    public static class Generative {
        private String baseUrl = "https://api.anthropic.com";
        private String model = "claude-haiku-4-5-20251001";
        private int maxTokens = 400;
        private long timeoutMs = 4000L;
    }
}
