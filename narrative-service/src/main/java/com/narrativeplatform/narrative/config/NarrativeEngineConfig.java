package com.narrativeplatform.narrative.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.narrativeplatform.common.config.ClassificationThresholds;
import com.narrativeplatform.common.config.EngineConfiguration;
import com.narrativeplatform.common.config.SignalWeights;
import com.narrativeplatform.common.engine.MarketNarrativeEngine;
import com.narrativeplatform.common.exception.ConfigurationException;
import com.narrativeplatform.common.exception.InputRangeException;
import com.narrativeplatform.common.model.InvestorType;
import com.narrativeplatform.common.model.LanguageIntensity;
import com.narrativeplatform.common.model.SignalStrength;
import com.narrativeplatform.common.narrative.NarrativeRenderer;
import com.narrativeplatform.common.narrative.TemplateNarrativeRenderer;
import com.narrativeplatform.common.reasoning.LanguageIntensityTable;
import com.narrativeplatform.narrative.renderer.GenerativeNarrativeRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Wires the engine from {@code application.yml}.
 *
 * <p>The {@link EngineConfiguration} bean is validated while the context starts,
 * so bad weights, thresholds or an incomplete intensity table abort startup
 * with a {@link ConfigurationException}.
 */
@Configuration
@EnableConfigurationProperties({NarrativeEngineProperties.class, RendererProperties.class})
public class NarrativeEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(NarrativeEngineConfig.class);

    @Value("${anthropic.api-key:}")
    private String anthropicApiKey;

    @Bean
    public EngineConfiguration engineConfiguration(NarrativeEngineProperties properties) {
        EngineConfiguration configuration = toEngineConfiguration(properties);
        log.info("Engine configuration loaded. weights={} thresholds={}",
            configuration.weights(), configuration.thresholds());
        return configuration;
    }

    @Bean
    public NarrativeRenderer narrativeRenderer(RendererProperties properties,
                                               WebClient.Builder webClientBuilder,
                                               ObjectMapper objectMapper) {
        TemplateNarrativeRenderer template = new TemplateNarrativeRenderer();
        String type = properties.getType() == null ? "" : properties.getType().trim().toLowerCase(Locale.ROOT);
        NarrativeRenderer renderer = switch (type) {
            case TemplateNarrativeRenderer.NAME -> template;
            case GenerativeNarrativeRenderer.NAME -> {
                RendererProperties.Generative generative = properties.getGenerative();
                WebClient client = GenerativeNarrativeRenderer.anthropicClient(webClientBuilder, generative.getBaseUrl());
                yield new GenerativeNarrativeRenderer(client, objectMapper, anthropicApiKey,
                    generative.getModel(), generative.getMaxTokens(),
                    Duration.ofMillis(generative.getTimeoutMs()), template);
            }
            default -> throw new ConfigurationException("narrative.renderer.type",
                "expected 'template' or 'generative' but was '" + properties.getType() + "'");
        };
        log.info("Narrative renderer selected. renderer={}", renderer.name());
        return renderer;
    }

    @Bean
    public MarketNarrativeEngine marketNarrativeEngine(EngineConfiguration engineConfiguration,
                                                       NarrativeRenderer narrativeRenderer) {
        return new MarketNarrativeEngine(engineConfiguration, narrativeRenderer);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // ── property translation ──────────────────────────────────────────────

    public static EngineConfiguration toEngineConfiguration(NarrativeEngineProperties properties) {
        NarrativeEngineProperties.Weights w = properties.getWeights();
        NarrativeEngineProperties.Thresholds t = properties.getThresholds();
        return EngineConfiguration.of(
            new SignalWeights(w.getTrend(), w.getNews(), w.getRisk(), w.getVolatility()),
            new ClassificationThresholds(t.getDeadZone(), t.getStrong(), t.getModerate()),
            intensityTable(properties.getIntensity()));
    }

    static LanguageIntensityTable intensityTable(Map<String, Map<String, String>> raw) {
        if (raw == null || raw.isEmpty()) {
            return LanguageIntensityTable.defaults();
        }
        Map<SignalStrength, Map<InvestorType, LanguageIntensity>> grid = new EnumMap<>(SignalStrength.class);
        try {
            raw.forEach((strength, row) -> {
                Map<InvestorType, LanguageIntensity> cells = new EnumMap<>(InvestorType.class);
                if (row != null) {
                    row.forEach((type, intensity) ->
                        cells.put(InvestorType.fromLabel(type), LanguageIntensity.fromLabel(intensity)));
                }
                grid.put(SignalStrength.fromLabel(strength), cells);
            });
        } catch (InputRangeException e) {
            throw new ConfigurationException("narrative.engine.intensity", e.getMessage(), e);
        }
        return new LanguageIntensityTable(grid);
    }
}
