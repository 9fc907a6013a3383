package com.narrativeplatform.narrative.renderer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.narrativeplatform.common.model.MarketState;
import com.narrativeplatform.common.model.NarrativeOutput;
import com.narrativeplatform.common.narrative.NarrativeInputs;
import com.narrativeplatform.common.narrative.NarrativeRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@link NarrativeRenderer} backed by the Anthropic Messages API.
 *
 * <p>Receives the same {@link NarrativeInputs} as the template renderer and
 * returns the same {@link NarrativeOutput} shape. The model is asked for a JSON
 * object with {@code headline} and {@code text}; the reply is accepted only when
 * both are non-blank and the text has 5–7 sentences.
 *
 * <p><strong>Fallback</strong>: a missing API key, a failed or timed-out call,
 * or a malformed reply renders with the injected fallback renderer instead, so
 * a request never fails because of text generation.
 *
 * <p>{@link #render} blocks for at most the configured timeout. The service
 * layer invokes the engine on a bounded-elastic scheduler.
 */
public class GenerativeNarrativeRenderer implements NarrativeRenderer {

    private static final Logger log = LoggerFactory.getLogger(GenerativeNarrativeRenderer.class);

    public static final String NAME = "generative";

    static final int MIN_SENTENCES = 5;
    static final int MAX_SENTENCES = 7;

    private final WebClient anthropicClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String model;
    private final int maxTokens;
    private final Duration timeout;
    private final NarrativeRenderer fallback;

    public GenerativeNarrativeRenderer(WebClient anthropicClient, ObjectMapper objectMapper, String apiKey,
                                       String model, int maxTokens, Duration timeout,
                                       NarrativeRenderer fallback) {
        this.anthropicClient = anthropicClient;
        this.objectMapper    = objectMapper;
        this.apiKey          = apiKey;
        this.model           = model;
        this.maxTokens       = maxTokens;
        this.timeout         = timeout;
        this.fallback        = fallback;
    }

    public static WebClient anthropicClient(WebClient.Builder builder, String baseUrl) {
        return builder
            .baseUrl(baseUrl)
            .defaultHeader("anthropic-version", "2023-06-01")
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public NarrativeOutput render(NarrativeInputs inputs) {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("[GenerativeRenderer] No Anthropic API key configured, using {} renderer. symbol={}",
                fallback.name(), inputs.symbol());
            return fallback.render(inputs);
        }
        try {
            String reply = callAnthropicApi(buildPrompt(inputs)).block(timeout);
            NarrativeOutput output = parseResponse(reply, inputs.investorProfile().type().label());
            log.info("[GenerativeRenderer] Narrative generated. symbol={} model={}", inputs.symbol(), model);
            return output;
        } catch (RuntimeException e) {
            log.error("[GenerativeRenderer] Generation failed, using {} renderer. symbol={} reason={}",
                fallback.name(), inputs.symbol(), e.getMessage());
            return fallback.render(inputs);
        }
    }

    // ── prompt construction ───────────────────────────────────────────────────

    String buildPrompt(NarrativeInputs inputs) {
        MarketState state = inputs.marketState();
        return """
            You are a market commentator writing for a retail investor dashboard.

            Symbol:            %s
            Trend:             %s
            Signal confidence: %.0f%%
            Risk level:        %s
            Volatility:        %s
            News sentiment:    %s
            Signals conflict:  %s

            Market bias:        %s
            Signal strength:    %s
            Language intensity: %s

            Investor type:  %s
            Time horizon:   %s
            Primary goal:   %s

            Write a headline of the form "<adjective> <bias> Outlook with <risk level> Risk" and a body
            of 5 to 7 sentences covering the trend and confidence, signal agreement, news sentiment,
            risk and volatility, guidance for the investor's goal and horizon, and a recommendation hint
            whose tone matches the language intensity. Do not add disclaimers.

            Respond ONLY with a JSON object in this exact format:
            {
              "headline": "...",
              "text": "..."
            }
            """.formatted(
                inputs.symbol(), state.trend().label(), inputs.composite().confidence(),
                state.riskLevel().label(), state.volatility().label(), state.newsSentiment().label(),
                inputs.composite().conflicting() ? "yes" : "no",
                inputs.bias().label(), inputs.strength().label(), inputs.intensity().label(),
                inputs.investorProfile().type().label(), inputs.investorProfile().timeHorizon().label(),
                inputs.investorProfile().primaryGoal().label());
    }

    // ── API call ──────────────────────────────────────────────────────────────

    private Mono<String> callAnthropicApi(String prompt) {
        Map<String, Object> requestBody = Map.of(
            "model", model,
            "max_tokens", maxTokens,
            "messages", List.of(Map.of("role", "user", "content", prompt))
        );

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody))
            .flatMap(bodyJson ->
                anthropicClient.post()
                    .uri("/v1/messages")
                    .header("x-api-key", apiKey)
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
            )
            .map(response -> {
                try {
                    JsonNode root = objectMapper.readTree(response);
                    return root.path("content").get(0).path("text").asText();
                } catch (Exception e) {
                    throw new IllegalStateException("Failed to extract text from Anthropic response", e);
                }
            });
    }

    // ── response parsing ──────────────────────────────────────────────────────

    /**
     * @throws IllegalStateException when the reply is not the expected JSON or
     *         the text falls outside 5–7 sentences
     */
    NarrativeOutput parseResponse(String reply, String investorType) {
        if (reply == null || reply.isBlank()) {
            throw new IllegalStateException("empty reply");
        }
        String cleaned = reply
            .replaceAll("```json", "")
            .replaceAll("```", "")
            .trim();
        JsonNode json;
        try {
            json = objectMapper.readTree(cleaned);
        } catch (Exception e) {
            throw new IllegalStateException("reply is not JSON", e);
        }
        String headline = json.path("headline").asText("").trim();
        String text     = json.path("text").asText("").trim();
        if (headline.isEmpty() || text.isEmpty()) {
            throw new IllegalStateException("reply is missing headline or text");
        }
        int sentences = countSentences(text);
        if (sentences < MIN_SENTENCES || sentences > MAX_SENTENCES) {
            throw new IllegalStateException(String.format(Locale.ROOT,
                "reply has %d sentences, expected %d-%d", sentences, MIN_SENTENCES, MAX_SENTENCES));
        }
        return new NarrativeOutput(headline, text, investorType);
    }

    static int countSentences(String text) {
        return text.trim().split("(?<=[.!?])\\s+").length;
    }
}
