package com.signalfusion.orchestrator.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * {@link LanguageModelClient} over the Anthropic Messages API.
 *
 * <p>Non-blocking: the HTTP call is a {@code Mono} chain with its own timeout. With no API
 * key configured, or on any failure, it completes empty and the caller uses its rule-based
 * text. A router failure degrades to the configured default tier.
 */
public class AnthropicLanguageModelClient implements LanguageModelClient {

    private static final Logger log = LoggerFactory.getLogger(AnthropicLanguageModelClient.class);

    private static final int MAX_TOKENS = 400;

    private final WebClient anthropicClient;
    private final ObjectMapper objectMapper;
    private final ModelTierRouter router;
    private final String apiKey;
    private final ModelTier defaultTier;
    private final Duration timeout;

    public AnthropicLanguageModelClient(WebClient anthropicClient, ObjectMapper objectMapper,
                                        ModelTierRouter router, String apiKey,
                                        ModelTier defaultTier, Duration timeout) {
        this.anthropicClient = anthropicClient;
        this.objectMapper    = objectMapper;
        this.router          = router;
        this.apiKey          = apiKey;
        this.defaultTier     = defaultTier;
        this.timeout         = timeout;
    }

    @Override
    public Mono<String> complete(String prompt, TaskDescriptor task) {
        if (apiKey == null || apiKey.isBlank()) {
            log.debug("LLM_SKIPPED taskType={} reason=no-api-key", task.taskType());
            return Mono.empty();
        }

        ModelTier tier;
        try {
            tier = router.route(task);
        } catch (RuntimeException e) {
            log.warn("DEGRADED_MODE component=router taskType={} defaultTier={} reason={}",
                     task.taskType(), defaultTier, e.getMessage());
            tier = defaultTier;
        }
        final ModelTier selected = tier;
        String model = router.modelFor(selected);

        Map<String, Object> requestBody = Map.of(
            "model", model,
            "max_tokens", MAX_TOKENS,
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
                    .timeout(timeout))
            .map(response -> extractText(response, selected))
            .doOnSuccess(text -> log.info("LLM_COMPLETED taskType={} tier={} model={} chars={}",
                                          task.taskType(), selected, model, text == null ? 0 : text.length()))
            .onErrorResume(e -> {
                log.warn("LLM_FAILED taskType={} tier={} model={} reason={}",
                         task.taskType(), selected, model, e.getMessage());
                return Mono.empty();
            });
    }

    private String extractText(String response, ModelTier tier) {
        try {
            JsonNode root = objectMapper.readTree(response);
            JsonNode usage = root.path("usage");
            long tokens = usage.path("input_tokens").asLong(0) + usage.path("output_tokens").asLong(0);
            router.record(tier, tokens, router.costPerCall(tier));
            String text = root.path("content").path(0).path("text").asText("");
            if (text.isBlank()) {
                throw new IllegalStateException("Anthropic response carried no text content");
            }
            return text.trim();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to parse Anthropic response", e);
        }
    }
}
