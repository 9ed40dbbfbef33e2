package com.signalfusion.orchestrator.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class AnthropicLanguageModelClientTest {

    private static final String RESPONSE = """
        {"content":[{"type":"text","text":"  Strong fundamentals outweigh soft momentum.  "}],
         "usage":{"input_tokens":120,"output_tokens":80}}
        """;

    private final ModelTierRouter router = new ModelTierRouter("cheap-model", "expensive-model", 0.002, 0.03);
    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    private WebClient stub(HttpStatus status, String body) {
        return WebClient.builder()
            .exchangeFunction(request -> {
                calls.incrementAndGet();
                lastRequest.set(request);
                return Mono.just(ClientResponse.create(status)
                    .header("Content-Type", "application/json")
                    .body(body)
                    .build());
            })
            .build();
    }

    private AnthropicLanguageModelClient client(WebClient webClient, String apiKey) {
        return new AnthropicLanguageModelClient(webClient, new ObjectMapper(), router, apiKey,
                                                ModelTier.CHEAP, Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("no API key → completes empty without calling the provider")
    void noKey() {
        StepVerifier.create(client(stub(HttpStatus.OK, RESPONSE), "")
                .complete("prompt", TaskDescriptor.of("synthesis_reasoning")))
            .verifyComplete();

        assertEquals(0, calls.get());
        assertEquals(0, router.stats().totalCalls());
    }

    @Test
    @DisplayName("successful call returns trimmed text and records usage on the routed tier")
    void recordsUsage() {
        StepVerifier.create(client(stub(HttpStatus.OK, RESPONSE), "test-key")
                .complete("prompt", TaskDescriptor.of("synthesis_reasoning")))
            .expectNext("Strong fundamentals outweigh soft momentum.")
            .verifyComplete();

        assertEquals("test-key", lastRequest.get().headers().getFirst("x-api-key"));
        assertTrue(lastRequest.get().url().getPath().endsWith("/v1/messages"));

        RouterStats stats = router.stats();
        assertEquals(1L, stats.callsByTier().get(ModelTier.EXPENSIVE));
        assertEquals(200L, stats.tokensByTier().get(ModelTier.EXPENSIVE));
        assertEquals(0.03, stats.actualCost(), 1e-9);
    }

    @Test
    @DisplayName("provider error → completes empty, nothing recorded")
    void providerError() {
        StepVerifier.create(client(stub(HttpStatus.INTERNAL_SERVER_ERROR, "{}"), "test-key")
                .complete("prompt", TaskDescriptor.of("headline_extract")))
            .verifyComplete();

        assertEquals(1, calls.get());
        assertEquals(0, router.stats().totalCalls());
    }

    @Test
    @DisplayName("response without text → completes empty")
    void emptyContent() {
        StepVerifier.create(client(stub(HttpStatus.OK, "{\"content\":[],\"usage\":{}}"), "test-key")
                .complete("prompt", TaskDescriptor.of("headline_extract")))
            .verifyComplete();
    }
}
