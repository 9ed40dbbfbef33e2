package com.signalfusion.orchestrator.specialist;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalfusion.common.exception.SpecialistException;
import com.signalfusion.common.model.SpecialistKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class RemoteSpecialistTest {

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    private RemoteSpecialist specialist(SpecialistKind kind, HttpStatus status, String body) {
        WebClient client = WebClient.builder()
            .baseUrl("http://specialists.test")
            .exchangeFunction(request -> {
                lastRequest.set(request);
                return Mono.just(ClientResponse.create(status)
                    .header("Content-Type", "application/json")
                    .body(body)
                    .build());
            })
            .build();
        return new RemoteSpecialist(kind, client, new ObjectMapper());
    }

    @Test
    @DisplayName("parses payload, confidence, citations and producedAt")
    void parsesResponse() {
        String body = """
            {"payload": {"signal": "BUY", "atr": {"value": 3.2}, "current_price": "$150.25"},
             "confidence": 0.82,
             "citations": ["https://example.com/a", "https://example.com/b"],
             "producedAt": "2026-03-02T14:55:00Z"}
            """;

        StepVerifier.create(specialist(SpecialistKind.TECHNICAL, HttpStatus.OK, body)
                .analyze(SpecialistContext.of("AAPL", null)))
            .assertNext(result -> {
                assertEquals(SpecialistKind.TECHNICAL, result.kind());
                assertEquals("AAPL", result.symbol());
                assertEquals("BUY", result.field("signal"));
                assertEquals(0.82, result.confidence(), 1e-9);
                assertEquals(List.of("https://example.com/a", "https://example.com/b"), result.citations());
                assertEquals(Instant.parse("2026-03-02T14:55:00Z"), result.producedAt());
            })
            .verifyComplete();

        assertEquals(HttpMethod.POST, lastRequest.get().method());
        assertEquals("/api/v1/specialists/technical/analyze", lastRequest.get().url().getPath());
    }

    @Test
    @DisplayName("missing confidence defaults to 0.5")
    void defaultConfidence() {
        StepVerifier.create(specialist(SpecialistKind.MACRO, HttpStatus.OK, "{\"payload\": {\"signal\": \"HOLD\"}}")
                .analyze(SpecialistContext.of("AAPL", null)))
            .assertNext(result -> assertEquals(0.5, result.confidence(), 1e-9))
            .verifyComplete();
    }

    @Test
    @DisplayName("body without a payload object → SpecialistException")
    void missingPayload() {
        StepVerifier.create(specialist(SpecialistKind.NEWS, HttpStatus.OK, "{\"confidence\": 0.9}")
                .analyze(SpecialistContext.of("AAPL", null)))
            .expectErrorSatisfies(e -> {
                assertInstanceOf(SpecialistException.class, e);
                assertEquals(SpecialistKind.NEWS, ((SpecialistException) e).getKind());
            })
            .verify();
    }

    @Test
    @DisplayName("HTTP 500 is wrapped as a non-timeout SpecialistException")
    void serverError() {
        StepVerifier.create(specialist(SpecialistKind.RISK, HttpStatus.INTERNAL_SERVER_ERROR, "{}")
                .analyze(SpecialistContext.of("AAPL", null)))
            .expectErrorSatisfies(e -> {
                SpecialistException se = assertInstanceOf(SpecialistException.class, e);
                assertFalse(se.isTimeout());
                assertEquals("AAPL", se.getSymbol());
            })
            .verify();
    }
}
