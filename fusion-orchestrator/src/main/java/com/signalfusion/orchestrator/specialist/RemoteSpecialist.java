package com.signalfusion.orchestrator.specialist;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalfusion.common.exception.SpecialistException;
import com.signalfusion.common.model.SpecialistKind;
import com.signalfusion.common.model.SpecialistResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link Specialist} served by a remote worker over HTTP:
 * {@code POST {base}/api/v1/specialists/{kind}/analyze}.
 *
 * <p>Expected response body:
 * <pre>
 * { "payload": {...}, "confidence": 0.0-1.0, "citations": ["..."], "producedAt": "ISO-8601" }
 * </pre>
 * Transport errors and malformed bodies surface as {@link SpecialistException}; the
 * dispatcher decides whether to retry.
 */
public class RemoteSpecialist implements Specialist {

    private static final Logger log = LoggerFactory.getLogger(RemoteSpecialist.class);

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final SpecialistKind kind;
    private final WebClient specialistClient;
    private final ObjectMapper objectMapper;

    public RemoteSpecialist(SpecialistKind kind, WebClient specialistClient, ObjectMapper objectMapper) {
        this.kind = kind;
        this.specialistClient = specialistClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public SpecialistKind kind() {
        return kind;
    }

    @Override
    public Mono<SpecialistResult> analyze(SpecialistContext context) {
        Map<String, Object> body = new HashMap<>();
        body.put("symbol", context.symbol());
        body.put("market_data", context.marketData());
        body.put("prior_signals", context.priorSignals());

        return specialistClient.post()
            .uri("/api/v1/specialists/{kind}/analyze", kind.wireName())
            .bodyValue(body)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .map(json -> toResult(context.symbol(), json))
            .doOnNext(r -> log.debug("SPECIALIST_RESPONDED kind={} symbol={} confidence={}",
                                     kind, context.symbol(), r.confidence()))
            .onErrorMap(e -> !(e instanceof SpecialistException),
                        e -> new SpecialistException(kind, context.symbol(), e.getMessage(), e, false));
    }

    private SpecialistResult toResult(String symbol, JsonNode json) {
        JsonNode payloadNode = json.path("payload");
        if (!payloadNode.isObject()) {
            throw new SpecialistException(kind, symbol, "response carried no payload object");
        }
        Map<String, Object> payload = objectMapper.convertValue(payloadNode, PAYLOAD_TYPE);
        double confidence = json.path("confidence").asDouble(0.5);

        List<String> citations = new ArrayList<>();
        json.path("citations").forEach(c -> citations.add(c.asText()));

        Instant producedAt = null;
        if (json.hasNonNull("producedAt")) {
            try {
                producedAt = Instant.parse(json.path("producedAt").asText());
            } catch (DateTimeParseException e) {
                log.debug("Unparseable producedAt from {} specialist, using now. value={}",
                          kind, json.path("producedAt").asText());
            }
        }
        return new SpecialistResult(kind, symbol, payload, confidence, citations, producedAt);
    }
}
