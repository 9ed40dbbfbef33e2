package com.signalfusion.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Raw output of one specialist for one symbol.
 *
 * <p>{@code payload} is deliberately loosely typed: specialists return heterogeneous
 * shapes (numbers raw, nested under {@code "value"}, or as strings). Read it through
 * {@link com.signalfusion.common.extract.ValueExtractor}, never by casting.
 *
 * <p>Never mutated after creation; a re-run supersedes it with a new instance.
 */
public record SpecialistResult(
    @JsonProperty("kind") SpecialistKind kind,
    @JsonProperty("symbol") String symbol,
    @JsonProperty("payload") Map<String, Object> payload,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("citations") List<String> citations,
    @JsonProperty("producedAt") Instant producedAt
) {
    public SpecialistResult {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(symbol, "symbol");
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        citations = citations == null ? List.of() : List.copyOf(citations);
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        producedAt = producedAt != null ? producedAt : Instant.now();
    }

    public static SpecialistResult of(SpecialistKind kind, String symbol,
                                      Map<String, Object> payload, double confidence) {
        return new SpecialistResult(kind, symbol, payload, confidence, List.of(), Instant.now());
    }

    /** Raw payload value for {@code key}, or null. */
    public Object field(String key) {
        return payload.get(key);
    }
}
