package com.signalfusion.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * A unit of fusion work: one or more symbols analysed under a set of requested capabilities.
 *
 * <p>Immutable once constructed. Symbols keep caller order and must be unique and non-blank.
 */
public record AnalysisTask(
    @JsonProperty("id") String id,
    @JsonProperty("symbols") List<String> symbols,
    @JsonProperty("capabilities") Set<Capability> capabilities,
    @JsonProperty("priority") int priority,
    @JsonProperty("createdAt") Instant createdAt
) {
    public AnalysisTask {
        Objects.requireNonNull(id, "id");
        if (symbols == null || symbols.isEmpty()) {
            throw new IllegalArgumentException("AnalysisTask requires at least one symbol");
        }
        Set<String> seen = new HashSet<>();
        for (String symbol : symbols) {
            if (symbol == null || symbol.isBlank()) {
                throw new IllegalArgumentException("AnalysisTask symbols must be non-blank");
            }
            if (!seen.add(symbol)) {
                throw new IllegalArgumentException("Duplicate symbol in AnalysisTask: " + symbol);
            }
        }
        symbols = List.copyOf(symbols);
        capabilities = (capabilities == null || capabilities.isEmpty())
            ? Collections.unmodifiableSet(EnumSet.allOf(Capability.class))
            : Collections.unmodifiableSet(EnumSet.copyOf(capabilities));
        createdAt = createdAt != null ? createdAt : Instant.now();
    }

    /** New task with a random id, every capability and default priority. */
    public static AnalysisTask of(String... symbols) {
        return new AnalysisTask(UUID.randomUUID().toString(), List.of(symbols),
                                Capability.all(), 5, Instant.now());
    }

    public static AnalysisTask of(List<String> symbols, Set<Capability> capabilities) {
        return new AnalysisTask(UUID.randomUUID().toString(), symbols, capabilities, 5, Instant.now());
    }

    /** Specialist kinds enabled by the requested capabilities, in declaration order. */
    public Set<SpecialistKind> requestedSpecialists() {
        Set<SpecialistKind> kinds = new LinkedHashSet<>();
        for (SpecialistKind kind : SpecialistKind.values()) {
            for (Capability c : capabilities) {
                if (c.specialistKind() == kind) kinds.add(kind);
            }
        }
        return kinds;
    }

    public boolean enrichmentRequested() {
        return capabilities.contains(Capability.ENRICHMENT);
    }
}
