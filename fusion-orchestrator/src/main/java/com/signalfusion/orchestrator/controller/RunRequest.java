package com.signalfusion.orchestrator.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.signalfusion.common.model.AnalysisTask;
import com.signalfusion.common.model.Capability;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Body of {@code POST /api/v1/fusion/run}. Capability names are case-insensitive; an absent
 * or empty list requests every capability.
 */
public record RunRequest(
    @JsonProperty("symbols") List<String> symbols,
    @JsonProperty("capabilities") List<String> capabilities,
    @JsonProperty("priority") Integer priority
) {
    private static final int DEFAULT_PRIORITY = 5;

    /** @throws IllegalArgumentException on unknown capabilities or invalid symbols */
    public AnalysisTask toTask() {
        Set<Capability> flags = EnumSet.noneOf(Capability.class);
        if (capabilities != null) {
            for (String name : capabilities) {
                if (name == null || name.isBlank()) {
                    throw new IllegalArgumentException("Capability names must be non-blank");
                }
                try {
                    flags.add(Capability.valueOf(name.trim().toUpperCase(Locale.ROOT)));
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("Unknown capability: " + name, e);
                }
            }
        }
        List<String> normalized = symbols == null ? List.of()
            : symbols.stream().map(s -> s == null ? null : s.trim().toUpperCase(Locale.ROOT)).toList();
        return new AnalysisTask(UUID.randomUUID().toString(), normalized, flags,
                                priority != null ? priority : DEFAULT_PRIORITY, Instant.now());
    }
}
