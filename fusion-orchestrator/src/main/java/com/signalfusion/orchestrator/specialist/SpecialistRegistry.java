package com.signalfusion.orchestrator.specialist;

import com.signalfusion.common.model.SpecialistKind;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/** Specialists available to this process, at most one per kind. */
public class SpecialistRegistry {

    private final Map<SpecialistKind, Specialist> byKind;

    public SpecialistRegistry(Collection<? extends Specialist> specialists) {
        Map<SpecialistKind, Specialist> map = new EnumMap<>(SpecialistKind.class);
        for (Specialist s : specialists) {
            if (map.putIfAbsent(s.kind(), s) != null) {
                throw new IllegalArgumentException("Duplicate specialist registered for " + s.kind());
            }
        }
        this.byKind = Collections.unmodifiableMap(map);
    }

    public Optional<Specialist> find(SpecialistKind kind) {
        return Optional.ofNullable(byKind.get(kind));
    }

    public Collection<Specialist> all() {
        return byKind.values();
    }
}
