package com.signalfusion.orchestrator.specialist;

import com.signalfusion.common.model.Action;
import com.signalfusion.common.model.MarketQuote;
import com.signalfusion.common.model.SpecialistKind;

import java.util.Map;
import java.util.Objects;

/**
 * Input handed to every specialist for one symbol.
 *
 * @param symbol       ticker
 * @param marketData   latest quote, or null when the provider was unavailable
 * @param priorSignals signals from an earlier run of the same symbol; empty on a first run
 */
public record SpecialistContext(
    String symbol,
    MarketQuote marketData,
    Map<SpecialistKind, Action> priorSignals
) {
    public SpecialistContext {
        Objects.requireNonNull(symbol, "symbol");
        priorSignals = priorSignals == null ? Map.of() : Map.copyOf(priorSignals);
    }

    public static SpecialistContext of(String symbol, MarketQuote marketData) {
        return new SpecialistContext(symbol, marketData, Map.of());
    }
}
