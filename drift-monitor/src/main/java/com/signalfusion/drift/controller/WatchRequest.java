package com.signalfusion.drift.controller;

import com.signalfusion.common.model.Action;
import com.signalfusion.drift.model.MarketSnapshot;
import com.signalfusion.drift.model.MonitoredAnalysis;

import java.time.Clock;
import java.time.Instant;

/**
 * Body of {@code POST /api/v1/drift/watch}: the finalized recommendation plus the market view
 * recorded when it completed.
 *
 * @param completedAt defaults to now when omitted
 */
public record WatchRequest(
    String analysisId,
    String symbol,
    String action,
    Double stopLoss,
    Double targetPrice,
    Double baselinePrice,
    Long baselineVolume,
    Double baselineVolatility,
    Double baselineSentiment,
    Instant completedAt
) {
    /**
     * @throws IllegalArgumentException on a missing id, symbol or baseline price, or an unknown action
     */
    public MonitoredAnalysis toAnalysis(Clock clock) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol is required");
        }
        if (baselinePrice == null) {
            throw new IllegalArgumentException("baselinePrice is required");
        }
        Action parsed = null;
        if (action != null && !action.isBlank()) {
            parsed = Action.parse(action);
            if (parsed == null) {
                throw new IllegalArgumentException("Unknown action: " + action);
            }
        }
        Instant completed = completedAt != null ? completedAt : clock.instant();
        String normalized = symbol.trim().toUpperCase();
        MarketSnapshot baseline = new MarketSnapshot(normalized, baselinePrice,
                                                     baselineVolume != null ? baselineVolume : 0L,
                                                     baselineVolatility, baselineSentiment, completed);
        return new MonitoredAnalysis(analysisId, normalized, parsed, stopLoss, targetPrice, baseline, completed);
    }
}
