package com.signalfusion.drift.model;

import com.signalfusion.common.model.Action;

import java.time.Instant;

/**
 * A completed recommendation under watch, with the market view at completion time.
 *
 * @param stopLoss    original stop, null when the recommendation carried none
 * @param targetPrice original target, null when the recommendation carried none
 */
public record MonitoredAnalysis(
    String analysisId,
    String symbol,
    Action action,
    Double stopLoss,
    Double targetPrice,
    MarketSnapshot baseline,
    Instant completedAt
) {
    public MonitoredAnalysis {
        if (analysisId == null || analysisId.isBlank()) {
            throw new IllegalArgumentException("analysisId must not be blank");
        }
        if (baseline == null) {
            throw new IllegalArgumentException("baseline snapshot is required");
        }
        if (completedAt == null) {
            throw new IllegalArgumentException("completedAt is required");
        }
        symbol = symbol != null && !symbol.isBlank() ? symbol.trim().toUpperCase() : baseline.symbol();
        action = action != null ? action : Action.HOLD;
    }

    public boolean hasBand() {
        return stopLoss != null && targetPrice != null;
    }
}
