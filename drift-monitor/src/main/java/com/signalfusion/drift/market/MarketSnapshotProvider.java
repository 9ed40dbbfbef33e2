package com.signalfusion.drift.market;

import com.signalfusion.drift.model.MarketSnapshot;
import reactor.core.publisher.Mono;

public interface MarketSnapshotProvider {

    /**
     * @return the current snapshot, or empty when no usable price is available
     */
    Mono<MarketSnapshot> snapshot(String symbol);
}
