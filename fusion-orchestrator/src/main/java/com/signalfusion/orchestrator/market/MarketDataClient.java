package com.signalfusion.orchestrator.market;

import com.signalfusion.common.model.MarketQuote;
import reactor.core.publisher.Mono;

/** Latest-quote lookup against the market-data provider. */
public interface MarketDataClient {

    /**
     * @return the quote, or empty when the provider failed; never errors
     */
    Mono<MarketQuote> getQuote(String symbol);
}
