package com.signalfusion.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/** Latest quote from the market-data provider. */
public record MarketQuote(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("price") double price,
    @JsonProperty("prevClose") double prevClose,
    @JsonProperty("volume") long volume,
    @JsonProperty("marketCap") double marketCap,
    @JsonProperty("timestamp") Instant timestamp
) {
    public boolean hasUsablePrice() {
        return price > 0.0 && Double.isFinite(price);
    }
}
