package com.signalfusion.orchestrator.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * One cached response. {@code symbol} and {@code queryType} are kept alongside the value so
 * that bulk invalidation can match entries without reversing the hashed key.
 */
public record CacheEntry(
    String key,
    Object value,
    Instant storedAt,
    String symbol,
    String queryType
) {
    public boolean isExpired(Instant now, Duration ttl) {
        return !now.isBefore(storedAt.plus(ttl));
    }
}
