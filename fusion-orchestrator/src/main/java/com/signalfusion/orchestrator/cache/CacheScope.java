package com.signalfusion.orchestrator.cache;

import java.util.Locale;
import java.util.Objects;

/**
 * Invalidation target: every entry for a symbol, or only one query type of it.
 *
 * @param symbol    ticker, case-insensitive
 * @param queryType query type to narrow to, or null for all types
 */
public record CacheScope(String symbol, String queryType) {

    public CacheScope {
        Objects.requireNonNull(symbol, "symbol");
        symbol = symbol.trim().toUpperCase(Locale.ROOT);
        queryType = (queryType == null || queryType.isBlank()) ? null : queryType.trim().toLowerCase(Locale.ROOT);
    }

    public static CacheScope symbol(String symbol) {
        return new CacheScope(symbol, null);
    }

    boolean matches(CacheEntry entry) {
        return symbol.equals(entry.symbol())
            && (queryType == null || queryType.equals(entry.queryType()));
    }
}
