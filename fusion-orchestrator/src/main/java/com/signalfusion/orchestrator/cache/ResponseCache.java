package com.signalfusion.orchestrator.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Content-addressed, process-wide cache for search and lookup responses.
 *
 * <h3>Key</h3>
 * <pre>
 *   "resp:" + sha256(queryType + ":" + SYMBOL + ":" + k1=v1&amp;k2=v2...)   (params sorted by name)
 * </pre>
 *
 * <h3>Concurrency</h3>
 * Backed by a {@link ConcurrentHashMap}: readers never block, {@link #set} replaces the
 * entry atomically (last write wins). Counters are {@link AtomicLong}s so concurrent
 * specialists record hits and misses without coordination.
 *
 * <p>An expired entry is evicted by the read that finds it; {@code remove(key, entry)} keeps a
 * concurrent overwrite from being lost.
 */
public class ResponseCache {

    private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);

    public static final String KEY_PREFIX = "resp:";

    private final ConcurrentMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final AtomicLong hits   = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();

    private final Clock clock;
    private final Duration ttl;
    private final double costPerCall;

    public ResponseCache(Clock clock, Duration ttl, double costPerCall) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("cache ttl must be positive: " + ttl);
        }
        this.clock = clock;
        this.ttl = ttl;
        this.costPerCall = costPerCall;
    }

    /** Deterministic key for a query; parameter order does not matter. */
    public static String key(String queryType, String symbol, Map<String, ?> params) {
        StringBuilder canonical = new StringBuilder()
            .append(normalizeType(queryType)).append(':')
            .append(normalizeSymbol(symbol)).append(':');
        if (params != null && !params.isEmpty()) {
            StringBuilder joined = new StringBuilder();
            new TreeMap<String, Object>(params).forEach((k, v) -> {
                if (joined.length() > 0) joined.append('&');
                joined.append(k).append('=').append(v == null ? "" : String.valueOf(v).trim());
            });
            canonical.append(joined);
        }
        return KEY_PREFIX + sha256(canonical.toString());
    }

    public Optional<Object> get(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            misses.incrementAndGet();
            log.debug("CACHE_MISS key={}", key);
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant(), ttl)) {
            entries.remove(key, entry);
            misses.incrementAndGet();
            log.debug("CACHE_EXPIRED key={} symbol={} storedAt={}", key, entry.symbol(), entry.storedAt());
            return Optional.empty();
        }
        hits.incrementAndGet();
        log.debug("CACHE_HIT key={} symbol={}", key, entry.symbol());
        return Optional.ofNullable(entry.value());
    }

    public void set(String key, Object value) {
        set(key, value, null, null);
    }

    /** Stores {@code value}, recording the symbol and query type for scoped invalidation. */
    public void set(String key, Object value, String symbol, String queryType) {
        Instant now = clock.instant();
        entries.put(key, new CacheEntry(key, value, now,
                                        symbol == null ? null : normalizeSymbol(symbol),
                                        queryType == null ? null : normalizeType(queryType)));
    }

    /** Removes every entry in {@code scope}; returns how many were removed. */
    public int invalidate(CacheScope scope) {
        AtomicInteger counter = new AtomicInteger();
        entries.values().removeIf(entry -> {
            boolean match = scope.matches(entry);
            if (match) counter.incrementAndGet();
            return match;
        });
        int removed = counter.get();
        log.info("CACHE_INVALIDATED symbol={} queryType={} removed={}",
                 scope.symbol(), scope.queryType() == null ? "*" : scope.queryType(), removed);
        return removed;
    }

    /** Counts a failed cache operation; callers continue uncached. */
    public void recordError() {
        errors.incrementAndGet();
    }

    public CacheStats stats() {
        long h = hits.get();
        long m = misses.get();
        long total = h + m;
        return new CacheStats(h, m, errors.get(), entries.size(),
                              total == 0 ? 0.0 : (double) h / total,
                              costPerCall, h * costPerCall);
    }

    /** Zeroes the counters; cached entries stay valid. */
    public void resetStats() {
        hits.set(0);
        misses.set(0);
        errors.set(0);
        log.info("CACHE_STATS_RESET entries={}", entries.size());
    }

    public Duration ttl() {
        return ttl;
    }

    private static String normalizeSymbol(String symbol) {
        return symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
    }

    private static String normalizeType(String queryType) {
        return queryType == null ? "" : queryType.trim().toLowerCase(Locale.ROOT);
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
