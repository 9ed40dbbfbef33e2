package com.signalfusion.orchestrator.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ResponseCacheTest {

    /** Clock whose instant only moves when the test advances it. */
    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) { this.now = start; }

        void advance(Duration d) { now = now.plus(d); }

        @Override public ZoneId getZone()               { return ZoneOffset.UTC; }
        @Override public Clock withZone(ZoneId zone)    { return this; }
        @Override public Instant instant()              { return now; }
    }

    private MutableClock clock;
    private ResponseCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-02T15:00:00Z"));
        cache = new ResponseCache(clock, Duration.ofMinutes(60), 0.01);
    }

    // ── keys ──────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("key derivation")
    class KeyTests {

        @Test
        @DisplayName("parameter order and symbol case do not change the key")
        void normalized() {
            Map<String, Object> a = new LinkedHashMap<>();
            a.put("query", "AAPL earnings");
            a.put("max_results", 10);
            Map<String, Object> b = new LinkedHashMap<>();
            b.put("max_results", 10);
            b.put("query", "AAPL earnings");

            assertEquals(ResponseCache.key("news", "aapl", a), ResponseCache.key("NEWS", "AAPL", b));
        }

        @Test
        @DisplayName("different scope yields a different key")
        void scoped() {
            Map<String, Object> params = Map.of("query", "outlook");
            assertNotEquals(ResponseCache.key("news", "AAPL", params), ResponseCache.key("macro", "AAPL", params));
            assertNotEquals(ResponseCache.key("news", "AAPL", params), ResponseCache.key("news", "MSFT", params));
            assertTrue(ResponseCache.key("news", "AAPL", params).startsWith(ResponseCache.KEY_PREFIX));
        }
    }

    // ── TTL ───────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("TTL")
    class TtlTests {

        @Test
        @DisplayName("set then get before TTL returns the value")
        void roundTrip() {
            cache.set("k", "v");
            clock.advance(Duration.ofMinutes(59));

            assertEquals(Optional.of("v"), cache.get("k"));
        }

        @Test
        @DisplayName("after TTL get misses and the entry is evicted")
        void expiry() {
            cache.set("k", "v");
            clock.advance(Duration.ofMinutes(60));

            assertTrue(cache.get("k").isEmpty());
            assertEquals(0, cache.stats().entries());
            assertEquals(1, cache.stats().misses());
        }

        @Test
        @DisplayName("writers overwrite on key collision")
        void lastWriteWins() {
            cache.set("k", "first");
            cache.set("k", "second");

            assertEquals(Optional.of("second"), cache.get("k"));
            assertEquals(1, cache.stats().entries());
        }

        @Test
        @DisplayName("non-positive TTL is rejected")
        void invalidTtl() {
            assertThrows(IllegalArgumentException.class, () -> new ResponseCache(clock, Duration.ZERO, 0.01));
        }
    }

    // ── invalidation ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("invalidation")
    class InvalidationTests {

        @BeforeEach
        void fill() {
            cache.set("n1", "x", "AAPL", "news");
            cache.set("s1", "x", "AAPL", "social");
            cache.set("n2", "x", "MSFT", "news");
        }

        @Test
        @DisplayName("symbol scope removes every query type of that symbol")
        void bySymbol() {
            assertEquals(2, cache.invalidate(CacheScope.symbol("aapl")));
            assertTrue(cache.get("n1").isEmpty());
            assertTrue(cache.get("n2").isPresent());
        }

        @Test
        @DisplayName("query type narrows the scope")
        void bySymbolAndType() {
            assertEquals(1, cache.invalidate(new CacheScope("AAPL", "News")));
            assertTrue(cache.get("s1").isPresent());
        }
    }

    // ── stats ─────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("stats")
    class StatsTests {

        @Test
        @DisplayName("hit rate and cost saved follow hits")
        void savings() {
            cache.set("k", "v");
            cache.get("k");
            cache.get("k");
            cache.get("k");
            cache.get("missing");

            CacheStats stats = cache.stats();
            assertEquals(3, stats.hits());
            assertEquals(1, stats.misses());
            assertEquals(0.75, stats.hitRate(), 1e-9);
            assertEquals(0.03, stats.estimatedCostSaved(), 1e-9);
        }

        @Test
        @DisplayName("reset clears counters but keeps entries valid")
        void reset() {
            cache.set("k", "v");
            cache.get("k");
            cache.recordError();

            cache.resetStats();

            CacheStats stats = cache.stats();
            assertEquals(0, stats.hits());
            assertEquals(0, stats.errors());
            assertEquals(0.0, stats.hitRate());
            assertEquals(Optional.of("v"), cache.get("k"));
        }

        @Test
        @DisplayName("concurrent readers count every hit")
        void concurrentHits() throws InterruptedException {
            cache.set("k", "v");
            ExecutorService pool = Executors.newFixedThreadPool(8);
            CountDownLatch done = new CountDownLatch(800);
            for (int i = 0; i < 800; i++) {
                pool.submit(() -> {
                    cache.get("k");
                    done.countDown();
                });
            }
            assertTrue(done.await(5, TimeUnit.SECONDS));
            pool.shutdown();

            assertEquals(800, cache.stats().hits());
        }
    }
}
