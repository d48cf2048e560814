package me.golemcore.livechat.cache;

import me.golemcore.livechat.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ResponseCacheTest {

    private MutableClock clock;
    private ResponseCache<String> cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-15T12:00:00Z"));
        cache = new ResponseCache<>(Duration.ofMinutes(5), 3, clock);
    }

    // ===== Get / set =====

    @Test
    void shouldReturnValueBeforeExpiry() {
        cache.set("a", "alpha");
        clock.advance(Duration.ofMinutes(5));

        assertEquals(Optional.of("alpha"), cache.get("a"));
    }

    @Test
    void shouldMissStrictlyAfterExpiryAndRemoveEntry() {
        cache.set("a", "alpha", Duration.ofSeconds(10));
        clock.advance(Duration.ofSeconds(10).plusMillis(1));

        assertEquals(Optional.empty(), cache.get("a"));
        assertEquals(0, cache.size());
    }

    @Test
    void shouldMissUnknownKey() {
        assertTrue(cache.get("missing").isEmpty());
    }

    @Test
    void shouldOverwriteExistingKeyWithoutEviction() {
        cache.set("a", "1");
        cache.set("b", "2");
        cache.set("c", "3");
        cache.set("a", "1b");

        assertEquals(3, cache.size());
        assertEquals(Optional.of("1b"), cache.get("a"));
        assertEquals(Optional.of("2"), cache.get("b"));
    }

    @Test
    void shouldDeleteAndClear() {
        cache.set("a", "1");
        cache.set("b", "2");

        cache.delete("a");
        assertTrue(cache.get("a").isEmpty());
        assertEquals(1, cache.size());

        cache.clear();
        assertEquals(0, cache.size());
    }

    // ===== Eviction =====

    @Test
    void shouldEvictExpiredEntryBeforeUnexpiredOnes() {
        cache.set("short", "s", Duration.ofSeconds(1));
        cache.set("long1", "l1", Duration.ofMinutes(10));
        cache.set("long2", "l2", Duration.ofMinutes(10));
        clock.advance(Duration.ofSeconds(2));

        cache.set("new", "n");

        assertEquals(3, cache.size());
        assertFalse(cache.keys().contains("short"));
        assertTrue(cache.get("long1").isPresent());
        assertTrue(cache.get("long2").isPresent());
        assertTrue(cache.get("new").isPresent());
    }

    @Test
    void shouldEvictEarliestExpiryWhenNothingExpired() {
        cache.set("first", "1", Duration.ofMinutes(10));
        cache.set("soonest", "2", Duration.ofMinutes(1));
        cache.set("third", "3", Duration.ofMinutes(20));

        cache.set("fourth", "4", Duration.ofMinutes(30));

        assertTrue(cache.get("soonest").isEmpty());
        assertTrue(cache.get("first").isPresent());
        assertTrue(cache.get("third").isPresent());
        assertTrue(cache.get("fourth").isPresent());
    }

    @Test
    void shouldNotPreferRecentlyReadEntries() {
        cache.set("a", "1", Duration.ofMinutes(1));
        cache.set("b", "2", Duration.ofMinutes(2));
        cache.set("c", "3", Duration.ofMinutes(3));
        cache.get("a");
        cache.get("a");

        cache.set("d", "4", Duration.ofMinutes(4));

        assertTrue(cache.get("a").isEmpty());
    }

    // ===== Maintenance =====

    @Test
    void shouldCleanupExpiredEntries() {
        cache.set("a", "1", Duration.ofSeconds(1));
        cache.set("b", "2", Duration.ofSeconds(1));
        cache.set("c", "3", Duration.ofMinutes(1));
        clock.advance(Duration.ofSeconds(5));

        assertEquals(2, cache.cleanup());
        assertEquals(1, cache.size());
        assertEquals(0, cache.cleanup());
    }

    @Test
    void shouldReportStats() {
        cache.set("a", "1", Duration.ofSeconds(1));
        cache.set("b", "2", Duration.ofMinutes(1));
        clock.advance(Duration.ofSeconds(5));

        CacheStats stats = cache.stats();

        assertEquals(2, stats.total());
        assertEquals(1, stats.active());
        assertEquals(1, stats.expired());
    }

    // ===== getOrSet =====

    @Test
    void shouldComputeOnMissAndReuseOnHit() {
        AtomicInteger loads = new AtomicInteger();

        String first = cache.getOrSet("k", () -> "v" + loads.incrementAndGet());
        String second = cache.getOrSet("k", () -> "v" + loads.incrementAndGet());

        assertEquals("v1", first);
        assertEquals("v1", second);
        assertEquals(1, loads.get());
    }

    @Test
    void shouldRecomputeAfterExpiry() {
        AtomicInteger loads = new AtomicInteger();
        cache.getOrSet("k", Duration.ofSeconds(1), () -> "v" + loads.incrementAndGet());
        clock.advance(Duration.ofSeconds(2));

        assertEquals("v2", cache.getOrSet("k", () -> "v" + loads.incrementAndGet()));
    }

    @Test
    void shouldPropagateLoaderFailureAndCacheNothing() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> cache.getOrSet("k", () -> {
                    throw new IllegalStateException("load failed");
                }));

        assertEquals("load failed", e.getMessage());
        assertTrue(cache.get("k").isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void shouldRejectNullValues() {
        assertThrows(NullPointerException.class, () -> cache.set("k", null));
        assertThrows(NullPointerException.class, () -> cache.set(null, "v"));
        assertEquals(0, cache.size());
    }

    @Test
    void shouldNotCacheNullFromLoader() {
        AtomicInteger loads = new AtomicInteger();

        assertNull(cache.getOrSet("k", () -> {
            loads.incrementAndGet();
            return null;
        }));
        assertEquals("v", cache.getOrSet("k", () -> {
            loads.incrementAndGet();
            return "v";
        }));

        assertEquals(2, loads.get());
        assertEquals(Optional.of("v"), cache.get("k"));
    }

    @Test
    void shouldRejectInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new ResponseCache<String>(Duration.ZERO, 10, clock));
        assertThrows(IllegalArgumentException.class,
                () -> new ResponseCache<String>(Duration.ofMinutes(1), 0, clock));
    }
}
