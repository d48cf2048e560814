package me.golemcore.livechat.cache;

import me.golemcore.livechat.infrastructure.config.LiveChatProperties;
import me.golemcore.livechat.testsupport.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CacheCleanupSchedulerTest {

    private MutableClock clock;
    private ResponseCache<Object> cache;
    private LiveChatProperties properties;
    private CacheCleanupScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-15T12:00:00Z"));
        cache = new ResponseCache<>(Duration.ofMinutes(5), 100, clock);
        properties = new LiveChatProperties();
        properties.getCache().setCleanupInterval(Duration.ofMillis(20));
        scheduler = new CacheCleanupScheduler(cache, properties);
    }

    @AfterEach
    void tearDown() {
        scheduler.destroy();
    }

    @Test
    void shouldPurgeExpiredEntriesPeriodically() {
        cache.set("short", "a", Duration.ofSeconds(1));
        cache.set("long", "b", Duration.ofHours(1));
        clock.advance(Duration.ofSeconds(2));

        scheduler.init();

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (cache.size() != 1 && System.nanoTime() < deadline) {
            Thread.onSpinWait();
        }
        assertEquals(1, cache.size());
        assertTrue(cache.get("long").isPresent());
    }

    @Test
    void shouldCleanupOnDemand() {
        cache.set("short", "a", Duration.ofSeconds(1));
        clock.advance(Duration.ofSeconds(2));

        scheduler.cleanup();

        assertEquals(0, cache.size());
    }

    @Test
    void shouldSkipSchedulingWhenDisabled() {
        properties.getCache().setCleanupInterval(Duration.ZERO);
        cache.set("short", "a", Duration.ofSeconds(1));
        clock.advance(Duration.ofSeconds(2));

        scheduler.init();

        assertEquals(1, cache.size());
    }
}
