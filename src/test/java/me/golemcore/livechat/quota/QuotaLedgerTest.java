package me.golemcore.livechat.quota;

import me.golemcore.livechat.dispatch.Subscription;
import me.golemcore.livechat.domain.exception.QuotaExceededException;
import me.golemcore.livechat.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class QuotaLedgerTest {

    private static final ZoneId PACIFIC = ZoneId.of("America/Los_Angeles");
    // 04:00 in Los Angeles (PST)
    private static final Instant START = Instant.parse("2026-01-15T12:00:00Z");
    private static final Instant NEXT_MIDNIGHT = Instant.parse("2026-01-16T08:00:00Z");

    private MutableClock clock;
    private QuotaLedger ledger;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        ledger = new QuotaLedger(100, PACIFIC, clock);
    }

    // ===== Accounting =====

    @Test
    void shouldAccumulateUsage() {
        assertEquals(5, ledger.add(5));
        assertEquals(55, ledger.add(50));
        assertEquals(55, ledger.getUsed());
        assertEquals(45, ledger.getRemaining());
        assertFalse(ledger.isExhausted());
    }

    @Test
    void shouldChargeOperationsFromCostTable() {
        ledger.add(QuotaCosts.LIVE_CHAT_MESSAGES_LIST);
        ledger.add(QuotaCosts.LIVE_CHAT_MESSAGES_INSERT);
        ledger.add("somethingUnknown.call");
        ledger.add(QuotaCosts.VIDEOS_LIST, 3);

        assertEquals(5 + 50 + 1 + 3, ledger.getUsed());
    }

    @Test
    void shouldNeverReportNegativeRemaining() {
        ledger.add(150);

        assertEquals(0, ledger.getRemaining());
        assertTrue(ledger.isExhausted());
    }

    @Test
    void shouldBeExhaustedExactlyAtLimit() {
        ledger.add(99);
        assertFalse(ledger.isExhausted());

        ledger.add(1);
        assertTrue(ledger.isExhausted());
    }

    @Test
    void shouldRejectNegativeCost() {
        assertThrows(IllegalArgumentException.class, () -> ledger.add(-1));
    }

    @Test
    void shouldThrowWhenBudgetSpent() {
        ledger.ensureAvailable();
        ledger.add(100);

        QuotaExceededException e = assertThrows(QuotaExceededException.class, ledger::ensureAvailable);
        assertEquals(100, e.getUsed());
        assertEquals(100, e.getLimit());
        assertEquals(NEXT_MIDNIGHT, e.getResetAt());
    }

    // ===== Daily reset =====

    @Test
    void shouldScheduleResetAtNextPacificMidnight() {
        assertEquals(NEXT_MIDNIGHT, ledger.getResetAt());
    }

    @Test
    void shouldZeroUsageOnceResetInstantPasses() {
        ledger.add(100);
        assertTrue(ledger.isExhausted());

        clock.set(NEXT_MIDNIGHT.minusSeconds(1));
        assertEquals(100, ledger.getUsed());

        clock.set(NEXT_MIDNIGHT);
        assertEquals(0, ledger.getUsed());
        assertFalse(ledger.isExhausted());
        assertEquals(NEXT_MIDNIGHT.plus(Duration.ofDays(1)), ledger.getResetAt());
    }

    @Test
    void shouldResetBeforeAddingAfterBoundary() {
        ledger.add(80);
        clock.advance(Duration.ofDays(1));

        assertEquals(10, ledger.add(10));
    }

    @Test
    void shouldResetManually() {
        ledger.add(70);
        ledger.reset();

        assertEquals(0, ledger.getUsed());
        assertEquals(100, ledger.getRemaining());
    }

    @Test
    void shouldComputeResetAcrossDaylightSavingChange() {
        // 2026-03-08 is the spring-forward day in Los Angeles
        Instant afterSwitch = Instant.parse("2026-03-08T10:00:00Z");
        assertEquals(Instant.parse("2026-03-09T07:00:00Z"), QuotaLedger.nextResetAfter(afterSwitch, PACIFIC));
    }

    // ===== Listeners =====

    @Test
    void shouldNotifyListenersAfterEachMutation() {
        List<Integer> seen = new ArrayList<>();
        ledger.subscribe((used, limit) -> seen.add(used));

        ledger.add(5);
        ledger.add(10);
        ledger.reset();

        assertEquals(List.of(5, 15, 0), seen);
    }

    @Test
    void shouldAllowListenerToReenterLedger() {
        AtomicInteger observedRemaining = new AtomicInteger(-1);
        ledger.subscribe((used, limit) -> observedRemaining.set(ledger.getRemaining()));

        ledger.add(30);

        assertEquals(70, observedRemaining.get());
    }

    @Test
    void shouldStopNotifyingAfterUnsubscribe() {
        AtomicInteger calls = new AtomicInteger();
        Subscription subscription = ledger.subscribe((used, limit) -> calls.incrementAndGet());

        ledger.add(1);
        subscription.unsubscribe();
        subscription.unsubscribe();
        ledger.add(1);

        assertEquals(1, calls.get());
    }

    @Test
    void shouldIsolateFailingListener() {
        AtomicInteger calls = new AtomicInteger();
        ledger.subscribe((used, limit) -> {
            throw new IllegalStateException("boom");
        });
        ledger.subscribe((used, limit) -> calls.incrementAndGet());

        assertEquals(3, ledger.add(3));
        assertEquals(1, calls.get());
    }

    @Test
    void shouldCountConcurrentAdds() throws Exception {
        QuotaLedger big = new QuotaLedger(1_000_000, PACIFIC, clock);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(8);
        for (int t = 0; t < 8; t++) {
            executor.submit(() -> {
                for (int i = 0; i < 1000; i++) {
                    big.add(1);
                }
                done.countDown();
            });
        }

        assertTrue(done.await(10, TimeUnit.SECONDS));
        executor.shutdown();
        assertEquals(8000, big.getUsed());
    }

    // ===== Cost table =====

    @Test
    void shouldEstimateBatchCost() {
        int estimate = QuotaCosts.estimate(Map.of(
                QuotaCosts.LIVE_CHAT_MESSAGES_LIST, 10,
                QuotaCosts.LIVE_CHAT_BANS_INSERT, 2,
                "unknown.op", 4));

        assertEquals(10 * 5 + 2 * 50 + 4, estimate);
    }

    @Test
    void shouldDefaultUnknownOperationsToOneUnit() {
        assertEquals(1, QuotaCosts.costOf("liveChatMessages.streamList"));
        assertEquals(1, QuotaCosts.costOf(null));
        assertEquals(100, QuotaCosts.costOf("search.list"));
    }
}
