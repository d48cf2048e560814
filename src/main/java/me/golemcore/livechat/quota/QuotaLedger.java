package me.golemcore.livechat.quota;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.livechat.dispatch.Subscription;
import me.golemcore.livechat.domain.exception.QuotaExceededException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Thread-safe ledger of quota units spent against a daily budget.
 *
 * <p>
 * The budget resets at the next midnight in the configured zone (Pacific time
 * for YouTube). Every read or write first checks whether that instant has
 * passed and, if so, zeroes usage and schedules the following reset.
 *
 * <p>
 * Listeners run synchronously after each mutation but outside the internal
 * lock, so a listener may call back into the ledger.
 *
 * @since 1.0
 */
@Slf4j
public class QuotaLedger {

    public static final ZoneId DEFAULT_RESET_ZONE = ZoneId.of("America/Los_Angeles");

    private final int limit;
    private final ZoneId resetZone;
    private final Clock clock;
    private final Object lock = new Object();
    private final Map<Long, QuotaListener> listeners = new LinkedHashMap<>();

    private int used;
    private Instant resetAt;
    private long nextListenerId;

    public QuotaLedger(int limit, ZoneId resetZone, Clock clock) {
        if (limit <= 0) {
            throw new IllegalArgumentException("quota limit must be positive");
        }
        this.limit = limit;
        this.resetZone = resetZone != null ? resetZone : DEFAULT_RESET_ZONE;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.resetAt = nextResetAfter(this.clock.instant(), this.resetZone);
    }

    public QuotaLedger(int limit) {
        this(limit, DEFAULT_RESET_ZONE, Clock.systemUTC());
    }

    /**
     * Records {@code cost} units and returns the total used today.
     */
    public int add(int cost) {
        if (cost < 0) {
            throw new IllegalArgumentException("cost must be non-negative");
        }
        int total;
        synchronized (lock) {
            rollOverIfDue();
            used += cost;
            total = used;
        }
        notifyListeners(total);
        return total;
    }

    public int add(String operation) {
        return add(QuotaCosts.costOf(operation));
    }

    public int add(String operation, int count) {
        return add(QuotaCosts.costOf(operation) * count);
    }

    public int getUsed() {
        return read(() -> used);
    }

    public int getRemaining() {
        return read(() -> Math.max(limit - used, 0));
    }

    public boolean isExhausted() {
        return read(() -> used >= limit);
    }

    public int getLimit() {
        return limit;
    }

    public Instant getResetAt() {
        synchronized (lock) {
            rollOverIfDue();
            return resetAt;
        }
    }

    /**
     * Throws if the budget for today is already spent.
     */
    public void ensureAvailable() {
        int snapshotUsed;
        Instant snapshotResetAt;
        synchronized (lock) {
            rollOverIfDue();
            if (used < limit) {
                return;
            }
            snapshotUsed = used;
            snapshotResetAt = resetAt;
        }
        throw new QuotaExceededException(snapshotUsed, limit, snapshotResetAt);
    }

    /**
     * Zeroes usage and schedules the next reset from now.
     */
    public void reset() {
        synchronized (lock) {
            used = 0;
            resetAt = nextResetAfter(clock.instant(), resetZone);
        }
        notifyListeners(0);
    }

    /**
     * Registers a listener invoked with {@code (used, limit)} after each change.
     */
    public Subscription subscribe(QuotaListener listener) {
        long id;
        synchronized (lock) {
            id = nextListenerId++;
            listeners.put(id, listener);
        }
        return Subscription.once(() -> {
            synchronized (lock) {
                listeners.remove(id);
            }
        });
    }

    static Instant nextResetAfter(Instant now, ZoneId zone) {
        ZonedDateTime local = now.atZone(zone);
        return local.toLocalDate().plusDays(1).atStartOfDay(zone).toInstant();
    }

    private <T> T read(Supplier<T> reader) {
        T value;
        boolean rolledOver;
        synchronized (lock) {
            rolledOver = rollOverIfDue();
            value = reader.get();
        }
        if (rolledOver) {
            notifyListeners(0);
        }
        return value;
    }

    // caller holds lock
    private boolean rollOverIfDue() {
        Instant now = clock.instant();
        if (now.isBefore(resetAt)) {
            return false;
        }
        log.info("[Quota] Daily quota reset ({} units used before reset)", used);
        used = 0;
        resetAt = nextResetAfter(now, resetZone);
        return true;
    }

    private void notifyListeners(int total) {
        List<QuotaListener> snapshot;
        synchronized (lock) {
            if (listeners.isEmpty()) {
                return;
            }
            snapshot = new ArrayList<>(listeners.values());
        }
        for (QuotaListener listener : snapshot) {
            try {
                listener.onUsageChanged(total, limit);
            } catch (RuntimeException e) {
                log.warn("[Quota] Usage listener failed: {}", e.getMessage());
            }
        }
    }
}
