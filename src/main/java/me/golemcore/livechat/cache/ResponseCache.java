package me.golemcore.livechat.cache;

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

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Capacity-bounded key/value store whose entries expire after a TTL.
 *
 * <p>
 * When an insert finds the cache full, expired entries are purged first; if it
 * is still full, the entry with the earliest expiry is evicted. Eviction is by
 * expiry, not by recency of use.
 *
 * <p>
 * {@link #getOrSet(String, Supplier)} re-checks under the write lock before
 * loading, but the loader itself runs without the lock. Two threads missing
 * the same key at the same moment may both load; the later value wins.
 *
 * <p>
 * Keys and values must not be {@code null}. A loader that returns
 * {@code null} is treated as a miss: nothing is stored and {@code null} is
 * returned.
 *
 * @param <V>
 *            value type
 * @since 1.0
 */
@Slf4j
public class ResponseCache<V> {

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);
    public static final int DEFAULT_MAX_ITEMS = 1000;

    private final Map<String, Entry<V>> entries = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Duration defaultTtl;
    private final int maxItems;
    private final Clock clock;

    public ResponseCache(Duration defaultTtl, int maxItems, Clock clock) {
        if (defaultTtl == null || defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("defaultTtl must be positive");
        }
        if (maxItems <= 0) {
            throw new IllegalArgumentException("maxItems must be positive");
        }
        this.defaultTtl = defaultTtl;
        this.maxItems = maxItems;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    public ResponseCache() {
        this(DEFAULT_TTL, DEFAULT_MAX_ITEMS, Clock.systemUTC());
    }

    public Optional<V> get(String key) {
        Instant now = clock.instant();
        lock.readLock().lock();
        try {
            Entry<V> entry = entries.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (!entry.isExpired(now)) {
                return Optional.of(entry.value());
            }
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            Entry<V> entry = entries.get(key);
            if (entry != null && entry.isExpired(now)) {
                entries.remove(key);
            }
            return Optional.empty();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void set(String key, V value) {
        set(key, value, defaultTtl);
    }

    public void set(String key, V value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Instant expiresAt = clock.instant().plus(ttl);
        lock.writeLock().lock();
        try {
            insert(key, value, expiresAt);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void delete(String key) {
        lock.writeLock().lock();
        try {
            entries.remove(key);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes all expired entries and returns how many were removed.
     */
    public int cleanup() {
        lock.writeLock().lock();
        try {
            return purgeExpired(clock.instant());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public CacheStats stats() {
        Instant now = clock.instant();
        lock.readLock().lock();
        try {
            int expired = 0;
            for (Entry<V> entry : entries.values()) {
                if (entry.isExpired(now)) {
                    expired++;
                }
            }
            return new CacheStats(entries.size(), entries.size() - expired, expired);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> keys() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(entries.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the cached value or loads, stores and returns it. A failing
     * loader caches nothing and its exception propagates.
     */
    public V getOrSet(String key, Supplier<V> loader) {
        return getOrSet(key, defaultTtl, loader);
    }

    public V getOrSet(String key, Duration ttl, Supplier<V> loader) {
        Optional<V> cached = get(key);
        if (cached.isPresent()) {
            return cached.get();
        }

        lock.writeLock().lock();
        try {
            Entry<V> entry = entries.get(key);
            if (entry != null && !entry.isExpired(clock.instant())) {
                return entry.value();
            }
        } finally {
            lock.writeLock().unlock();
        }

        V value = loader.get();
        if (value != null) {
            set(key, value, ttl);
        }
        return value;
    }

    // caller holds write lock
    private void insert(String key, V value, Instant expiresAt) {
        if (!entries.containsKey(key) && entries.size() >= maxItems) {
            purgeExpired(clock.instant());
            if (entries.size() >= maxItems) {
                evictEarliestExpiry();
            }
        }
        entries.put(key, new Entry<>(value, expiresAt));
    }

    private int purgeExpired(Instant now) {
        int removed = 0;
        Iterator<Map.Entry<String, Entry<V>>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            if (it.next().getValue().isExpired(now)) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("[Cache] Purged {} expired entries", removed);
        }
        return removed;
    }

    private void evictEarliestExpiry() {
        String victim = null;
        Instant earliest = null;
        for (Map.Entry<String, Entry<V>> candidate : entries.entrySet()) {
            Instant expiresAt = candidate.getValue().expiresAt();
            if (earliest == null || expiresAt.isBefore(earliest)) {
                earliest = expiresAt;
                victim = candidate.getKey();
            }
        }
        if (victim != null) {
            entries.remove(victim);
            log.debug("[Cache] Evicted '{}' (expires {})", victim, earliest);
        }
    }

    private record Entry<V>(V value, Instant expiresAt) {

        boolean isExpired(Instant now) {
            return now.isAfter(expiresAt);
        }
    }
}
