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

import me.golemcore.livechat.infrastructure.config.LiveChatProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically purges expired entries from the shared response cache.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CacheCleanupScheduler {

    private final ResponseCache<Object> responseCache;
    private final LiveChatProperties properties;

    private final ScheduledExecutorService cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "cache-cleanup");
        t.setDaemon(true);
        return t;
    });

    @PostConstruct
    void init() {
        long intervalMs = properties.getCache().getCleanupInterval().toMillis();
        if (intervalMs <= 0) {
            log.debug("[Cache] Scheduled cleanup disabled");
            return;
        }
        cleanupExecutor.scheduleAtFixedRate(this::cleanup, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    void destroy() {
        cleanupExecutor.shutdownNow();
        try {
            if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Cache] Cleanup executor did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    void cleanup() {
        try {
            int removed = responseCache.cleanup();
            if (removed > 0) {
                log.debug("[Cache] Cleanup removed {} expired entries, {} left", removed, responseCache.size());
            }
        } catch (RuntimeException e) {
            log.warn("[Cache] Cleanup failed: {}", e.getMessage());
        }
    }
}
