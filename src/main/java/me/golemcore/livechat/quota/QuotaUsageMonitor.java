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
import me.golemcore.livechat.infrastructure.config.LiveChatProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Logs a warning once per quota day when usage crosses the configured share of
 * the daily limit, and an error when the limit is reached.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QuotaUsageMonitor {

    private final QuotaLedger quotaLedger;
    private final LiveChatProperties properties;

    private Subscription subscription;
    private Instant warnedFor;
    private Instant exhaustedFor;

    @PostConstruct
    void init() {
        subscription = quotaLedger.subscribe(this::onUsageChanged);
    }

    @PreDestroy
    void destroy() {
        if (subscription != null) {
            subscription.unsubscribe();
        }
    }

    synchronized void onUsageChanged(int used, int limit) {
        Instant quotaDay = quotaLedger.getResetAt();
        if (used >= limit) {
            if (!quotaDay.equals(exhaustedFor)) {
                exhaustedFor = quotaDay;
                log.error("[Quota] Daily quota exhausted ({}/{}), resets at {}", used, limit, quotaDay);
            }
            return;
        }
        double threshold = properties.getQuota().getWarnThreshold();
        if (threshold > 0 && used >= limit * threshold && !quotaDay.equals(warnedFor)) {
            warnedFor = quotaDay;
            log.warn("[Quota] {}/{} units used ({}%), resets at {}", used, limit, used * 100 / limit, quotaDay);
        }
    }
}
