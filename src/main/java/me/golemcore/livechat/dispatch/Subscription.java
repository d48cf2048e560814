package me.golemcore.livechat.dispatch;

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

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle returned by a subscribe call. Only the first {@link #unsubscribe()}
 * has an effect; later calls are no-ops.
 */
@FunctionalInterface
public interface Subscription {

    void unsubscribe();

    /**
     * Wraps an action so it runs at most once.
     */
    static Subscription once(Runnable action) {
        AtomicBoolean done = new AtomicBoolean(false);
        return () -> {
            if (done.compareAndSet(false, true)) {
                action.run();
            }
        };
    }

    /**
     * Combines several subscriptions into one handle that removes them all.
     */
    static Subscription composite(List<Subscription> subscriptions) {
        List<Subscription> copy = List.copyOf(subscriptions);
        return once(() -> copy.forEach(Subscription::unsubscribe));
    }
}
