package me.golemcore.livechat.lifecycle;

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

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation signal for one session.
 *
 * <p>
 * Waits made through {@link #sleep(Duration)} return early once the token is
 * cancelled. Blocking I/O registers a hook with {@link #onCancel(Runnable)}
 * (for example {@code call::cancel}) so it is aborted as well.
 */
@Slf4j
public final class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<Runnable> hooks = new ArrayList<>();

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public void cancel() {
        List<Runnable> toRun;
        synchronized (hooks) {
            if (isCancelled()) {
                return;
            }
            cancelled.countDown();
            toRun = new ArrayList<>(hooks);
            hooks.clear();
        }
        for (Runnable hook : toRun) {
            runHook(hook);
        }
    }

    /**
     * Waits for {@code duration} or until cancelled.
     *
     * @return {@code true} if the full duration elapsed, {@code false} if the
     *         token was cancelled (or the thread interrupted) first
     */
    public boolean sleep(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return !isCancelled();
        }
        try {
            return !cancelled.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Registers a hook run once on cancellation. If the token is already
     * cancelled the hook runs immediately. The returned handle removes the hook.
     */
    public Runnable onCancel(Runnable hook) {
        synchronized (hooks) {
            if (!isCancelled()) {
                hooks.add(hook);
                return () -> {
                    synchronized (hooks) {
                        hooks.remove(hook);
                    }
                };
            }
        }
        runHook(hook);
        return () -> {
        };
    }

    private void runHook(Runnable hook) {
        try {
            hook.run();
        } catch (RuntimeException e) {
            log.debug("Cancellation hook failed: {}", e.getMessage());
        }
    }
}
