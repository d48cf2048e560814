package me.golemcore.livechat.domain.service;

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

import me.golemcore.livechat.domain.exception.TokenRefreshException;
import me.golemcore.livechat.port.outbound.CredentialsPort;
import me.golemcore.livechat.port.outbound.TokenProviderPort;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Background worker that fetches a fresh access token on a fixed interval and
 * installs it into the shared HTTP executor. Runs independently of the
 * ingestion cadence.
 *
 * <p>
 * A failed refresh is reported to the failure callback and the previous token
 * stays installed; the next tick tries again.
 */
@Slf4j
public class TokenRefreshScheduler {

    private final TokenProviderPort tokenProvider;
    private final CredentialsPort credentials;
    private final Consumer<Throwable> onFailure;
    private final Object lock = new Object();

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> refreshTask;

    public TokenRefreshScheduler(TokenProviderPort tokenProvider, CredentialsPort credentials,
            Consumer<Throwable> onFailure) {
        this.tokenProvider = tokenProvider;
        this.credentials = credentials;
        this.onFailure = onFailure;
    }

    /**
     * Fetches and installs a token on the calling thread.
     *
     * @throws TokenRefreshException
     *             if the provider fails or returns a blank token
     */
    public void refreshNow() {
        String token;
        try {
            token = tokenProvider.getAccessToken();
        } catch (TokenRefreshException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TokenRefreshException("token provider failed: " + e.getMessage(), e);
        }
        if (token == null || token.isBlank()) {
            throw new TokenRefreshException("token provider returned an empty token");
        }
        credentials.installAccessToken(token);
    }

    public void start(Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("token refresh interval must be positive");
        }
        synchronized (lock) {
            if (scheduler != null) {
                return;
            }
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "livechat-token-refresh");
                t.setDaemon(true);
                return t;
            });
            long millis = interval.toMillis();
            refreshTask = scheduler.scheduleAtFixedRate(this::refreshQuietly, millis, millis,
                    TimeUnit.MILLISECONDS);
            log.info("[TokenRefresh] Refreshing access token every {}", interval);
        }
    }

    public void stop() {
        ScheduledExecutorService toStop;
        synchronized (lock) {
            if (scheduler == null) {
                return;
            }
            refreshTask.cancel(false);
            toStop = scheduler;
            scheduler = null;
            refreshTask = null;
        }
        toStop.shutdown();
        try {
            if (!toStop.awaitTermination(5, TimeUnit.SECONDS)) {
                toStop.shutdownNow();
            }
        } catch (InterruptedException e) {
            toStop.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.debug("[TokenRefresh] Stopped");
    }

    public boolean isRunning() {
        synchronized (lock) {
            return scheduler != null;
        }
    }

    private void refreshQuietly() {
        try {
            refreshNow();
            log.debug("[TokenRefresh] Access token refreshed");
        } catch (RuntimeException e) {
            log.warn("[TokenRefresh] Refresh failed: {}", e.getMessage());
            onFailure.accept(e);
        }
    }
}
