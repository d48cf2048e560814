package me.golemcore.livechat.adapter.inbound.livechat;

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

import me.golemcore.livechat.adapter.outbound.youtube.YouTubeApiClient;
import me.golemcore.livechat.dispatch.HandlerRegistry;
import me.golemcore.livechat.domain.exception.RateLimitedException;
import me.golemcore.livechat.domain.model.LiveChatMessage;
import me.golemcore.livechat.domain.model.MessageDeletedDetails;
import me.golemcore.livechat.domain.model.MessageType;
import me.golemcore.livechat.domain.model.UserBannedDetails;
import me.golemcore.livechat.lifecycle.CancellationToken;
import me.golemcore.livechat.lifecycle.LifecycleController;
import me.golemcore.livechat.lifecycle.LifecycleState;
import me.golemcore.livechat.port.inbound.IngestionPort;
import me.golemcore.livechat.retry.BackoffPolicy;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared plumbing of the poll and stream transports: lifecycle, cursor,
 * backoff attempts and routing of chat items to handler categories.
 *
 * <p>
 * Subclasses implement {@link #runSession(CancellationToken)}, which runs on
 * the background worker until the token is cancelled or the chat ends. The
 * session never throws past this class; failures are dispatched to
 * {@link #ERROR}.
 */
@Slf4j
public abstract class AbstractLiveChatIngestion implements IngestionPort {

    protected final String liveChatId;
    protected final YouTubeApiClient apiClient;
    protected final BackoffPolicy backoffPolicy;

    private final String transport;
    private final HandlerRegistry handlers = new HandlerRegistry(ERROR);
    private final LifecycleController lifecycle;
    private final AtomicInteger attempt = new AtomicInteger();
    private volatile String pageToken = "";

    protected AbstractLiveChatIngestion(String transport, String liveChatId, YouTubeApiClient apiClient,
            BackoffPolicy backoffPolicy) {
        this.transport = transport;
        this.liveChatId = liveChatId;
        this.apiClient = apiClient;
        this.backoffPolicy = backoffPolicy != null ? backoffPolicy : BackoffPolicy.defaults();
        this.lifecycle = new LifecycleController("livechat-" + transport);
    }

    @Override
    public String getTransport() {
        return transport;
    }

    @Override
    public String getLiveChatId() {
        return liveChatId;
    }

    @Override
    public void start() {
        if (liveChatId == null || liveChatId.isBlank()) {
            throw new IllegalStateException("liveChatId is required");
        }
        lifecycle.start(this::runLoop);
    }

    @Override
    public void stop() {
        lifecycle.stop();
    }

    @Override
    public boolean isRunning() {
        return lifecycle.isRunning();
    }

    @Override
    public LifecycleState getState() {
        return lifecycle.getState();
    }

    @Override
    public String getPageToken() {
        return pageToken;
    }

    @Override
    public void setPageToken(String pageToken) {
        this.pageToken = pageToken != null ? pageToken : "";
    }

    @Override
    public void resetPageToken() {
        this.pageToken = "";
    }

    @Override
    public void reset() {
        if (lifecycle.getState() != LifecycleState.STOPPED) {
            throw new IllegalStateException("cannot reset while " + lifecycle.getState());
        }
        pageToken = "";
        attempt.set(0);
    }

    @Override
    public HandlerRegistry getHandlers() {
        return handlers;
    }

    public int getAttempt() {
        return attempt.get();
    }

    protected abstract void runSession(CancellationToken token);

    private void runLoop(CancellationToken token) {
        log.info("[{}] Connected to live chat {}", logPrefix(), liveChatId);
        handlers.dispatch(CONNECT);
        try {
            runSession(token);
        } finally {
            log.info("[{}] Disconnected from live chat {}", logPrefix(), liveChatId);
            handlers.dispatch(DISCONNECT);
        }
    }

    /**
     * Dispatches items in server order, routing deletions and bans to their own
     * categories. Deletion and ban items without their details are dropped.
     */
    protected void dispatchItems(List<LiveChatMessage> items) {
        if (items == null) {
            return;
        }
        for (LiveChatMessage item : items) {
            MessageType type = item.getMessageType().orElse(null);
            if (type == MessageType.MESSAGE_DELETED) {
                MessageDeletedDetails details = item.getSnippet().getMessageDeletedDetails();
                if (details != null && details.getDeletedMessageId() != null) {
                    handlers.dispatch(DELETE, details.getDeletedMessageId());
                } else {
                    log.debug("[{}] Dropping deletion {} without details", logPrefix(), item.getId());
                }
            } else if (type == MessageType.USER_BANNED) {
                UserBannedDetails details = item.getSnippet().getUserBannedDetails();
                if (details != null) {
                    handlers.dispatch(BAN, details);
                } else {
                    log.debug("[{}] Dropping ban {} without details", logPrefix(), item.getId());
                }
            } else {
                handlers.dispatch(MESSAGE, item);
            }
        }
    }

    protected void dispatchError(Throwable error) {
        handlers.dispatch(ERROR, error);
    }

    protected void updatePageToken(String nextPageToken) {
        if (nextPageToken != null && !nextPageToken.isEmpty()) {
            this.pageToken = nextPageToken;
        }
    }

    protected void resetAttempts() {
        attempt.set(0);
    }

    /**
     * Returns the backoff delay for the current attempt and advances the
     * counter. A rate limit hint longer than the backoff wins.
     */
    protected Duration nextRetryDelay(RuntimeException failure) {
        Duration delay = backoffPolicy.delay(attempt.getAndIncrement());
        if (failure instanceof RateLimitedException rateLimited
                && rateLimited.getRetryAfter().compareTo(delay) > 0) {
            return rateLimited.getRetryAfter();
        }
        return delay;
    }

    protected abstract String logPrefix();
}
