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
import me.golemcore.livechat.dispatch.HandlerCategory;
import me.golemcore.livechat.dispatch.Subscription;
import me.golemcore.livechat.domain.exception.ChatEndedException;
import me.golemcore.livechat.domain.exception.LiveChatApiException;
import me.golemcore.livechat.domain.exception.QuotaExceededException;
import me.golemcore.livechat.domain.model.LiveChatMessageListResponse;
import me.golemcore.livechat.infrastructure.config.LiveChatProperties;
import me.golemcore.livechat.lifecycle.CancellationToken;
import me.golemcore.livechat.quota.QuotaCosts;
import me.golemcore.livechat.retry.BackoffPolicy;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/**
 * Streaming transport for {@code liveChat/messages/stream}.
 *
 * <p>
 * Each attempt holds one long-lived response open and reads it as server-sent
 * events; every event carries one page of chat items. The cursor survives
 * reconnects, so a new attempt resumes where the previous one stopped.
 *
 * <p>
 * Reconnects after a clean end of the body wait for the server's
 * {@code retry:} hint. Reconnects after a failure wait for the backoff delay.
 * Both are capped by {@code maxReconnectDelay}, which must be at least the
 * backoff cap.
 *
 * @since 1.0
 */
@Slf4j
public class LiveChatStream extends AbstractLiveChatIngestion {

    public static final HandlerCategory<LiveChatMessageListResponse> RESPONSE = HandlerCategory.of("response",
            LiveChatMessageListResponse.class);

    private final OkHttpClient streamingClient;
    private final List<String> parts;
    private final int maxResults;
    private final int profileImageSize;
    private final String language;
    private final Duration maxReconnectDelay;
    private final int maxEventBytes;
    private volatile Duration reconnectDelay;

    public LiveChatStream(String liveChatId, YouTubeApiClient apiClient, OkHttpClient streamingClient,
            BackoffPolicy backoffPolicy, LiveChatProperties.StreamProperties settings) {
        super("stream", liveChatId, apiClient, backoffPolicy);
        validate(settings, this.backoffPolicy);
        this.streamingClient = streamingClient;
        this.parts = List.copyOf(settings.getParts());
        this.maxResults = settings.getMaxResults();
        this.profileImageSize = settings.getProfileImageSize();
        this.language = settings.getLanguage();
        this.maxReconnectDelay = settings.getMaxReconnectDelay();
        this.reconnectDelay = settings.getReconnectDelay();
        this.maxEventBytes = settings.getMaxEventBytes();
    }

    public Subscription onResponse(Consumer<LiveChatMessageListResponse> handler) {
        return getHandlers().subscribe(RESPONSE, handler);
    }

    public Duration getReconnectDelay() {
        return reconnectDelay;
    }

    @Override
    protected void runSession(CancellationToken token) {
        while (!token.isCancelled()) {
            Duration wait;
            try {
                streamOnce(token);
                if (token.isCancelled()) {
                    return;
                }
                wait = cap(reconnectDelay);
                log.info("[Stream] Server closed the stream, reconnecting in {}ms", wait.toMillis());
            } catch (ChatEndedException e) {
                if (!token.isCancelled()) {
                    log.info("[Stream] Live chat {} ended: {}", liveChatId, e.getMessage());
                    dispatchError(e);
                }
                return;
            } catch (QuotaExceededException e) {
                if (token.isCancelled()) {
                    return;
                }
                log.warn("[Stream] Quota exhausted: {}", e.getMessage());
                dispatchError(e);
                wait = cap(reconnectDelay);
            } catch (RuntimeException e) {
                if (token.isCancelled()) {
                    return;
                }
                wait = cap(nextRetryDelay(e));
                log.warn("[Stream] Stream failed (attempt {}), reconnecting in {}ms: {}", getAttempt(),
                        wait.toMillis(), e.getMessage());
                dispatchError(e);
            }
            if (!token.sleep(wait)) {
                return;
            }
        }
    }

    private void streamOnce(CancellationToken token) {
        apiClient.getQuotaLedger().ensureAvailable();
        Request request = apiClient.authorizedRequest(streamUrl())
                .header("Accept", "text/event-stream")
                .header("Cache-Control", "no-cache")
                .get()
                .build();

        Call call = streamingClient.newCall(request);
        Runnable unregister = token.onCancel(call::cancel);
        try (Response response = call.execute()) {
            apiClient.getQuotaLedger().add(QuotaCosts.LIVE_CHAT_MESSAGES_STREAM);
            ResponseBody body = response.body();
            if (!response.isSuccessful()) {
                String errorBody = apiClient.readBody(response);
                throw apiClient.toException(response.code(), errorBody, response.header("Retry-After"));
            }
            if (body == null) {
                throw new LiveChatApiException(response.code(), null, "empty stream body");
            }
            log.debug("[Stream] Stream opened for {}", liveChatId);
            new ServerSentEventReader(this::handleEvent, this::handleRetry, maxEventBytes).read(body.source());
        } catch (IOException e) {
            throw new LiveChatApiException("stream connection failed: " + e.getMessage(), e);
        } finally {
            unregister.run();
        }
    }

    private void handleEvent(String data) {
        LiveChatMessageListResponse response = apiClient.decode(data, LiveChatMessageListResponse.class);
        updatePageToken(response.getNextPageToken());
        if (response.isChatEnded()) {
            throw new ChatEndedException(liveChatId, "live chat ended at " + response.getOfflineAt());
        }
        resetAttempts();
        getHandlers().dispatch(RESPONSE, response);
        dispatchItems(response.getItems());
    }

    private void handleRetry(Duration delay) {
        log.debug("[Stream] Server reconnect hint {}ms", delay.toMillis());
        reconnectDelay = delay;
    }

    private HttpUrl.Builder streamUrl() {
        HttpUrl.Builder url = apiClient.url("liveChat/messages/stream")
                .addQueryParameter("liveChatId", liveChatId)
                .addQueryParameter("part", String.join(",", parts))
                .addQueryParameter("maxResults", String.valueOf(maxResults))
                .addQueryParameter("profileImageSize", String.valueOf(profileImageSize));
        if (language != null && !language.isBlank()) {
            url.addQueryParameter("hl", language);
        }
        String pageToken = getPageToken();
        if (!pageToken.isEmpty()) {
            url.addQueryParameter("pageToken", pageToken);
        }
        return url;
    }

    private Duration cap(Duration delay) {
        return delay.compareTo(maxReconnectDelay) > 0 ? maxReconnectDelay : delay;
    }

    private static void validate(LiveChatProperties.StreamProperties settings, BackoffPolicy backoffPolicy) {
        if (settings.getParts() == null || settings.getParts().isEmpty()) {
            throw new IllegalArgumentException("stream parts must not be empty");
        }
        if (settings.getMaxResults() < 200 || settings.getMaxResults() > 2000) {
            throw new IllegalArgumentException("stream maxResults must be within [200, 2000]");
        }
        if (settings.getProfileImageSize() < 16 || settings.getProfileImageSize() > 720) {
            throw new IllegalArgumentException("stream profileImageSize must be within [16, 720]");
        }
        if (settings.getMaxEventBytes() <= 0) {
            throw new IllegalArgumentException("stream maxEventBytes must be positive");
        }
        if (settings.getReconnectDelay().isNegative()) {
            throw new IllegalArgumentException("stream reconnectDelay must be non-negative");
        }
        if (settings.getMaxReconnectDelay().compareTo(backoffPolicy.getMaxDelay()) < 0) {
            throw new IllegalArgumentException("stream maxReconnectDelay must be >= backoff maxDelay");
        }
    }

    @Override
    protected String logPrefix() {
        return "Stream";
    }
}
