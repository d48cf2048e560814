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

import me.golemcore.livechat.adapter.outbound.youtube.ApiRequest;
import me.golemcore.livechat.adapter.outbound.youtube.YouTubeApiClient;
import me.golemcore.livechat.dispatch.HandlerCategory;
import me.golemcore.livechat.dispatch.Subscription;
import me.golemcore.livechat.domain.exception.ChatEndedException;
import me.golemcore.livechat.domain.exception.QuotaExceededException;
import me.golemcore.livechat.domain.model.LiveChatMessage;
import me.golemcore.livechat.domain.model.LiveChatMessageListResponse;
import me.golemcore.livechat.infrastructure.config.LiveChatProperties;
import me.golemcore.livechat.lifecycle.CancellationToken;
import me.golemcore.livechat.quota.QuotaCosts;
import me.golemcore.livechat.retry.BackoffPolicy;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/**
 * Interval polling transport for {@code liveChat/messages}.
 *
 * <p>
 * Each cycle fetches one page from the current cursor, dispatches its items and
 * sleeps for the server's suggested interval clamped to
 * {@code [minInterval, maxInterval]}. Fetches are strictly sequential.
 *
 * <p>
 * Failure handling:
 * <ul>
 * <li>chat ended - error dispatched, loop exits</li>
 * <li>quota exhausted - error dispatched, next poll after the normal
 * interval</li>
 * <li>anything else - error dispatched, retry after backoff (or the server's
 * retry hint when longer)</li>
 * </ul>
 *
 * @since 1.0
 */
@Slf4j
public class LiveChatPoller extends AbstractLiveChatIngestion {

    public static final HandlerCategory<PollCompletion> POLL_COMPLETE = HandlerCategory.of("pollComplete",
            PollCompletion.class);

    private static final String PARTS = "id,snippet,authorDetails";

    private final Duration minInterval;
    private final Duration maxInterval;
    private final int maxResults;
    private final int profileImageSize;

    public LiveChatPoller(String liveChatId, YouTubeApiClient apiClient, BackoffPolicy backoffPolicy,
            LiveChatProperties.PollProperties settings) {
        super("poll", liveChatId, apiClient, backoffPolicy);
        if (settings.getMinInterval().isNegative() || settings.getMinInterval().isZero()) {
            throw new IllegalArgumentException("poll minInterval must be positive");
        }
        if (settings.getMaxInterval().compareTo(settings.getMinInterval()) < 0) {
            throw new IllegalArgumentException("poll maxInterval must be >= minInterval");
        }
        this.minInterval = settings.getMinInterval();
        this.maxInterval = settings.getMaxInterval();
        this.maxResults = settings.getMaxResults();
        this.profileImageSize = settings.getProfileImageSize();
    }

    public Subscription onPollComplete(Consumer<PollCompletion> handler) {
        return getHandlers().subscribe(POLL_COMPLETE, handler);
    }

    /**
     * Clamps a server suggested interval into the configured range.
     */
    public Duration clampInterval(long suggestedMillis) {
        Duration suggested = Duration.ofMillis(Math.max(0L, suggestedMillis));
        if (suggested.compareTo(minInterval) < 0) {
            return minInterval;
        }
        if (suggested.compareTo(maxInterval) > 0) {
            return maxInterval;
        }
        return suggested;
    }

    @Override
    protected void runSession(CancellationToken token) {
        Duration interval = minInterval;
        while (!token.isCancelled()) {
            Duration wait;
            try {
                LiveChatMessageListResponse response = fetch(token);
                if (response.isChatEnded()) {
                    throw new ChatEndedException(liveChatId, "live chat ended at " + response.getOfflineAt());
                }
                updatePageToken(response.getNextPageToken());
                interval = clampInterval(response.getPollingIntervalMillis());
                List<LiveChatMessage> items = response.getItems() != null ? response.getItems() : List.of();
                dispatchItems(items);
                resetAttempts();
                getHandlers().dispatch(POLL_COMPLETE, new PollCompletion(items.size(), interval, getPageToken()));
                log.debug("[Poller] {} items, next poll in {}ms", items.size(), interval.toMillis());
                wait = interval;
            } catch (ChatEndedException e) {
                if (!token.isCancelled()) {
                    log.info("[Poller] Live chat {} ended: {}", liveChatId, e.getMessage());
                    dispatchError(e);
                }
                return;
            } catch (QuotaExceededException e) {
                if (token.isCancelled()) {
                    return;
                }
                log.warn("[Poller] Quota exhausted: {}", e.getMessage());
                dispatchError(e);
                wait = interval;
            } catch (RuntimeException e) {
                if (token.isCancelled()) {
                    return;
                }
                wait = nextRetryDelay(e);
                log.warn("[Poller] Poll failed (attempt {}), retrying in {}ms: {}", getAttempt(), wait.toMillis(),
                        e.getMessage());
                dispatchError(e);
            }
            if (!token.sleep(wait)) {
                return;
            }
        }
    }

    private LiveChatMessageListResponse fetch(CancellationToken token) {
        apiClient.getQuotaLedger().ensureAvailable();
        ApiRequest request = ApiRequest.get("liveChat/messages", QuotaCosts.LIVE_CHAT_MESSAGES_LIST)
                .param("liveChatId", liveChatId)
                .param("part", PARTS)
                .param("maxResults", String.valueOf(maxResults))
                .param("profileImageSize", String.valueOf(profileImageSize))
                .param("pageToken", getPageToken())
                .build();
        LiveChatMessageListResponse response = apiClient.execute(request, LiveChatMessageListResponse.class, token);
        return response != null ? response : new LiveChatMessageListResponse();
    }

    @Override
    protected String logPrefix() {
        return "Poller";
    }
}
