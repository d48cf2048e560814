package me.golemcore.livechat.adapter.outbound.youtube;

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

import me.golemcore.livechat.cache.ResponseCache;
import me.golemcore.livechat.domain.model.LiveChatBan;
import me.golemcore.livechat.domain.model.LiveChatMessage;
import me.golemcore.livechat.domain.model.LiveChatModerator;
import me.golemcore.livechat.domain.model.MessageType;
import me.golemcore.livechat.domain.model.UserBannedDetails;
import me.golemcore.livechat.port.outbound.LiveChatModerationPort;
import me.golemcore.livechat.quota.QuotaCosts;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Moderation calls against the live chat endpoints. Moderator lists are cached
 * per chat and dropped whenever a moderator is added or removed.
 */
@Slf4j
public class YouTubeModerationAdapter implements LiveChatModerationPort {

    private static final String MODERATORS_KEY_PREFIX = "moderators:";

    private final YouTubeApiClient apiClient;
    private final ResponseCache<Object> cache;

    public YouTubeModerationAdapter(YouTubeApiClient apiClient, ResponseCache<Object> cache) {
        this.apiClient = apiClient;
        this.cache = cache;
    }

    @Override
    public LiveChatMessage sendMessage(String liveChatId, String text) {
        Map<String, Object> snippet = new LinkedHashMap<>();
        snippet.put("liveChatId", liveChatId);
        snippet.put("type", MessageType.TEXT_MESSAGE.getWireValue());
        snippet.put("textMessageDetails", Map.of("messageText", text));

        ApiRequest request = ApiRequest.post("liveChat/messages", QuotaCosts.LIVE_CHAT_MESSAGES_INSERT,
                Map.of("snippet", snippet))
                .param("part", "snippet")
                .build();
        return apiClient.execute(request, LiveChatMessage.class);
    }

    @Override
    public void deleteMessage(String messageId) {
        requireId(messageId, "messageId");
        apiClient.execute(ApiRequest.delete("liveChat/messages", QuotaCosts.LIVE_CHAT_MESSAGES_DELETE)
                .param("id", messageId)
                .build(), Void.class);
    }

    @Override
    public LiveChatBan banUser(String liveChatId, String channelId) {
        return insertBan(liveChatId, channelId, UserBannedDetails.BAN_TYPE_PERMANENT, 0);
    }

    @Override
    public LiveChatBan timeoutUser(String liveChatId, String channelId, long durationSeconds) {
        if (durationSeconds <= 0) {
            throw new IllegalArgumentException("durationSeconds must be positive");
        }
        return insertBan(liveChatId, channelId, UserBannedDetails.BAN_TYPE_TEMPORARY, durationSeconds);
    }

    @Override
    public void unbanUser(String banId) {
        requireId(banId, "banId");
        apiClient.execute(ApiRequest.delete("liveChat/bans", QuotaCosts.LIVE_CHAT_BANS_DELETE)
                .param("id", banId)
                .build(), Void.class);
    }

    @Override
    public LiveChatModerator addModerator(String liveChatId, String channelId) {
        requireId(channelId, "channelId");
        Map<String, Object> snippet = new LinkedHashMap<>();
        snippet.put("liveChatId", liveChatId);
        snippet.put("moderatorDetails", Map.of("channelId", channelId));

        ApiRequest request = ApiRequest.post("liveChat/moderators", QuotaCosts.LIVE_CHAT_MODERATORS_INSERT,
                Map.of("snippet", snippet))
                .param("part", "snippet")
                .build();
        LiveChatModerator moderator = apiClient.execute(request, LiveChatModerator.class);
        cache.delete(MODERATORS_KEY_PREFIX + liveChatId);
        return moderator;
    }

    @Override
    public void removeModerator(String moderatorId) {
        requireId(moderatorId, "moderatorId");
        apiClient.execute(ApiRequest.delete("liveChat/moderators", QuotaCosts.LIVE_CHAT_MODERATORS_DELETE)
                .param("id", moderatorId)
                .build(), Void.class);
        // the moderator id does not tell which chat it belongs to
        for (String key : cache.keys()) {
            if (key.startsWith(MODERATORS_KEY_PREFIX)) {
                cache.delete(key);
            }
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<LiveChatModerator> listModerators(String liveChatId) {
        return (List<LiveChatModerator>) cache.getOrSet(MODERATORS_KEY_PREFIX + liveChatId, () -> {
            log.debug("[Moderation] Loading moderators of {}", liveChatId);
            ApiRequest request = ApiRequest.get("liveChat/moderators", QuotaCosts.LIVE_CHAT_MODERATORS_LIST)
                    .param("liveChatId", liveChatId)
                    .param("part", "snippet")
                    .param("maxResults", "50")
                    .build();
            LiveChatModerator.ListResponse response = apiClient.execute(request, LiveChatModerator.ListResponse.class);
            if (response == null || response.getItems() == null) {
                return List.of();
            }
            return List.copyOf(response.getItems());
        });
    }

    private LiveChatBan insertBan(String liveChatId, String channelId, String type, long durationSeconds) {
        requireId(channelId, "channelId");
        Map<String, Object> snippet = new LinkedHashMap<>();
        snippet.put("liveChatId", liveChatId);
        snippet.put("type", type);
        if (durationSeconds > 0) {
            snippet.put("banDurationSeconds", durationSeconds);
        }
        snippet.put("bannedUserDetails", Map.of("channelId", channelId));

        ApiRequest request = ApiRequest.post("liveChat/bans", QuotaCosts.LIVE_CHAT_BANS_INSERT,
                Map.of("snippet", snippet))
                .param("part", "snippet")
                .build();
        return apiClient.execute(request, LiveChatBan.class);
    }

    private static void requireId(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
