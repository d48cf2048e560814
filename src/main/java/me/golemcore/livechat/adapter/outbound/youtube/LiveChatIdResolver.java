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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import me.golemcore.livechat.cache.ResponseCache;
import me.golemcore.livechat.domain.exception.LiveChatApiException;
import me.golemcore.livechat.quota.QuotaCosts;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Looks up the active live chat of a broadcast video. Results are cached.
 */
@Slf4j
public class LiveChatIdResolver {

    private static final String KEY_PREFIX = "liveChatId:";

    private final YouTubeApiClient apiClient;
    private final ResponseCache<Object> cache;

    public LiveChatIdResolver(YouTubeApiClient apiClient, ResponseCache<Object> cache) {
        this.apiClient = apiClient;
        this.cache = cache;
    }

    /**
     * @throws LiveChatApiException
     *             if the video does not exist or has no active live chat
     */
    public String resolve(String videoId) {
        if (videoId == null || videoId.isBlank()) {
            throw new IllegalArgumentException("videoId must not be blank");
        }
        return (String) cache.getOrSet(KEY_PREFIX + videoId, () -> fetch(videoId));
    }

    private String fetch(String videoId) {
        ApiRequest request = ApiRequest.get("videos", QuotaCosts.VIDEOS_LIST)
                .param("part", "liveStreamingDetails")
                .param("id", videoId)
                .build();
        VideoListResponse response = apiClient.execute(request, VideoListResponse.class);
        if (response == null || response.getItems() == null || response.getItems().isEmpty()) {
            throw new LiveChatApiException(404, "videoNotFound", "video not found: " + videoId);
        }
        Video video = response.getItems().get(0);
        String liveChatId = video.getLiveStreamingDetails() != null
                ? video.getLiveStreamingDetails().getActiveLiveChatId()
                : null;
        if (liveChatId == null || liveChatId.isBlank()) {
            throw new LiveChatApiException(404, "liveChatNotActive", "video has no active live chat: " + videoId);
        }
        log.info("[Resolver] Video {} -> live chat {}", videoId, liveChatId);
        return liveChatId;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class VideoListResponse {
        private List<Video> items;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Video {
        private String id;
        private LiveStreamingDetails liveStreamingDetails;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class LiveStreamingDetails {
        private String activeLiveChatId;
        private String actualStartTime;
        private String actualEndTime;
        private Long concurrentViewers;
    }
}
