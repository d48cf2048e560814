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

import java.util.Map;

/**
 * Static quota unit costs per provider operation.
 *
 * <p>
 * Operations that are not listed cost one unit.
 */
public final class QuotaCosts {

    public static final int DEFAULT_DAILY_QUOTA = 10_000;
    public static final int DEFAULT_COST = 1;

    public static final String LIVE_CHAT_MESSAGES_LIST = "liveChatMessages.list";
    public static final String LIVE_CHAT_MESSAGES_INSERT = "liveChatMessages.insert";
    public static final String LIVE_CHAT_MESSAGES_DELETE = "liveChatMessages.delete";
    public static final String LIVE_CHAT_MESSAGES_STREAM = "liveChatMessages.streamList";
    public static final String LIVE_CHAT_BANS_INSERT = "liveChatBans.insert";
    public static final String LIVE_CHAT_BANS_DELETE = "liveChatBans.delete";
    public static final String LIVE_CHAT_MODERATORS_LIST = "liveChatModerators.list";
    public static final String LIVE_CHAT_MODERATORS_INSERT = "liveChatModerators.insert";
    public static final String LIVE_CHAT_MODERATORS_DELETE = "liveChatModerators.delete";
    public static final String VIDEOS_LIST = "videos.list";

    private static final Map<String, Integer> COSTS = Map.ofEntries(
            Map.entry(LIVE_CHAT_MESSAGES_LIST, 5),
            Map.entry(LIVE_CHAT_MESSAGES_INSERT, 50),
            Map.entry(LIVE_CHAT_MESSAGES_DELETE, 50),
            Map.entry(LIVE_CHAT_BANS_INSERT, 50),
            Map.entry(LIVE_CHAT_BANS_DELETE, 50),
            Map.entry(LIVE_CHAT_MODERATORS_LIST, 50),
            Map.entry(LIVE_CHAT_MODERATORS_INSERT, 50),
            Map.entry(LIVE_CHAT_MODERATORS_DELETE, 50),
            Map.entry(VIDEOS_LIST, 1),
            Map.entry("videos.insert", 1600),
            Map.entry("videos.update", 50),
            Map.entry("videos.delete", 50),
            Map.entry("channels.list", 1),
            Map.entry("search.list", 100),
            Map.entry("playlists.list", 1),
            Map.entry("playlistItems.list", 1),
            Map.entry("commentThreads.list", 1),
            Map.entry("comments.insert", 50),
            Map.entry("subscriptions.list", 1),
            Map.entry("liveBroadcasts.list", 1),
            Map.entry("liveBroadcasts.insert", 50),
            Map.entry("liveBroadcasts.transition", 50),
            Map.entry("liveStreams.list", 1));

    private QuotaCosts() {
    }

    public static int costOf(String operation) {
        if (operation == null) {
            return DEFAULT_COST;
        }
        return COSTS.getOrDefault(operation, DEFAULT_COST);
    }

    /**
     * Sums the cost of a planned batch of calls keyed by operation name.
     */
    public static int estimate(Map<String, Integer> operationCounts) {
        int total = 0;
        for (Map.Entry<String, Integer> entry : operationCounts.entrySet()) {
            total += costOf(entry.getKey()) * entry.getValue();
        }
        return total;
    }
}
