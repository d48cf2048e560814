package me.golemcore.livechat.port.outbound;

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

import me.golemcore.livechat.domain.model.LiveChatBan;
import me.golemcore.livechat.domain.model.LiveChatMessage;
import me.golemcore.livechat.domain.model.LiveChatModerator;

import java.util.List;

/**
 * Moderation actions against a live chat. All calls are blocking and throw
 * {@link me.golemcore.livechat.domain.exception.LiveChatException} subtypes on
 * failure.
 */
public interface LiveChatModerationPort {

    LiveChatMessage sendMessage(String liveChatId, String text);

    void deleteMessage(String messageId);

    LiveChatBan banUser(String liveChatId, String channelId);

    LiveChatBan timeoutUser(String liveChatId, String channelId, long durationSeconds);

    void unbanUser(String banId);

    LiveChatModerator addModerator(String liveChatId, String channelId);

    void removeModerator(String moderatorId);

    List<LiveChatModerator> listModerators(String liveChatId);
}
