package me.golemcore.livechat.infrastructure.config;

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

import me.golemcore.livechat.adapter.inbound.livechat.ChatBotFactory;
import me.golemcore.livechat.adapter.outbound.youtube.LiveChatIdResolver;
import me.golemcore.livechat.domain.service.ChatBotService;
import me.golemcore.livechat.infrastructure.event.ChatEventPublisher;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Connects a chat bot on application startup when
 * {@code livechat.bot.enabled} is true, and closes it on shutdown.
 *
 * <p>
 * The live chat id is taken from {@code livechat.bot.live-chat-id}, or
 * resolved from {@code livechat.bot.video-id}. Classified events are
 * republished on the {@link ChatEventPublisher} when
 * {@code livechat.bot.publish-events} is set.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LiveChatBotRunner {

    private final LiveChatProperties properties;
    private final ChatBotFactory chatBotFactory;
    private final LiveChatIdResolver liveChatIdResolver;
    private final ChatEventPublisher eventPublisher;

    private volatile ChatBotService bot;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        LiveChatProperties.BotProperties settings = properties.getBot();
        if (!settings.isEnabled()) {
            log.info("[ChatBot] Auto-connect disabled");
            return;
        }
        try {
            String liveChatId = resolveLiveChatId(settings);
            ChatBotService created = chatBotFactory.create(liveChatId);
            created.onConnect(() -> log.info("[ChatBot] Listening to live chat {}", liveChatId));
            created.onDisconnect(() -> log.info("[ChatBot] Stopped listening to live chat {}", liveChatId));
            created.onError(error -> log.warn("[ChatBot] {}", error.getMessage()));
            if (settings.isPublishEvents()) {
                created.onAnyEvent(eventPublisher::publish);
            }
            created.connect();
            bot = created;
        } catch (RuntimeException e) {
            log.error("[ChatBot] Failed to connect: {}", e.getMessage(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        ChatBotService current = bot;
        if (current != null) {
            log.info("[ChatBot] Shutting down");
            current.close();
            bot = null;
        }
    }

    public ChatBotService getBot() {
        return bot;
    }

    private String resolveLiveChatId(LiveChatProperties.BotProperties settings) {
        if (settings.getLiveChatId() != null && !settings.getLiveChatId().isBlank()) {
            return settings.getLiveChatId();
        }
        if (settings.getVideoId() != null && !settings.getVideoId().isBlank()) {
            return liveChatIdResolver.resolve(settings.getVideoId());
        }
        throw new IllegalStateException("livechat.bot.live-chat-id or livechat.bot.video-id is required");
    }
}
