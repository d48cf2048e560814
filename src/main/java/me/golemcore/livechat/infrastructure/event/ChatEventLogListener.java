package me.golemcore.livechat.infrastructure.event;

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

import me.golemcore.livechat.domain.model.event.BanEvent;
import me.golemcore.livechat.domain.model.event.ChatEvent;
import me.golemcore.livechat.domain.model.event.ChatMessageEvent;
import me.golemcore.livechat.domain.model.event.SuperChatEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Logs chat events published on the application event bus.
 */
@Component
@Slf4j
public class ChatEventLogListener {

    @EventListener
    public void onChatEvent(ChatEvent event) {
        if (event instanceof ChatMessageEvent message) {
            log.info("[Chat] {}: {}", message.author().displayName(), message.text());
        } else if (event instanceof SuperChatEvent superChat) {
            log.info("[Chat] Super Chat {} from {}: {}", superChat.amountDisplayString(),
                    superChat.author().displayName(), superChat.comment());
        } else if (event instanceof BanEvent ban) {
            log.info("[Chat] {} banned ({})", ban.displayName(), ban.banType());
        } else {
            log.info("[Chat] {}", event);
        }
    }
}
