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

import me.golemcore.livechat.domain.model.event.ChatEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Republishes classified chat events as Spring application events so any
 * {@code @EventListener} method can consume them.
 *
 * <p>
 * Delivery is synchronous on the ingestion worker thread. A failing listener
 * propagates to the caller, which is the chat bot's handler registry.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChatEventPublisher {

    private final ApplicationEventPublisher eventPublisher;
    private final AtomicLong published = new AtomicLong();

    public void publish(ChatEvent event) {
        log.trace("[Events] Publishing {} {}", event.getClass().getSimpleName(), event.id());
        eventPublisher.publishEvent(event);
        published.incrementAndGet();
    }

    public long getPublishedCount() {
        return published.get();
    }
}
