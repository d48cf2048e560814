package me.golemcore.livechat;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the live chat ingestion engine.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Inbound     → LiveChatPoller, LiveChatStream (IngestionPort)
 * Domain      → ChatBotService, ChatEventClassifier, TokenRefreshScheduler
 * Outbound    → YouTubeApiClient, YouTubeModerationAdapter, token providers
 * Core        → BackoffPolicy, QuotaLedger, ResponseCache, HandlerRegistry,
 *               LifecycleController
 * </pre>
 *
 * <p>
 * Set {@code livechat.bot.enabled=true} together with
 * {@code livechat.bot.live-chat-id} or {@code livechat.bot.video-id} to start
 * ingesting on startup.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class LiveChatApplication {

    public static void main(String[] args) {
        SpringApplication.run(LiveChatApplication.class, args);
    }
}
