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
import me.golemcore.livechat.domain.service.ChatBotService;
import me.golemcore.livechat.domain.service.ChatEventClassifier;
import me.golemcore.livechat.infrastructure.config.LiveChatProperties;
import me.golemcore.livechat.infrastructure.http.OkHttpConfig;
import me.golemcore.livechat.port.inbound.IngestionPort;
import me.golemcore.livechat.port.outbound.LiveChatModerationPort;
import me.golemcore.livechat.port.outbound.TokenProviderPort;
import me.golemcore.livechat.retry.BackoffPolicy;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Builds chat bots for a live chat with the configured transport.
 */
@Component
public class ChatBotFactory {

    private final YouTubeApiClient apiClient;
    private final OkHttpClient streamingClient;
    private final BackoffPolicy backoffPolicy;
    private final LiveChatModerationPort moderation;
    private final ChatEventClassifier classifier;
    private final ObjectProvider<TokenProviderPort> tokenProvider;
    private final LiveChatProperties properties;

    public ChatBotFactory(YouTubeApiClient apiClient,
            @Qualifier(OkHttpConfig.STREAMING_CLIENT) OkHttpClient streamingClient,
            BackoffPolicy backoffPolicy,
            LiveChatModerationPort moderation,
            ChatEventClassifier classifier,
            ObjectProvider<TokenProviderPort> tokenProvider,
            LiveChatProperties properties) {
        this.apiClient = apiClient;
        this.streamingClient = streamingClient;
        this.backoffPolicy = backoffPolicy;
        this.moderation = moderation;
        this.classifier = classifier;
        this.tokenProvider = tokenProvider;
        this.properties = properties;
    }

    public ChatBotService create(String liveChatId) {
        return create(liveChatId, properties.getBot().getTransport());
    }

    public ChatBotService create(String liveChatId, LiveChatProperties.Transport transport) {
        IngestionPort ingestion = createIngestion(liveChatId, transport);
        return new ChatBotService(ingestion, moderation, classifier, tokenProvider.getIfAvailable(), apiClient,
                properties.getBot().getTokenRefreshInterval());
    }

    public IngestionPort createIngestion(String liveChatId, LiveChatProperties.Transport transport) {
        return switch (transport) {
            case POLL -> new LiveChatPoller(liveChatId, apiClient, backoffPolicy, properties.getPoll());
            case STREAM -> new LiveChatStream(liveChatId, apiClient, streamingClient, backoffPolicy,
                    properties.getStream());
        };
    }
}
