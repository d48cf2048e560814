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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.golemcore.livechat.adapter.outbound.auth.OAuthRefreshTokenProvider;
import me.golemcore.livechat.adapter.outbound.auth.StaticTokenProvider;
import me.golemcore.livechat.adapter.outbound.youtube.LiveChatIdResolver;
import me.golemcore.livechat.adapter.outbound.youtube.YouTubeApiClient;
import me.golemcore.livechat.adapter.outbound.youtube.YouTubeModerationAdapter;
import me.golemcore.livechat.cache.ResponseCache;
import me.golemcore.livechat.port.outbound.LiveChatModerationPort;
import me.golemcore.livechat.port.outbound.TokenProviderPort;
import me.golemcore.livechat.quota.QuotaLedger;
import me.golemcore.livechat.retry.BackoffPolicy;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Spring configuration wiring the core components.
 *
 * <p>
 * Creates the shared {@link ObjectMapper}, {@link Clock}, backoff policy,
 * quota ledger, response cache and YouTube adapters from
 * {@link LiveChatProperties}. A token provider bean exists only when
 * {@code livechat.auth.refresh-token} or {@code livechat.auth.access-token}
 * is set; otherwise requests authenticate with the API key.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final LiveChatProperties properties;

    @PostConstruct
    public void init() {
        log.info("Live chat engine configured: api={}, transport={}, quota={}/day",
                properties.getApi().getBaseUrl(),
                properties.getBot().getTransport(),
                properties.getQuota().getDailyLimit());
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BackoffPolicy backoffPolicy() {
        LiveChatProperties.BackoffProperties backoff = properties.getBackoff();
        return new BackoffPolicy(backoff.getBaseDelay(), backoff.getMaxDelay(), backoff.getMultiplier(),
                backoff.getJitter());
    }

    @Bean
    public QuotaLedger quotaLedger(Clock clock) {
        LiveChatProperties.QuotaProperties quota = properties.getQuota();
        return new QuotaLedger(quota.getDailyLimit(), ZoneId.of(quota.getResetZone()), clock);
    }

    @Bean
    public ResponseCache<Object> responseCache(Clock clock) {
        LiveChatProperties.CacheProperties cache = properties.getCache();
        return new ResponseCache<>(cache.getDefaultTtl(), cache.getMaxItems(), clock);
    }

    @Bean
    public YouTubeApiClient youTubeApiClient(OkHttpClient okHttpClient, ObjectMapper objectMapper,
            QuotaLedger quotaLedger, Clock clock) {
        return new YouTubeApiClient(okHttpClient, objectMapper, quotaLedger, properties.getApi(), clock);
    }

    @Bean
    public LiveChatModerationPort liveChatModerationPort(YouTubeApiClient apiClient,
            ResponseCache<Object> responseCache) {
        return new YouTubeModerationAdapter(apiClient, responseCache);
    }

    @Bean
    public LiveChatIdResolver liveChatIdResolver(YouTubeApiClient apiClient, ResponseCache<Object> responseCache) {
        return new LiveChatIdResolver(apiClient, responseCache);
    }

    @Bean
    @ConditionalOnExpression("'${livechat.auth.refresh-token:}' != '' or '${livechat.auth.access-token:}' != ''")
    public TokenProviderPort tokenProvider(OkHttpClient okHttpClient, ObjectMapper objectMapper, Clock clock) {
        LiveChatProperties.AuthProperties auth = properties.getAuth();
        if (auth.getRefreshToken() != null && !auth.getRefreshToken().isBlank()) {
            log.info("[Auth] Using OAuth refresh token flow");
            return new OAuthRefreshTokenProvider(okHttpClient, objectMapper, auth, clock);
        }
        log.info("[Auth] Using static access token");
        return new StaticTokenProvider(auth.getAccessToken());
    }
}
