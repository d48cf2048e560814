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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for the live chat engine, bound from {@code livechat.*}.
 *
 * <p>
 * Nested sections:
 * <ul>
 * <li>{@link ApiProperties} - provider endpoint and API key</li>
 * <li>{@link HttpProperties} - HTTP client timeouts and pooling</li>
 * <li>{@link PollProperties} - interval polling transport</li>
 * <li>{@link StreamProperties} - streaming transport</li>
 * <li>{@link BackoffProperties} - retry delays</li>
 * <li>{@link QuotaProperties} - daily quota budget</li>
 * <li>{@link CacheProperties} - response cache</li>
 * <li>{@link AuthProperties} - access token source</li>
 * <li>{@link BotProperties} - auto-connect settings</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "livechat")
@Data
public class LiveChatProperties {

    private ApiProperties api = new ApiProperties();
    private HttpProperties http = new HttpProperties();
    private PollProperties poll = new PollProperties();
    private StreamProperties stream = new StreamProperties();
    private BackoffProperties backoff = new BackoffProperties();
    private QuotaProperties quota = new QuotaProperties();
    private CacheProperties cache = new CacheProperties();
    private AuthProperties auth = new AuthProperties();
    private BotProperties bot = new BotProperties();

    @Data
    public static class ApiProperties {
        private String baseUrl = "https://www.googleapis.com/youtube/v3";
        private String apiKey;
        private String userAgent = "golemcore-livechat/1.0";
        private long maxResponseBytes = 10L * 1024 * 1024;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 30000;
        private long writeTimeout = 30000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class PollProperties {
        private Duration minInterval = Duration.ofSeconds(1);
        private Duration maxInterval = Duration.ofSeconds(30);
        private int maxResults = 500;
        private int profileImageSize = 88;
    }

    @Data
    public static class StreamProperties {
        private List<String> parts = new ArrayList<>(List.of("id", "snippet", "authorDetails"));
        private int maxResults = 500;
        private int profileImageSize = 88;
        private String language;
        private Duration reconnectDelay = Duration.ofSeconds(1);
        private Duration maxReconnectDelay = Duration.ofSeconds(30);
        private int maxEventBytes = 1024 * 1024;
    }

    @Data
    public static class BackoffProperties {
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double multiplier = 2.0;
        private double jitter = 0.1;
    }

    @Data
    public static class QuotaProperties {
        private int dailyLimit = 10000;
        private String resetZone = "America/Los_Angeles";
        private double warnThreshold = 0.8;
    }

    @Data
    public static class CacheProperties {
        private Duration defaultTtl = Duration.ofMinutes(5);
        private int maxItems = 1000;
        private Duration cleanupInterval = Duration.ofMinutes(1);
    }

    @Data
    public static class AuthProperties {
        private String accessToken;
        private String clientId;
        private String clientSecret;
        private String refreshToken;
        private String tokenUrl = "https://oauth2.googleapis.com/token";
    }

    @Data
    public static class BotProperties {
        private boolean enabled = false;
        private String liveChatId;
        private String videoId;
        private Transport transport = Transport.POLL;
        private Duration tokenRefreshInterval = Duration.ofMinutes(45);
        private boolean publishEvents = true;
    }

    public enum Transport {
        POLL, STREAM
    }
}
