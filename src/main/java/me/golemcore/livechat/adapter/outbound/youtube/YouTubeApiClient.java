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
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.livechat.domain.exception.ChatEndedException;
import me.golemcore.livechat.domain.exception.LiveChatApiException;
import me.golemcore.livechat.domain.exception.MalformedResponseException;
import me.golemcore.livechat.domain.exception.QuotaExceededException;
import me.golemcore.livechat.domain.exception.RateLimitedException;
import me.golemcore.livechat.infrastructure.config.LiveChatProperties;
import me.golemcore.livechat.lifecycle.CancellationToken;
import me.golemcore.livechat.port.outbound.CredentialsPort;
import me.golemcore.livechat.quota.QuotaLedger;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shared HTTP executor for the YouTube Data API.
 *
 * <p>
 * Authenticates with the installed OAuth access token, or with the API key
 * when no token is installed. Each completed request is charged to the
 * {@link QuotaLedger} under its operation name. Error envelopes are mapped to:
 * <ul>
 * <li>{@link QuotaExceededException} - reason {@code quotaExceeded}</li>
 * <li>{@link RateLimitedException} - HTTP 429 or a rate limit reason, with the
 * {@code Retry-After} hint</li>
 * <li>{@link ChatEndedException} - the chat ended, was disabled or is gone</li>
 * <li>{@link LiveChatApiException} - everything else</li>
 * </ul>
 *
 * @since 1.0
 */
@Slf4j
public class YouTubeApiClient implements CredentialsPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(1);
    private static final Set<String> QUOTA_REASONS = Set.of("quotaExceeded", "dailyLimitExceeded");
    private static final Set<String> RATE_LIMIT_REASONS = Set.of("rateLimitExceeded", "userRateLimitExceeded");
    private static final Set<String> CHAT_ENDED_REASONS = Set.of("liveChatEnded", "liveChatDisabled",
            "liveChatNotFound");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final QuotaLedger quotaLedger;
    private final HttpUrl baseUrl;
    private final String apiKey;
    private final String userAgent;
    private final long maxResponseBytes;
    private final Clock clock;

    private volatile String accessToken;

    public YouTubeApiClient(OkHttpClient httpClient, ObjectMapper objectMapper, QuotaLedger quotaLedger,
            LiveChatProperties.ApiProperties api, Clock clock) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.quotaLedger = quotaLedger;
        this.baseUrl = HttpUrl.get(api.getBaseUrl());
        this.apiKey = api.getApiKey();
        this.userAgent = api.getUserAgent();
        this.maxResponseBytes = api.getMaxResponseBytes();
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    @Override
    public void installAccessToken(String token) {
        this.accessToken = token;
    }

    @Override
    public boolean hasAccessToken() {
        String token = accessToken;
        return token != null && !token.isBlank();
    }

    public QuotaLedger getQuotaLedger() {
        return quotaLedger;
    }

    public <T> T execute(ApiRequest request, Class<T> responseType) {
        return execute(request, responseType, null);
    }

    /**
     * Executes a request and decodes the JSON response. A cancelled
     * {@code token} aborts the in-flight call.
     */
    public <T> T execute(ApiRequest request, Class<T> responseType, CancellationToken token) {
        Request httpRequest = buildRequest(request);
        Call call = httpClient.newCall(httpRequest);
        Runnable unregister = token != null ? token.onCancel(call::cancel) : () -> {
        };
        try (Response response = call.execute()) {
            if (request.getOperation() != null) {
                quotaLedger.add(request.getOperation());
            }
            String body = readBody(response);
            if (!response.isSuccessful()) {
                throw toException(response.code(), body, response.header("Retry-After"));
            }
            if (responseType == Void.class || body.isBlank()) {
                return null;
            }
            return decode(body, responseType);
        } catch (IOException e) {
            throw new LiveChatApiException(request.getOperation() + " request failed: " + e.getMessage(), e);
        } finally {
            unregister.run();
        }
    }

    /**
     * Starts a URL below the API base path.
     */
    public HttpUrl.Builder url(String path) {
        return baseUrl.newBuilder().addPathSegments(path);
    }

    /**
     * Adds authentication and common headers. Falls back to the API key query
     * parameter when no access token is installed.
     */
    public Request.Builder authorizedRequest(HttpUrl.Builder url) {
        String token = accessToken;
        boolean bearer = token != null && !token.isBlank();
        if (!bearer && apiKey != null && !apiKey.isBlank()) {
            url.addQueryParameter("key", apiKey);
        }
        Request.Builder builder = new Request.Builder().url(url.build());
        if (bearer) {
            builder.header("Authorization", "Bearer " + token);
        }
        if (userAgent != null && !userAgent.isBlank()) {
            builder.header("User-Agent", userAgent);
        }
        return builder;
    }

    /**
     * Maps an error response to the matching exception type.
     */
    public RuntimeException toException(int statusCode, String body, String retryAfterHeader) {
        ErrorEnvelope envelope = parseError(body);
        String reason = null;
        String message = body == null || body.isBlank() ? "HTTP " + statusCode : truncate(body);
        if (envelope != null && envelope.getError() != null) {
            ErrorBody error = envelope.getError();
            if (error.getMessage() != null) {
                message = error.getMessage();
            }
            if (error.getErrors() != null && !error.getErrors().isEmpty()) {
                reason = error.getErrors().get(0).getReason();
            }
        }

        if (reason != null && QUOTA_REASONS.contains(reason)) {
            return new QuotaExceededException(message);
        }
        if (statusCode == 429 || (reason != null && RATE_LIMIT_REASONS.contains(reason))) {
            return new RateLimitedException(parseRetryAfter(retryAfterHeader), message);
        }
        if (reason != null && CHAT_ENDED_REASONS.contains(reason)) {
            return new ChatEndedException(null, message);
        }
        return new LiveChatApiException(statusCode, reason, message);
    }

    public <T> T decode(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("failed to decode " + type.getSimpleName() + ": "
                    + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parses a {@code Retry-After} value given in seconds or as an HTTP date.
     * Missing or unparseable values yield one second.
     */
    Duration parseRetryAfter(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_RETRY_AFTER;
        }
        String trimmed = value.trim();
        try {
            long seconds = Long.parseLong(trimmed);
            return seconds > 0 ? Duration.ofSeconds(seconds) : DEFAULT_RETRY_AFTER;
        } catch (NumberFormatException e) {
            log.trace("Retry-After is not in seconds: {}", trimmed);
        }
        try {
            ZonedDateTime at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
            Duration until = Duration.between(clock.instant(), at.toInstant());
            return until.isNegative() || until.isZero() ? DEFAULT_RETRY_AFTER : until;
        } catch (DateTimeParseException e) {
            log.debug("Unparseable Retry-After header: {}", trimmed);
            return DEFAULT_RETRY_AFTER;
        }
    }

    private Request buildRequest(ApiRequest request) {
        HttpUrl.Builder url = url(request.getPath());
        for (Map.Entry<String, String> param : request.getQuery().entrySet()) {
            if (param.getValue() != null && !param.getValue().isEmpty()) {
                url.addQueryParameter(param.getKey(), param.getValue());
            }
        }
        Request.Builder builder = authorizedRequest(url).header("Accept", "application/json");

        RequestBody body = null;
        if (request.getBody() != null) {
            try {
                body = RequestBody.create(objectMapper.writeValueAsString(request.getBody()), JSON);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Cannot serialize request body for " + request.getOperation(), e);
            }
        } else if ("POST".equals(request.getMethod()) || "PUT".equals(request.getMethod())) {
            body = RequestBody.create(new byte[0], JSON);
        }
        return builder.method(request.getMethod(), body).build();
    }

    /**
     * Reads the body as text, failing once it exceeds {@code maxResponseBytes}
     * whether or not the server declared a length.
     */
    public String readBody(Response response) throws IOException {
        ResponseBody body = response.body();
        if (body == null) {
            return "";
        }
        long length = body.contentLength();
        if (length > maxResponseBytes) {
            throw new IOException("response body too large: " + length + " bytes");
        }
        BufferedSource source = body.source();
        if (source.request(maxResponseBytes + 1)) {
            throw new IOException("response body too large: more than " + maxResponseBytes + " bytes");
        }
        MediaType contentType = body.contentType();
        Charset charset = contentType != null ? contentType.charset(StandardCharsets.UTF_8) : StandardCharsets.UTF_8;
        return source.readString(charset);
    }

    private ErrorEnvelope parseError(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(body, ErrorEnvelope.class);
        } catch (JsonProcessingException e) {
            log.debug("Error response is not a JSON envelope: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static String truncate(String text) {
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ErrorEnvelope {
        private ErrorBody error;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ErrorBody {
        private int code;
        private String message;
        private List<ErrorItem> errors;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ErrorItem {
        private String reason;
        private String domain;
        private String message;
    }
}
