package me.golemcore.livechat.adapter.outbound.auth;

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
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.livechat.domain.exception.TokenRefreshException;
import me.golemcore.livechat.infrastructure.config.LiveChatProperties;
import me.golemcore.livechat.port.outbound.TokenProviderPort;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Exchanges a long-lived OAuth refresh token for short-lived access tokens.
 *
 * <p>
 * The current token is reused until ten seconds before it expires.
 */
@Slf4j
public class OAuthRefreshTokenProvider implements TokenProviderPort {

    private static final Duration EXPIRY_DELTA = Duration.ofSeconds(10);

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final LiveChatProperties.AuthProperties auth;
    private final Clock clock;

    private String accessToken;
    private Instant expiresAt;

    public OAuthRefreshTokenProvider(OkHttpClient httpClient, ObjectMapper objectMapper,
            LiveChatProperties.AuthProperties auth, Clock clock) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.auth = auth;
        this.clock = clock;
    }

    @Override
    public synchronized String getAccessToken() {
        if (accessToken != null && (expiresAt == null || clock.instant().isBefore(expiresAt.minus(EXPIRY_DELTA)))) {
            return accessToken;
        }
        TokenResponse token = refresh();
        accessToken = token.getAccessToken();
        expiresAt = token.getExpiresIn() > 0 ? clock.instant().plusSeconds(token.getExpiresIn()) : null;
        log.debug("[Auth] Obtained access token, expires at {}", expiresAt);
        return accessToken;
    }

    private TokenResponse refresh() {
        FormBody form = new FormBody.Builder()
                .add("grant_type", "refresh_token")
                .add("refresh_token", orEmpty(auth.getRefreshToken()))
                .add("client_id", orEmpty(auth.getClientId()))
                .add("client_secret", orEmpty(auth.getClientSecret()))
                .build();
        Request request = new Request.Builder()
                .url(auth.getTokenUrl())
                .post(form)
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                throw new TokenRefreshException("token endpoint returned " + response.code() + ": " + text);
            }
            TokenResponse token = objectMapper.readValue(text, TokenResponse.class);
            if (token.getAccessToken() == null || token.getAccessToken().isBlank()) {
                throw new TokenRefreshException("token endpoint returned no access_token");
            }
            return token;
        } catch (IOException e) {
            throw new TokenRefreshException("token refresh failed: " + e.getMessage(), e);
        }
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class TokenResponse {
        @JsonProperty("access_token")
        private String accessToken;
        @JsonProperty("token_type")
        private String tokenType;
        @JsonProperty("expires_in")
        private long expiresIn;
        private String scope;
    }
}
