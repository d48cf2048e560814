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

import me.golemcore.livechat.domain.exception.TokenRefreshException;
import me.golemcore.livechat.port.outbound.TokenProviderPort;

/**
 * Returns the same pre-issued access token every time.
 */
public class StaticTokenProvider implements TokenProviderPort {

    private final String accessToken;

    public StaticTokenProvider(String accessToken) {
        this.accessToken = accessToken;
    }

    @Override
    public String getAccessToken() {
        if (accessToken == null || accessToken.isBlank()) {
            throw new TokenRefreshException("no access token configured");
        }
        return accessToken;
    }
}
