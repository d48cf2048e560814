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

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.Map;

/**
 * Description of one call to the provider API.
 *
 * <p>
 * {@code operation} names the quota cost entry charged for the call;
 * {@code body} is serialized as JSON when present.
 */
@Getter
@Builder
public class ApiRequest {

    @Builder.Default
    private final String method = "GET";
    private final String path;
    @Singular("param")
    private final Map<String, String> query;
    private final Object body;
    private final String operation;

    public static ApiRequestBuilder get(String path, String operation) {
        return builder().method("GET").path(path).operation(operation);
    }

    public static ApiRequestBuilder post(String path, String operation, Object body) {
        return builder().method("POST").path(path).operation(operation).body(body);
    }

    public static ApiRequestBuilder delete(String path, String operation) {
        return builder().method("DELETE").path(path).operation(operation);
    }
}
