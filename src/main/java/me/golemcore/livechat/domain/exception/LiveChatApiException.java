package me.golemcore.livechat.domain.exception;

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

import lombok.Getter;

/**
 * Error returned by the provider API, decoded from its error envelope.
 *
 * <p>
 * A status code of {@code 0} means the request never produced an HTTP response
 * (connection refused, reset, cancelled call).
 */
@Getter
public class LiveChatApiException extends LiveChatException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final String reason;

    public LiveChatApiException(int statusCode, String reason, String message) {
        super(format(statusCode, reason, message));
        this.statusCode = statusCode;
        this.reason = reason;
    }

    public LiveChatApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.reason = null;
    }

    public boolean isNotFound() {
        return statusCode == 404 || "notFound".equals(reason);
    }

    public boolean isForbidden() {
        return statusCode == 403 || "forbidden".equals(reason);
    }

    private static String format(int statusCode, String reason, String message) {
        if (reason != null && !reason.isBlank()) {
            return "youtube api: " + reason + " (" + statusCode + "): " + message;
        }
        return "youtube api: status " + statusCode + ": " + message;
    }
}
