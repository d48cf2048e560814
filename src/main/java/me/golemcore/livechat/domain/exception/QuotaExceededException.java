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

import java.time.Instant;

/**
 * The daily quota budget is spent. Usage resets at midnight in the quota
 * reset zone.
 */
@Getter
public class QuotaExceededException extends LiveChatException {

    private static final long serialVersionUID = 1L;

    private final int used;
    private final int limit;
    private final transient Instant resetAt;

    public QuotaExceededException(int used, int limit, Instant resetAt) {
        super("quota exceeded: " + used + "/" + limit + " units used, resets at " + resetAt);
        this.used = used;
        this.limit = limit;
        this.resetAt = resetAt;
    }

    public QuotaExceededException(String message) {
        super(message);
        this.used = -1;
        this.limit = -1;
        this.resetAt = null;
    }
}
