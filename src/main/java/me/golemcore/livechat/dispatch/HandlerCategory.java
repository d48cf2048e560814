package me.golemcore.livechat.dispatch;

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

import java.util.Objects;

/**
 * Typed name of a handler category. Two categories are equal when both their
 * names and payload types are equal, so a name reused with another payload type
 * is a separate category.
 *
 * @param <T>
 *            payload type delivered to handlers of this category
 */
public final class HandlerCategory<T> {

    private final String name;
    private final Class<T> payloadType;

    private HandlerCategory(String name, Class<T> payloadType) {
        this.name = Objects.requireNonNull(name, "name");
        this.payloadType = Objects.requireNonNull(payloadType, "payloadType");
    }

    public static <T> HandlerCategory<T> of(String name, Class<T> payloadType) {
        return new HandlerCategory<>(name, payloadType);
    }

    /**
     * Category whose events carry no payload.
     */
    public static HandlerCategory<Void> signal(String name) {
        return new HandlerCategory<>(name, Void.class);
    }

    public String getName() {
        return name;
    }

    public Class<T> getPayloadType() {
        return payloadType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HandlerCategory)) {
            return false;
        }
        HandlerCategory<?> other = (HandlerCategory<?>) o;
        return name.equals(other.name) && payloadType.equals(other.payloadType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, payloadType);
    }

    @Override
    public String toString() {
        return name;
    }
}
