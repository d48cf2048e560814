package me.golemcore.livechat.cache;

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

/**
 * Point-in-time counts of cache entries.
 *
 * @param total
 *            entries currently stored, including expired ones not yet purged
 * @param active
 *            entries whose expiry is still in the future
 * @param expired
 *            entries past their expiry
 */
public record CacheStats(int total, int active, int expired) {
}
