package me.golemcore.livechat.domain.model.event;

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

import me.golemcore.livechat.domain.model.AuthorDetails;

/**
 * Author snapshot attached to classified chat events.
 */
public record Author(String channelId, String displayName, String profileImageUrl,
        boolean verified, boolean owner, boolean sponsor, boolean moderator) {

    public static Author from(AuthorDetails details) {
        if (details == null) {
            return new Author(null, null, null, false, false, false, false);
        }
        return new Author(details.getChannelId(), details.getDisplayName(), details.getProfileImageUrl(),
                details.isVerified(), details.isChatOwner(), details.isChatSponsor(), details.isChatModerator());
    }
}
