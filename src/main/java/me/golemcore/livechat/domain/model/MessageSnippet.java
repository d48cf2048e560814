package me.golemcore.livechat.domain.model;

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
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Core content of a live chat message.
 *
 * <p>
 * {@code type} holds the raw wire tag. Exactly one of the detail fields is set,
 * and which one follows from the tag; messages of type {@code chatEndedEvent}
 * or {@code tombstone} carry none.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MessageSnippet {

    private String type;
    private String liveChatId;
    private String authorChannelId;
    private Instant publishedAt;
    private boolean hasDisplayContent;
    private String displayMessage;
    private TextMessageDetails textMessageDetails;
    private SuperChatDetails superChatDetails;
    private SuperStickerDetails superStickerDetails;
    private MemberMilestoneChatDetails memberMilestoneChatDetails;
    private NewSponsorDetails newSponsorDetails;
    private MembershipGiftingDetails membershipGiftingDetails;
    private GiftMembershipReceivedDetails giftMembershipReceivedDetails;
    private MessageDeletedDetails messageDeletedDetails;
    private UserBannedDetails userBannedDetails;
    private PollDetails pollDetails;
}
