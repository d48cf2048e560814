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

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Type tags carried in {@code snippet.type} of a live chat message.
 */
public enum MessageType {

    TEXT_MESSAGE("textMessageEvent"),
    SUPER_CHAT("superChatEvent"),
    SUPER_STICKER("superStickerEvent"),
    NEW_SPONSOR("newSponsorEvent"),
    MEMBER_MILESTONE_CHAT("memberMilestoneChatEvent"),
    MEMBERSHIP_GIFTING("membershipGiftingEvent"),
    GIFT_MEMBERSHIP_RECEIVED("giftMembershipReceivedEvent"),
    MESSAGE_DELETED("messageDeletedEvent"),
    USER_BANNED("userBannedEvent"),
    POLL("pollEvent"),
    CHAT_ENDED("chatEndedEvent"),
    TOMBSTONE("tombstone");

    private static final Map<String, MessageType> BY_WIRE_VALUE = Arrays.stream(values())
            .collect(Collectors.toMap(MessageType::getWireValue, Function.identity()));

    private final String wireValue;

    MessageType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    /**
     * Looks up a tag; unknown or missing tags yield empty.
     */
    public static Optional<MessageType> fromWireValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_WIRE_VALUE.get(value));
    }
}
