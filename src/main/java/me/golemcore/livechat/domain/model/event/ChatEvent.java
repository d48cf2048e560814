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

import me.golemcore.livechat.dispatch.HandlerCategory;
import me.golemcore.livechat.dispatch.HandlerRegistry;

import java.time.Instant;

/**
 * A chat item classified into one semantic category.
 *
 * <p>
 * Each variant knows its own handler category, so delivering an event is a
 * single {@link #dispatchTo(HandlerRegistry)} call.
 */
public sealed interface ChatEvent permits ChatMessageEvent, SuperChatEvent, SuperStickerEvent, MembershipEvent,
        MemberMilestoneEvent, GiftMembershipEvent, GiftMembershipReceivedEvent, MessageDeletedEvent, BanEvent {

    HandlerCategory<ChatMessageEvent> TEXT_MESSAGE = HandlerCategory.of("textMessage", ChatMessageEvent.class);
    HandlerCategory<SuperChatEvent> SUPER_CHAT = HandlerCategory.of("superChat", SuperChatEvent.class);
    HandlerCategory<SuperStickerEvent> SUPER_STICKER = HandlerCategory.of("superSticker", SuperStickerEvent.class);
    HandlerCategory<MembershipEvent> MEMBERSHIP = HandlerCategory.of("membership", MembershipEvent.class);
    HandlerCategory<MemberMilestoneEvent> MEMBER_MILESTONE = HandlerCategory.of("memberMilestone",
            MemberMilestoneEvent.class);
    HandlerCategory<GiftMembershipEvent> GIFT_MEMBERSHIP = HandlerCategory.of("giftMembership",
            GiftMembershipEvent.class);
    HandlerCategory<GiftMembershipReceivedEvent> GIFT_MEMBERSHIP_RECEIVED = HandlerCategory.of(
            "giftMembershipReceived", GiftMembershipReceivedEvent.class);
    HandlerCategory<MessageDeletedEvent> MESSAGE_DELETED = HandlerCategory.of("messageDeleted",
            MessageDeletedEvent.class);
    HandlerCategory<BanEvent> USER_BANNED = HandlerCategory.of("userBanned", BanEvent.class);

    String id();

    Instant publishedAt();

    void dispatchTo(HandlerRegistry registry);
}
