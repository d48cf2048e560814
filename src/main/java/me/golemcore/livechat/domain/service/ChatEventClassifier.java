package me.golemcore.livechat.domain.service;

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

import me.golemcore.livechat.domain.model.GiftMembershipReceivedDetails;
import me.golemcore.livechat.domain.model.LiveChatMessage;
import me.golemcore.livechat.domain.model.MemberMilestoneChatDetails;
import me.golemcore.livechat.domain.model.MembershipGiftingDetails;
import me.golemcore.livechat.domain.model.MessageDeletedDetails;
import me.golemcore.livechat.domain.model.MessageSnippet;
import me.golemcore.livechat.domain.model.MessageType;
import me.golemcore.livechat.domain.model.NewSponsorDetails;
import me.golemcore.livechat.domain.model.SuperChatDetails;
import me.golemcore.livechat.domain.model.SuperStickerDetails;
import me.golemcore.livechat.domain.model.UserBannedDetails;
import me.golemcore.livechat.domain.model.event.Author;
import me.golemcore.livechat.domain.model.event.BanEvent;
import me.golemcore.livechat.domain.model.event.ChatEvent;
import me.golemcore.livechat.domain.model.event.ChatMessageEvent;
import me.golemcore.livechat.domain.model.event.GiftMembershipEvent;
import me.golemcore.livechat.domain.model.event.GiftMembershipReceivedEvent;
import me.golemcore.livechat.domain.model.event.MemberMilestoneEvent;
import me.golemcore.livechat.domain.model.event.MembershipEvent;
import me.golemcore.livechat.domain.model.event.MessageDeletedEvent;
import me.golemcore.livechat.domain.model.event.SuperChatEvent;
import me.golemcore.livechat.domain.model.event.SuperStickerEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Maps raw chat items to {@link ChatEvent} variants by their type tag.
 *
 * <p>
 * Unknown tags, tags without a semantic category (polls, chat-ended notices,
 * tombstones) and items missing the payload their tag requires yield empty.
 * Events built from the ingestion {@code delete} and {@code ban} payloads have
 * no item id or timestamp.
 */
@Component
@Slf4j
public class ChatEventClassifier {

    public Optional<ChatEvent> classify(LiveChatMessage message) {
        if (message == null || message.getSnippet() == null) {
            return Optional.empty();
        }
        Optional<MessageType> type = message.getMessageType();
        if (type.isEmpty()) {
            log.debug("[ChatBot] Dropping message {} with unknown type '{}'", message.getId(),
                    message.getSnippet().getType());
            return Optional.empty();
        }

        MessageSnippet snippet = message.getSnippet();
        Author author = Author.from(message.getAuthorDetails());
        return switch (type.get()) {
            case TEXT_MESSAGE -> text(message.getId(), author, snippet);
            case SUPER_CHAT -> superChat(message.getId(), author, snippet);
            case SUPER_STICKER -> superSticker(message.getId(), author, snippet);
            case NEW_SPONSOR -> membership(message.getId(), author, snippet);
            case MEMBER_MILESTONE_CHAT -> milestone(message.getId(), author, snippet);
            case MEMBERSHIP_GIFTING -> gift(message.getId(), author, snippet);
            case GIFT_MEMBERSHIP_RECEIVED -> giftReceived(message.getId(), author, snippet);
            case MESSAGE_DELETED -> deleted(message.getId(), snippet);
            case USER_BANNED -> banned(message.getId(), snippet.getUserBannedDetails(), snippet.getPublishedAt());
            case POLL, CHAT_ENDED, TOMBSTONE -> Optional.empty();
        };
    }

    private Optional<ChatEvent> text(String id, Author author, MessageSnippet snippet) {
        String text = snippet.getTextMessageDetails() != null
                ? snippet.getTextMessageDetails().getMessageText()
                : snippet.getDisplayMessage();
        return Optional.of(new ChatMessageEvent(id, author, text, snippet.getPublishedAt()));
    }

    private Optional<ChatEvent> superChat(String id, Author author, MessageSnippet snippet) {
        SuperChatDetails details = snippet.getSuperChatDetails();
        if (details == null) {
            return Optional.empty();
        }
        return Optional.of(new SuperChatEvent(id, author, details.getAmountMicros(), details.getCurrency(),
                details.getAmountDisplayString(), details.getUserComment(), details.getTier(),
                snippet.getPublishedAt()));
    }

    private Optional<ChatEvent> superSticker(String id, Author author, MessageSnippet snippet) {
        SuperStickerDetails details = snippet.getSuperStickerDetails();
        if (details == null) {
            return Optional.empty();
        }
        String stickerId = details.getSuperStickerId();
        String altText = null;
        if (details.getSuperStickerMetadata() != null) {
            altText = details.getSuperStickerMetadata().getAltText();
            if (stickerId == null) {
                stickerId = details.getSuperStickerMetadata().getStickerId();
            }
        }
        return Optional.of(new SuperStickerEvent(id, author, stickerId, altText, details.getAmountMicros(),
                details.getCurrency(), details.getAmountDisplayString(), details.getTier(),
                snippet.getPublishedAt()));
    }

    private Optional<ChatEvent> membership(String id, Author author, MessageSnippet snippet) {
        NewSponsorDetails details = snippet.getNewSponsorDetails();
        if (details == null) {
            return Optional.empty();
        }
        return Optional.of(new MembershipEvent(id, author, details.getMemberLevelName(), details.isUpgrade(),
                snippet.getPublishedAt()));
    }

    private Optional<ChatEvent> milestone(String id, Author author, MessageSnippet snippet) {
        MemberMilestoneChatDetails details = snippet.getMemberMilestoneChatDetails();
        if (details == null) {
            return Optional.empty();
        }
        return Optional.of(new MemberMilestoneEvent(id, author, details.getMemberLevelName(),
                details.getMemberMonth(), details.getUserComment(), snippet.getPublishedAt()));
    }

    private Optional<ChatEvent> gift(String id, Author author, MessageSnippet snippet) {
        MembershipGiftingDetails details = snippet.getMembershipGiftingDetails();
        if (details == null) {
            return Optional.empty();
        }
        return Optional.of(new GiftMembershipEvent(id, author, details.getGiftMembershipsCount(),
                details.getMemberLevelName(), snippet.getPublishedAt()));
    }

    private Optional<ChatEvent> giftReceived(String id, Author author, MessageSnippet snippet) {
        GiftMembershipReceivedDetails details = snippet.getGiftMembershipReceivedDetails();
        if (details == null) {
            return Optional.empty();
        }
        return Optional.of(new GiftMembershipReceivedEvent(id, author, details.getMemberLevelName(),
                details.getGifterChannelId(), details.getAssociatedMembershipGiftingMessageId(),
                snippet.getPublishedAt()));
    }

    /**
     * Builds a deletion event from the payload of the ingestion {@code delete}
     * category, which carries only the deleted message id.
     */
    public Optional<ChatEvent> classifyDeletion(String deletedMessageId) {
        if (deletedMessageId == null || deletedMessageId.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new MessageDeletedEvent(null, deletedMessageId, null));
    }

    /**
     * Builds a ban event from the payload of the ingestion {@code ban} category.
     */
    public Optional<ChatEvent> classifyBan(UserBannedDetails details) {
        return banned(null, details, null);
    }

    private Optional<ChatEvent> deleted(String id, MessageSnippet snippet) {
        MessageDeletedDetails details = snippet.getMessageDeletedDetails();
        if (details == null) {
            return Optional.empty();
        }
        return Optional.of(new MessageDeletedEvent(id, details.getDeletedMessageId(), snippet.getPublishedAt()));
    }

    private Optional<ChatEvent> banned(String id, UserBannedDetails details, Instant publishedAt) {
        if (details == null || details.getBannedUserDetails() == null) {
            return Optional.empty();
        }
        Duration duration = UserBannedDetails.BAN_TYPE_TEMPORARY.equals(details.getBanType())
                ? Duration.ofSeconds(details.getBanDurationSeconds())
                : Duration.ZERO;
        return Optional.of(new BanEvent(id, details.getBannedUserDetails().getChannelId(),
                details.getBannedUserDetails().getDisplayName(), details.getBanType(), duration, publishedAt));
    }
}
