package me.golemcore.livechat.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.livechat.domain.model.AuthorDetails;
import me.golemcore.livechat.domain.model.BannedUserDetails;
import me.golemcore.livechat.domain.model.LiveChatMessage;
import me.golemcore.livechat.domain.model.MessageSnippet;
import me.golemcore.livechat.domain.model.TextMessageDetails;
import me.golemcore.livechat.domain.model.UserBannedDetails;
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
import me.golemcore.livechat.infrastructure.config.AutoConfiguration;
import me.golemcore.livechat.infrastructure.config.LiveChatProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ChatEventClassifierTest {

    private static final String AUTHOR = "\"authorDetails\":{\"channelId\":\"UC1\",\"displayName\":\"Alice\","
            + "\"isVerified\":true,\"isChatOwner\":false,\"isChatSponsor\":true,\"isChatModerator\":true}";
    private static final Instant PUBLISHED = Instant.parse("2026-01-15T12:00:00Z");

    private ObjectMapper objectMapper;
    private ChatEventClassifier classifier;

    @BeforeEach
    void setUp() {
        objectMapper = new AutoConfiguration(new LiveChatProperties()).objectMapper();
        classifier = new ChatEventClassifier();
    }

    // ===== Messages =====

    @Test
    void shouldClassifyTextMessageWithAuthor() throws Exception {
        ChatEvent event = classify("textMessageEvent", "\"textMessageDetails\":{\"messageText\":\"hello\"}");

        ChatMessageEvent message = assertInstanceOf(ChatMessageEvent.class, event);
        assertEquals("m1", message.id());
        assertEquals("hello", message.text());
        assertEquals(PUBLISHED, message.publishedAt());
        assertEquals("UC1", message.author().channelId());
        assertEquals("Alice", message.author().displayName());
        assertTrue(message.author().verified());
        assertFalse(message.author().owner());
        assertTrue(message.author().sponsor());
        assertTrue(message.author().moderator());
    }

    @Test
    void shouldFallBackToDisplayMessageForText() {
        LiveChatMessage message = LiveChatMessage.builder()
                .id("m2")
                .snippet(MessageSnippet.builder().type("textMessageEvent").displayMessage("shown").build())
                .build();

        ChatMessageEvent event = assertInstanceOf(ChatMessageEvent.class, classifier.classify(message).orElseThrow());
        assertEquals("shown", event.text());
        assertNull(event.author().channelId());
    }

    @Test
    void shouldClassifySuperChat() throws Exception {
        ChatEvent event = classify("superChatEvent", "\"superChatDetails\":{\"amountMicros\":5000000,"
                + "\"currency\":\"USD\",\"amountDisplayString\":\"$5.00\",\"userComment\":\"great\",\"tier\":2}");

        SuperChatEvent superChat = assertInstanceOf(SuperChatEvent.class, event);
        assertEquals(5_000_000L, superChat.amountMicros());
        assertEquals("USD", superChat.currency());
        assertEquals("$5.00", superChat.amountDisplayString());
        assertEquals("great", superChat.comment());
        assertEquals(2, superChat.tier());
    }

    @Test
    void shouldClassifySuperStickerUsingMetadata() throws Exception {
        ChatEvent event = classify("superStickerEvent", "\"superStickerDetails\":{\"superStickerMetadata\":"
                + "{\"stickerId\":\"st-1\",\"altText\":\"waving cat\"},\"amountMicros\":2000000,"
                + "\"currency\":\"EUR\",\"amountDisplayString\":\"EUR 2.00\",\"tier\":1}");

        SuperStickerEvent sticker = assertInstanceOf(SuperStickerEvent.class, event);
        assertEquals("st-1", sticker.stickerId());
        assertEquals("waving cat", sticker.altText());
        assertEquals(2_000_000L, sticker.amountMicros());
        assertEquals("EUR", sticker.currency());
    }

    // ===== Memberships =====

    @Test
    void shouldClassifyNewMembership() throws Exception {
        ChatEvent event = classify("newSponsorEvent",
                "\"newSponsorDetails\":{\"memberLevelName\":\"Gold\",\"isUpgrade\":true}");

        MembershipEvent membership = assertInstanceOf(MembershipEvent.class, event);
        assertEquals("Gold", membership.levelName());
        assertTrue(membership.upgrade());
    }

    @Test
    void shouldClassifyMilestone() throws Exception {
        ChatEvent event = classify("memberMilestoneChatEvent", "\"memberMilestoneChatDetails\":"
                + "{\"memberLevelName\":\"Gold\",\"memberMonth\":12,\"userComment\":\"one year\"}");

        MemberMilestoneEvent milestone = assertInstanceOf(MemberMilestoneEvent.class, event);
        assertEquals(12, milestone.months());
        assertEquals("one year", milestone.comment());
    }

    @Test
    void shouldClassifyGiftsGivenAndReceived() throws Exception {
        ChatEvent given = classify("membershipGiftingEvent",
                "\"membershipGiftingDetails\":{\"giftMembershipsCount\":5,\"memberLevelName\":\"Gold\"}");
        ChatEvent received = classify("giftMembershipReceivedEvent", "\"giftMembershipReceivedDetails\":"
                + "{\"memberLevelName\":\"Gold\",\"gifterChannelId\":\"UC9\","
                + "\"associatedMembershipGiftingMessageId\":\"g1\"}");

        GiftMembershipEvent gift = assertInstanceOf(GiftMembershipEvent.class, given);
        assertEquals(5, gift.count());
        GiftMembershipReceivedEvent receipt = assertInstanceOf(GiftMembershipReceivedEvent.class, received);
        assertEquals("UC9", receipt.gifterChannelId());
        assertEquals("g1", receipt.giftingMessageId());
    }

    // ===== Moderation =====

    @Test
    void shouldClassifyDeletion() throws Exception {
        ChatEvent event = classify("messageDeletedEvent", "\"messageDeletedDetails\":{\"deletedMessageId\":\"m0\"}");

        MessageDeletedEvent deleted = assertInstanceOf(MessageDeletedEvent.class, event);
        assertEquals("m0", deleted.deletedMessageId());
    }

    @Test
    void shouldClassifyTemporaryBanWithDuration() throws Exception {
        ChatEvent event = classify("userBannedEvent", "\"userBannedDetails\":{\"bannedUserDetails\":"
                + "{\"channelId\":\"UC5\",\"displayName\":\"Troll\"},\"banType\":\"temporary\","
                + "\"banDurationSeconds\":300}");

        BanEvent ban = assertInstanceOf(BanEvent.class, event);
        assertEquals("UC5", ban.channelId());
        assertEquals("Troll", ban.displayName());
        assertEquals(Duration.ofMinutes(5), ban.duration());
    }

    @Test
    void shouldIgnoreDurationOfPermanentBan() throws Exception {
        ChatEvent event = classify("userBannedEvent", "\"userBannedDetails\":{\"bannedUserDetails\":"
                + "{\"channelId\":\"UC5\"},\"banType\":\"permanent\",\"banDurationSeconds\":300}");

        assertEquals(Duration.ZERO, assertInstanceOf(BanEvent.class, event).duration());
    }

    @Test
    void shouldBuildDeletionFromIngestionPayload() {
        MessageDeletedEvent deleted = assertInstanceOf(MessageDeletedEvent.class,
                classifier.classifyDeletion("m7").orElseThrow());

        assertEquals("m7", deleted.deletedMessageId());
        assertNull(deleted.id());
        assertTrue(classifier.classifyDeletion(" ").isEmpty());
    }

    @Test
    void shouldBuildBanFromIngestionPayload() {
        UserBannedDetails details = UserBannedDetails.builder()
                .bannedUserDetails(BannedUserDetails.builder().channelId("UC8").displayName("Spam").build())
                .banType(UserBannedDetails.BAN_TYPE_TEMPORARY)
                .banDurationSeconds(60)
                .build();

        BanEvent ban = assertInstanceOf(BanEvent.class, classifier.classifyBan(details).orElseThrow());

        assertEquals("UC8", ban.channelId());
        assertEquals(Duration.ofMinutes(1), ban.duration());
        assertTrue(classifier.classifyBan(UserBannedDetails.builder().build()).isEmpty());
        assertTrue(classifier.classifyBan(null).isEmpty());
    }

    // ===== Dropped =====

    @Test
    void shouldDropUnknownAndNonDispatchedTypes() throws Exception {
        assertTrue(classifyOptional("someFutureEvent", "\"displayMessage\":\"x\"").isEmpty());
        assertTrue(classifyOptional("pollEvent", "\"displayMessage\":\"x\"").isEmpty());
        assertTrue(classifyOptional("chatEndedEvent", "\"displayMessage\":\"x\"").isEmpty());
        assertTrue(classifyOptional("tombstone", "\"displayMessage\":\"x\"").isEmpty());
    }

    @Test
    void shouldDropMessagesMissingDetails() throws Exception {
        assertTrue(classifyOptional("superChatEvent", "\"displayMessage\":\"x\"").isEmpty());
        assertTrue(classifyOptional("userBannedEvent", "\"userBannedDetails\":{\"banType\":\"permanent\"}")
                .isEmpty());
    }

    @Test
    void shouldDropMessagesWithoutSnippet() {
        assertTrue(classifier.classify(null).isEmpty());
        assertTrue(classifier.classify(LiveChatMessage.builder().id("m").build()).isEmpty());
        assertTrue(classifier.classify(LiveChatMessage.builder()
                .snippet(MessageSnippet.builder().textMessageDetails(new TextMessageDetails("x")).build())
                .authorDetails(new AuthorDetails())
                .build()).isEmpty());
    }

    private ChatEvent classify(String type, String details) throws Exception {
        return classifyOptional(type, details).orElseThrow();
    }

    private Optional<ChatEvent> classifyOptional(String type, String details) throws Exception {
        String json = "{\"id\":\"m1\",\"snippet\":{\"type\":\"" + type + "\",\"publishedAt\":\""
                + PUBLISHED + "\"," + details + "}," + AUTHOR + "}";
        return classifier.classify(objectMapper.readValue(json, LiveChatMessage.class));
    }
}
