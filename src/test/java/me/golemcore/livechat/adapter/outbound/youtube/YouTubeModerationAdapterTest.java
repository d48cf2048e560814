package me.golemcore.livechat.adapter.outbound.youtube;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.livechat.cache.ResponseCache;
import me.golemcore.livechat.domain.model.LiveChatBan;
import me.golemcore.livechat.domain.model.LiveChatMessage;
import me.golemcore.livechat.domain.model.LiveChatModerator;
import me.golemcore.livechat.infrastructure.config.AutoConfiguration;
import me.golemcore.livechat.infrastructure.config.LiveChatProperties;
import me.golemcore.livechat.quota.QuotaLedger;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class YouTubeModerationAdapterTest {

    private static final String CHAT_ID = "chat-1";
    private static final String CONTENT_TYPE = "Content-Type";
    private static final String APPLICATION_JSON = "application/json";
    private static final String MODERATORS = "{\"items\":[{\"id\":\"mod-1\",\"snippet\":{\"liveChatId\":\"chat-1\","
            + "\"moderatorDetails\":{\"channelId\":\"UC3\",\"displayName\":\"Mod\"}}}]}";

    private MockWebServer mockServer;
    private ObjectMapper objectMapper;
    private QuotaLedger quotaLedger;
    private ResponseCache<Object> cache;
    private YouTubeModerationAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();

        LiveChatProperties properties = new LiveChatProperties();
        properties.getApi().setBaseUrl(mockServer.url("/youtube/v3").toString());
        objectMapper = new AutoConfiguration(properties).objectMapper();
        quotaLedger = new QuotaLedger(10_000, ZoneOffset.UTC, Clock.systemUTC());
        cache = new ResponseCache<>(Duration.ofMinutes(5), 100, Clock.systemUTC());
        YouTubeApiClient apiClient = new YouTubeApiClient(new OkHttpClient(), objectMapper, quotaLedger,
                properties.getApi(), Clock.systemUTC());
        apiClient.installAccessToken("token-1");
        adapter = new YouTubeModerationAdapter(apiClient, cache);
    }

    @AfterEach
    void tearDown() throws IOException {
        mockServer.shutdown();
    }

    // ===== Messages =====

    @Test
    void shouldInsertTextMessage() throws Exception {
        mockServer.enqueue(json("{\"id\":\"m9\",\"snippet\":{\"type\":\"textMessageEvent\"}}"));

        LiveChatMessage sent = adapter.sendMessage(CHAT_ID, "welcome");

        assertEquals("m9", sent.getId());
        RecordedRequest request = mockServer.takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/youtube/v3/liveChat/messages", request.getRequestUrl().encodedPath());
        assertEquals("snippet", request.getRequestUrl().queryParameter("part"));
        JsonNode snippet = objectMapper.readTree(request.getBody().readUtf8()).get("snippet");
        assertEquals(CHAT_ID, snippet.get("liveChatId").asText());
        assertEquals("textMessageEvent", snippet.get("type").asText());
        assertEquals("welcome", snippet.get("textMessageDetails").get("messageText").asText());
        assertEquals(50, quotaLedger.getUsed());
    }

    @Test
    void shouldDeleteMessageById() throws Exception {
        mockServer.enqueue(new MockResponse().setResponseCode(204));

        adapter.deleteMessage("m1");

        RecordedRequest request = mockServer.takeRequest();
        assertEquals("DELETE", request.getMethod());
        assertEquals("m1", request.getRequestUrl().queryParameter("id"));
    }

    @Test
    void shouldRejectBlankIds() {
        assertThrows(IllegalArgumentException.class, () -> adapter.deleteMessage(" "));
        assertThrows(IllegalArgumentException.class, () -> adapter.banUser(CHAT_ID, null));
        assertThrows(IllegalArgumentException.class, () -> adapter.timeoutUser(CHAT_ID, "UC1", 0));
        assertEquals(0, mockServer.getRequestCount());
    }

    // ===== Bans =====

    @Test
    void shouldBanPermanently() throws Exception {
        mockServer.enqueue(json("{\"id\":\"ban-1\",\"snippet\":{\"type\":\"permanent\"}}"));

        LiveChatBan ban = adapter.banUser(CHAT_ID, "UC1");

        assertEquals("ban-1", ban.getId());
        JsonNode snippet = objectMapper.readTree(mockServer.takeRequest().getBody().readUtf8()).get("snippet");
        assertEquals("permanent", snippet.get("type").asText());
        assertFalse(snippet.has("banDurationSeconds"));
        assertEquals("UC1", snippet.get("bannedUserDetails").get("channelId").asText());
    }

    @Test
    void shouldBanTemporarilyWithDuration() throws Exception {
        mockServer.enqueue(json("{\"id\":\"ban-2\",\"snippet\":{\"type\":\"temporary\",\"banDurationSeconds\":300}}"));

        LiveChatBan ban = adapter.timeoutUser(CHAT_ID, "UC1", 300);

        assertEquals(300L, ban.getSnippet().getBanDurationSeconds());
        RecordedRequest request = mockServer.takeRequest();
        assertEquals("/youtube/v3/liveChat/bans", request.getRequestUrl().encodedPath());
        JsonNode snippet = objectMapper.readTree(request.getBody().readUtf8()).get("snippet");
        assertEquals("temporary", snippet.get("type").asText());
        assertEquals(300, snippet.get("banDurationSeconds").asLong());
    }

    @Test
    void shouldUnbanById() throws Exception {
        mockServer.enqueue(new MockResponse().setResponseCode(204));

        adapter.unbanUser("ban-1");

        RecordedRequest request = mockServer.takeRequest();
        assertEquals("DELETE", request.getMethod());
        assertEquals("/youtube/v3/liveChat/bans", request.getRequestUrl().encodedPath());
        assertEquals("ban-1", request.getRequestUrl().queryParameter("id"));
    }

    // ===== Moderators =====

    @Test
    void shouldCacheModeratorList() {
        mockServer.enqueue(json(MODERATORS));

        List<LiveChatModerator> first = adapter.listModerators(CHAT_ID);
        List<LiveChatModerator> second = adapter.listModerators(CHAT_ID);

        assertEquals(1, first.size());
        assertEquals("UC3", first.get(0).getSnippet().getModeratorDetails().getChannelId());
        assertSame(first, second);
        assertEquals(1, mockServer.getRequestCount());
    }

    @Test
    void shouldInvalidateModeratorCacheOnAdd() throws Exception {
        mockServer.enqueue(json(MODERATORS));
        mockServer.enqueue(json("{\"id\":\"mod-2\"}"));
        mockServer.enqueue(json(MODERATORS));

        adapter.listModerators(CHAT_ID);
        LiveChatModerator added = adapter.addModerator(CHAT_ID, "UC4");
        adapter.listModerators(CHAT_ID);

        assertEquals("mod-2", added.getId());
        assertEquals(3, mockServer.getRequestCount());
        mockServer.takeRequest();
        JsonNode snippet = objectMapper.readTree(mockServer.takeRequest().getBody().readUtf8()).get("snippet");
        assertEquals("UC4", snippet.get("moderatorDetails").get("channelId").asText());
    }

    @Test
    void shouldInvalidateAllModeratorListsOnRemove() {
        mockServer.enqueue(json(MODERATORS));
        mockServer.enqueue(json(MODERATORS));
        mockServer.enqueue(new MockResponse().setResponseCode(204));
        cache.set("liveChatId:video-1", CHAT_ID);

        adapter.listModerators(CHAT_ID);
        adapter.listModerators("chat-2");
        adapter.removeModerator("mod-1");

        assertFalse(cache.get("moderators:" + CHAT_ID).isPresent());
        assertFalse(cache.get("moderators:chat-2").isPresent());
        assertTrue(cache.get("liveChatId:video-1").isPresent());
    }

    @Test
    void shouldNotCacheFailedModeratorLookup() {
        mockServer.enqueue(new MockResponse().setResponseCode(500));
        mockServer.enqueue(json(MODERATORS));

        assertThrows(RuntimeException.class, () -> adapter.listModerators(CHAT_ID));
        assertEquals(1, adapter.listModerators(CHAT_ID).size());
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader(CONTENT_TYPE, APPLICATION_JSON).setBody(body);
    }
}
