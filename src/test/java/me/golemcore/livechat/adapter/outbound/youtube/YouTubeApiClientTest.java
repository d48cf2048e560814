package me.golemcore.livechat.adapter.outbound.youtube;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.livechat.domain.exception.ChatEndedException;
import me.golemcore.livechat.domain.exception.LiveChatApiException;
import me.golemcore.livechat.domain.exception.MalformedResponseException;
import me.golemcore.livechat.domain.exception.QuotaExceededException;
import me.golemcore.livechat.domain.exception.RateLimitedException;
import me.golemcore.livechat.domain.model.LiveChatMessageListResponse;
import me.golemcore.livechat.infrastructure.config.AutoConfiguration;
import me.golemcore.livechat.infrastructure.config.LiveChatProperties;
import me.golemcore.livechat.quota.QuotaCosts;
import me.golemcore.livechat.quota.QuotaLedger;
import me.golemcore.livechat.testsupport.MutableClock;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class YouTubeApiClientTest {

    private static final String CONTENT_TYPE = "Content-Type";
    private static final String APPLICATION_JSON = "application/json";
    private static final Instant NOW = Instant.parse("2026-01-15T12:00:00Z");

    private MockWebServer mockServer;
    private QuotaLedger quotaLedger;
    private YouTubeApiClient client;

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();

        LiveChatProperties properties = new LiveChatProperties();
        properties.getApi().setBaseUrl(mockServer.url("/youtube/v3").toString());
        properties.getApi().setApiKey("test-key");
        ObjectMapper objectMapper = new AutoConfiguration(properties).objectMapper();
        MutableClock clock = new MutableClock(NOW);
        quotaLedger = new QuotaLedger(QuotaCosts.DEFAULT_DAILY_QUOTA, ZoneOffset.UTC, clock);
        client = new YouTubeApiClient(new OkHttpClient(), objectMapper, quotaLedger, properties.getApi(), clock);
    }

    @AfterEach
    void tearDown() throws IOException {
        mockServer.shutdown();
    }

    // ===== Authentication =====

    @Test
    void shouldUseApiKeyWithoutAccessToken() throws Exception {
        mockServer.enqueue(json("{\"items\":[]}"));

        client.execute(listRequest(), LiveChatMessageListResponse.class);

        RecordedRequest request = mockServer.takeRequest();
        assertEquals("test-key", request.getRequestUrl().queryParameter("key"));
        assertNull(request.getHeader("Authorization"));
        assertFalse(client.hasAccessToken());
    }

    @Test
    void shouldUseBearerTokenWhenInstalled() throws Exception {
        mockServer.enqueue(json("{\"items\":[]}"));
        client.installAccessToken("token-1");

        client.execute(listRequest(), LiveChatMessageListResponse.class);

        RecordedRequest request = mockServer.takeRequest();
        assertEquals("Bearer token-1", request.getHeader("Authorization"));
        assertNull(request.getRequestUrl().queryParameter("key"));
        assertTrue(client.hasAccessToken());
    }

    // ===== Requests =====

    @Test
    void shouldBuildPathAndQueryAndChargeQuota() throws Exception {
        mockServer.enqueue(json("{\"nextPageToken\":\"p2\",\"pollingIntervalMillis\":5000,"
                + "\"items\":[{\"id\":\"m1\",\"snippet\":{\"type\":\"textMessageEvent\"}}]}"));

        LiveChatMessageListResponse response = client.execute(listRequest(), LiveChatMessageListResponse.class);

        assertEquals("p2", response.getNextPageToken());
        assertEquals(5000, response.getPollingIntervalMillis());
        assertEquals(1, response.getItems().size());
        assertEquals(5, quotaLedger.getUsed());

        RecordedRequest request = mockServer.takeRequest();
        assertEquals("GET", request.getMethod());
        assertEquals("/youtube/v3/liveChat/messages", request.getRequestUrl().encodedPath());
        assertEquals("chat-1", request.getRequestUrl().queryParameter("liveChatId"));
        assertNull(request.getRequestUrl().queryParameter("pageToken"));
    }

    @Test
    void shouldSerializePostBody() throws Exception {
        mockServer.enqueue(json("{}"));

        client.execute(ApiRequest.post("liveChat/messages", QuotaCosts.LIVE_CHAT_MESSAGES_INSERT,
                Map.of("snippet", Map.of("liveChatId", "chat-1"))).param("part", "snippet").build(), Void.class);

        RecordedRequest request = mockServer.takeRequest();
        assertEquals("POST", request.getMethod());
        assertTrue(request.getBody().readUtf8().contains("\"liveChatId\":\"chat-1\""));
        assertEquals(50, quotaLedger.getUsed());
    }

    @Test
    void shouldReturnNullForEmptyBody() {
        mockServer.enqueue(new MockResponse().setResponseCode(204));

        Object result = client.execute(ApiRequest.delete("liveChat/messages", QuotaCosts.LIVE_CHAT_MESSAGES_DELETE)
                .param("id", "m1").build(), Object.class);

        assertNull(result);
    }

    // ===== Error mapping =====

    @Test
    void shouldMapQuotaExceeded() {
        mockServer.enqueue(error(403, "quotaExceeded", "The request cannot be completed"));

        assertThrows(QuotaExceededException.class,
                () -> client.execute(listRequest(), LiveChatMessageListResponse.class));
    }

    @Test
    void shouldMapTooManyRequestsWithRetryAfter() {
        mockServer.enqueue(new MockResponse().setResponseCode(429).setHeader("Retry-After", "7"));

        RateLimitedException error = assertThrows(RateLimitedException.class,
                () -> client.execute(listRequest(), LiveChatMessageListResponse.class));
        assertEquals(Duration.ofSeconds(7), error.getRetryAfter());
    }

    @Test
    void shouldMapRateLimitReason() {
        mockServer.enqueue(error(403, "rateLimitExceeded", "slow down"));

        RateLimitedException error = assertThrows(RateLimitedException.class,
                () -> client.execute(listRequest(), LiveChatMessageListResponse.class));
        assertEquals(Duration.ofSeconds(1), error.getRetryAfter());
    }

    @Test
    void shouldMapChatEnded() {
        mockServer.enqueue(error(403, "liveChatEnded", "The live chat is no longer live."));

        assertThrows(ChatEndedException.class,
                () -> client.execute(listRequest(), LiveChatMessageListResponse.class));
    }

    @Test
    void shouldMapOtherErrorsWithReason() {
        mockServer.enqueue(error(404, "notFound", "missing"));

        LiveChatApiException error = assertThrows(LiveChatApiException.class,
                () -> client.execute(listRequest(), LiveChatMessageListResponse.class));
        assertEquals(404, error.getStatusCode());
        assertEquals("notFound", error.getReason());
        assertTrue(error.isNotFound());
    }

    @Test
    void shouldMapNonJsonErrorBody() {
        mockServer.enqueue(new MockResponse().setResponseCode(502).setBody("Bad Gateway"));

        LiveChatApiException error = assertThrows(LiveChatApiException.class,
                () -> client.execute(listRequest(), LiveChatMessageListResponse.class));
        assertEquals(502, error.getStatusCode());
        assertNull(error.getReason());
    }

    @Test
    void shouldRaiseMalformedResponseForInvalidJson() {
        mockServer.enqueue(json("{not json"));

        assertThrows(MalformedResponseException.class,
                () -> client.execute(listRequest(), LiveChatMessageListResponse.class));
    }

    @Test
    void shouldWrapTransportFailures() throws IOException {
        MockWebServer closed = new MockWebServer();
        closed.start();
        LiveChatProperties properties = new LiveChatProperties();
        properties.getApi().setBaseUrl(closed.url("/youtube/v3").toString());
        closed.shutdown();
        YouTubeApiClient unreachable = new YouTubeApiClient(new OkHttpClient(),
                new AutoConfiguration(properties).objectMapper(), quotaLedger, properties.getApi(), null);

        LiveChatApiException error = assertThrows(LiveChatApiException.class,
                () -> unreachable.execute(listRequest(), LiveChatMessageListResponse.class));
        assertEquals(0, error.getStatusCode());
        assertNotNull(error.getCause());
    }

    // ===== Body size =====

    @Test
    void shouldRejectChunkedBodyLargerThanLimit() {
        mockServer.enqueue(new MockResponse().setHeader(CONTENT_TYPE, APPLICATION_JSON)
                .setChunkedBody("{\"nextPageToken\":\"" + "t".repeat(5000) + "\"}", 256));

        LiveChatApiException error = assertThrows(LiveChatApiException.class,
                () -> limitedClient(64).execute(listRequest(), LiveChatMessageListResponse.class));
        assertInstanceOf(IOException.class, error.getCause());
        assertTrue(error.getMessage().contains("too large"));
    }

    @Test
    void shouldRejectDeclaredLengthLargerThanLimit() {
        mockServer.enqueue(json("{\"nextPageToken\":\"" + "t".repeat(200) + "\"}"));

        assertThrows(LiveChatApiException.class,
                () -> limitedClient(64).execute(listRequest(), LiveChatMessageListResponse.class));
    }

    @Test
    void shouldAcceptChunkedBodyWithinLimit() {
        mockServer.enqueue(new MockResponse().setHeader(CONTENT_TYPE, APPLICATION_JSON)
                .setChunkedBody("{\"nextPageToken\":\"p9\"}", 4));

        LiveChatMessageListResponse response = limitedClient(64).execute(listRequest(),
                LiveChatMessageListResponse.class);

        assertEquals("p9", response.getNextPageToken());
    }

    // ===== Retry-After =====

    @Test
    void shouldParseRetryAfterVariants() {
        assertEquals(Duration.ofSeconds(1), client.parseRetryAfter(null));
        assertEquals(Duration.ofSeconds(1), client.parseRetryAfter("garbage"));
        assertEquals(Duration.ofSeconds(1), client.parseRetryAfter("0"));
        assertEquals(Duration.ofSeconds(30), client.parseRetryAfter(" 30 "));
        assertEquals(Duration.ofSeconds(90), client.parseRetryAfter("Thu, 15 Jan 2026 12:01:30 GMT"));
        assertEquals(Duration.ofSeconds(1), client.parseRetryAfter("Thu, 15 Jan 2026 11:00:00 GMT"));
    }

    private YouTubeApiClient limitedClient(long maxResponseBytes) {
        LiveChatProperties properties = new LiveChatProperties();
        properties.getApi().setBaseUrl(mockServer.url("/youtube/v3").toString());
        properties.getApi().setApiKey("test-key");
        properties.getApi().setMaxResponseBytes(maxResponseBytes);
        return new YouTubeApiClient(new OkHttpClient(), new AutoConfiguration(properties).objectMapper(),
                quotaLedger, properties.getApi(), new MutableClock(NOW));
    }

    private static ApiRequest listRequest() {
        return ApiRequest.get("liveChat/messages", QuotaCosts.LIVE_CHAT_MESSAGES_LIST)
                .param("liveChatId", "chat-1")
                .param("part", "snippet")
                .param("pageToken", null)
                .build();
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader(CONTENT_TYPE, APPLICATION_JSON).setBody(body);
    }

    private static MockResponse error(int code, String reason, String message) {
        return new MockResponse().setResponseCode(code).setHeader(CONTENT_TYPE, APPLICATION_JSON)
                .setBody("{\"error\":{\"code\":" + code + ",\"message\":\"" + message + "\","
                        + "\"errors\":[{\"reason\":\"" + reason + "\",\"domain\":\"youtube.liveChat\"}]}}");
    }
}
