package me.golemcore.livechat.infrastructure.http;

import me.golemcore.livechat.infrastructure.config.LiveChatProperties;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OkHttpConfigTest {

    @Test
    void shouldApplyConfiguredTimeouts() {
        LiveChatProperties properties = new LiveChatProperties();
        properties.getHttp().setReadTimeout(12_000);

        OkHttpClient client = new OkHttpConfig(properties).okHttpClient();

        assertEquals(12_000, client.readTimeoutMillis());
        assertEquals(10_000, client.connectTimeoutMillis());
    }

    @Test
    void shouldDisableReadTimeoutForStreaming() {
        OkHttpConfig config = new OkHttpConfig(new LiveChatProperties());
        OkHttpClient base = config.okHttpClient();

        OkHttpClient streaming = config.streamingOkHttpClient(base);

        assertEquals(0, streaming.readTimeoutMillis());
        assertEquals(0, streaming.callTimeoutMillis());
        assertSame(base.connectionPool(), streaming.connectionPool());
        assertEquals(base.interceptors().size(), streaming.interceptors().size());
    }

    @Test
    void shouldPassResponsesThroughLoggingInterceptor() throws Exception {
        MockWebServer server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(404).setBody("missing"));
        server.start();
        try {
            OkHttpClient client = new OkHttpConfig(new LiveChatProperties()).okHttpClient();
            Request request = new Request.Builder().url(server.url("/nothing")).build();

            try (Response response = client.newCall(request).execute()) {
                assertEquals(404, response.code());
                assertEquals("missing", response.body().string());
            }
        } finally {
            server.shutdown();
        }
    }
}
