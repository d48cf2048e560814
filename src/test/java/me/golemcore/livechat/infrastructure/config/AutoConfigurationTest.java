package me.golemcore.livechat.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.livechat.adapter.outbound.auth.OAuthRefreshTokenProvider;
import me.golemcore.livechat.adapter.outbound.auth.StaticTokenProvider;
import me.golemcore.livechat.domain.model.LiveChatMessageListResponse;
import me.golemcore.livechat.quota.QuotaLedger;
import me.golemcore.livechat.retry.BackoffPolicy;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class AutoConfigurationTest {

    private LiveChatProperties properties;
    private AutoConfiguration configuration;

    @BeforeEach
    void setUp() {
        properties = new LiveChatProperties();
        configuration = new AutoConfiguration(properties);
    }

    @Test
    void shouldDecodeTimestampsAndIgnoreUnknownFields() throws Exception {
        ObjectMapper mapper = configuration.objectMapper();

        LiveChatMessageListResponse response = mapper.readValue(
                "{\"offlineAt\":\"2026-01-15T12:00:00Z\",\"somethingNew\":1}", LiveChatMessageListResponse.class);

        assertEquals(Instant.parse("2026-01-15T12:00:00Z"), response.getOfflineAt());
        assertTrue(response.isChatEnded());
    }

    @Test
    void shouldBuildBackoffAndQuotaFromProperties() {
        properties.getBackoff().setBaseDelay(Duration.ofMillis(500));
        properties.getBackoff().setJitter(0.0);
        properties.getQuota().setDailyLimit(2_000);

        BackoffPolicy backoff = configuration.backoffPolicy();
        QuotaLedger ledger = configuration.quotaLedger(Clock.systemUTC());

        assertEquals(Duration.ofMillis(500), backoff.delay(0));
        assertEquals(2_000, ledger.getLimit());
    }

    @Test
    void shouldPreferRefreshTokenFlow() {
        properties.getAuth().setRefreshToken("refresh-1");
        properties.getAuth().setAccessToken("static-1");

        assertInstanceOf(OAuthRefreshTokenProvider.class,
                configuration.tokenProvider(new OkHttpClient(), configuration.objectMapper(), Clock.systemUTC()));
    }

    @Test
    void shouldFallBackToStaticToken() {
        properties.getAuth().setAccessToken("static-1");

        assertInstanceOf(StaticTokenProvider.class,
                configuration.tokenProvider(new OkHttpClient(), configuration.objectMapper(), Clock.systemUTC()));
    }
}
