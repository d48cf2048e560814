package me.golemcore.livechat.infrastructure.http;

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

import me.golemcore.livechat.infrastructure.config.LiveChatProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.ConnectionPool;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Spring configuration for the OkHttp clients.
 *
 * <p>
 * The primary client is configured from {@code livechat.http} and serves all
 * request/response calls. The streaming client shares its connection pool but
 * has no read or call timeout, since a chat stream stays open indefinitely.
 * Both log unsuccessful exchanges at debug level.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class OkHttpConfig {

    public static final String STREAMING_CLIENT = "streamingOkHttpClient";

    private final LiveChatProperties properties;

    @Bean
    @Primary
    public OkHttpClient okHttpClient() {
        LiveChatProperties.HttpProperties http = properties.getHttp();
        ConnectionPool pool = new ConnectionPool(http.getMaxIdleConnections(), http.getKeepAliveDuration(),
                TimeUnit.MILLISECONDS);

        return new OkHttpClient.Builder()
                .connectTimeout(http.getConnectTimeout(), TimeUnit.MILLISECONDS)
                .readTimeout(http.getReadTimeout(), TimeUnit.MILLISECONDS)
                .writeTimeout(http.getWriteTimeout(), TimeUnit.MILLISECONDS)
                .connectionPool(pool)
                .retryOnConnectionFailure(true)
                .addInterceptor(OkHttpConfig::logExchange)
                .build();
    }

    @Bean(STREAMING_CLIENT)
    public OkHttpClient streamingOkHttpClient(@Qualifier("okHttpClient") OkHttpClient base) {
        return base.newBuilder()
                .readTimeout(0, TimeUnit.MILLISECONDS)
                .callTimeout(0, TimeUnit.MILLISECONDS)
                .build();
    }

    private static Response logExchange(Interceptor.Chain chain) throws IOException {
        Request request = chain.request();
        long started = System.nanoTime();
        try {
            Response response = chain.proceed(request);
            if (!response.isSuccessful()) {
                log.debug("[Http] {} {} -> {} in {}ms", request.method(), request.url().encodedPath(),
                        response.code(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
            }
            return response;
        } catch (IOException e) {
            log.debug("[Http] {} {} failed: {}", request.method(), request.url().encodedPath(), e.getMessage());
            throw e;
        }
    }
}
