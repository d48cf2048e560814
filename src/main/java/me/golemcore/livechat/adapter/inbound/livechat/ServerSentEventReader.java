package me.golemcore.livechat.adapter.inbound.livechat;

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

import lombok.extern.slf4j.Slf4j;
import okio.BufferedSource;

import java.io.IOException;
import java.time.Duration;
import java.util.function.Consumer;

/**
 * Line-oriented reader for {@code text/event-stream} bodies.
 *
 * <p>
 * {@code data:} lines accumulate (joined with newlines) until a blank line
 * ends the event, which is then passed to the event listener. {@code retry:}
 * lines report a reconnect delay in milliseconds and never produce an event.
 * Comment lines ({@code :}) and other fields are ignored. Data left pending
 * when the body ends without a blank line is discarded.
 *
 * <p>
 * A single line longer than {@code maxEventBytes}, or an event whose data
 * grows past that many characters, fails the read with an {@link IOException}.
 */
@Slf4j
public class ServerSentEventReader {

    public static final int DEFAULT_MAX_EVENT_BYTES = 1024 * 1024;

    private final Consumer<String> onEvent;
    private final Consumer<Duration> onRetry;
    private final int maxEventBytes;

    public ServerSentEventReader(Consumer<String> onEvent, Consumer<Duration> onRetry) {
        this(onEvent, onRetry, DEFAULT_MAX_EVENT_BYTES);
    }

    public ServerSentEventReader(Consumer<String> onEvent, Consumer<Duration> onRetry, int maxEventBytes) {
        if (maxEventBytes <= 0) {
            throw new IllegalArgumentException("maxEventBytes must be positive");
        }
        this.onEvent = onEvent;
        this.onRetry = onRetry;
        this.maxEventBytes = maxEventBytes;
    }

    /**
     * Reads until end of stream. Exceptions thrown by the listeners propagate.
     */
    public void read(BufferedSource source) throws IOException {
        StringBuilder data = new StringBuilder();
        boolean pending = false;
        while (!source.exhausted()) {
            String line = nextLine(source);
            if (line.isEmpty()) {
                if (pending) {
                    String payload = data.toString();
                    data.setLength(0);
                    pending = false;
                    onEvent.accept(payload);
                }
                continue;
            }
            if (line.startsWith(":")) {
                continue;
            }

            int colon = line.indexOf(':');
            String field = colon < 0 ? line : line.substring(0, colon);
            String value = colon < 0 ? "" : line.substring(colon + 1);
            if (value.startsWith(" ")) {
                value = value.substring(1);
            }

            switch (field) {
                case "data" -> {
                    if (data.length() + value.length() + 1 > maxEventBytes) {
                        throw new IOException("event data exceeds " + maxEventBytes + " characters");
                    }
                    if (pending) {
                        data.append('\n');
                    }
                    data.append(value);
                    pending = true;
                }
                case "retry" -> handleRetry(value);
                default -> log.trace("[Stream] Ignoring field '{}'", field);
            }
        }
        if (pending) {
            log.debug("[Stream] Discarding unterminated event ({} chars)", data.length());
        }
    }

    private String nextLine(BufferedSource source) throws IOException {
        long newline = source.indexOf((byte) '\n', 0, maxEventBytes);
        String line;
        if (newline >= 0) {
            line = source.readUtf8(newline);
            source.skip(1);
        } else if (source.request(maxEventBytes)) {
            throw new IOException("event line exceeds " + maxEventBytes + " bytes");
        } else {
            line = source.readUtf8();
        }
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    private void handleRetry(String value) {
        try {
            long millis = Long.parseLong(value.trim());
            if (millis >= 0) {
                onRetry.accept(Duration.ofMillis(millis));
            }
        } catch (NumberFormatException e) {
            log.debug("[Stream] Invalid retry value: {}", value);
        }
    }
}
