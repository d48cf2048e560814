package me.golemcore.livechat.port.inbound;

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
import me.golemcore.livechat.dispatch.Subscription;
import me.golemcore.livechat.domain.model.LiveChatMessage;
import me.golemcore.livechat.domain.model.UserBannedDetails;
import me.golemcore.livechat.lifecycle.LifecycleState;

import java.util.function.Consumer;

/**
 * Inbound port for a live chat feed. Implementations fetch chat items in the
 * background and dispatch them through {@link #getHandlers()}.
 *
 * <p>
 * Deleted-message and ban items go to {@link #DELETE} (the deleted message id)
 * and {@link #BAN} (the ban details), never to {@link #MESSAGE}. {@link #CONNECT} fires once when a session begins and
 * {@link #DISCONNECT} once when it ends, whatever the reason.
 */
public interface IngestionPort {

    HandlerCategory<LiveChatMessage> MESSAGE = HandlerCategory.of("message", LiveChatMessage.class);
    HandlerCategory<String> DELETE = HandlerCategory.of("delete", String.class);
    HandlerCategory<UserBannedDetails> BAN = HandlerCategory.of("ban", UserBannedDetails.class);
    HandlerCategory<Throwable> ERROR = HandlerCategory.of("error", Throwable.class);
    HandlerCategory<Void> CONNECT = HandlerCategory.signal("connect");
    HandlerCategory<Void> DISCONNECT = HandlerCategory.signal("disconnect");

    /**
     * Returns the transport identifier ("poll" or "stream").
     */
    String getTransport();

    String getLiveChatId();

    /**
     * Starts ingesting in the background.
     *
     * @throws me.golemcore.livechat.domain.exception.AlreadyRunningException
     *             if a session is already active
     */
    void start();

    /**
     * Stops ingesting and waits for the background worker to exit.
     */
    void stop();

    boolean isRunning();

    LifecycleState getState();

    /**
     * Returns the cursor of the next fetch, empty before the first one.
     */
    String getPageToken();

    /**
     * Sets the cursor, for resuming from a previously exported position.
     */
    void setPageToken(String pageToken);

    void resetPageToken();

    /**
     * Clears the cursor and retry state. Only valid while stopped.
     */
    void reset();

    HandlerRegistry getHandlers();

    default Subscription onMessage(Consumer<LiveChatMessage> handler) {
        return getHandlers().subscribe(MESSAGE, handler);
    }

    default Subscription onDelete(Consumer<String> handler) {
        return getHandlers().subscribe(DELETE, handler);
    }

    default Subscription onBan(Consumer<UserBannedDetails> handler) {
        return getHandlers().subscribe(BAN, handler);
    }

    default Subscription onError(Consumer<Throwable> handler) {
        return getHandlers().subscribe(ERROR, handler);
    }

    default Subscription onConnect(Runnable handler) {
        return getHandlers().subscribe(CONNECT, handler);
    }

    default Subscription onDisconnect(Runnable handler) {
        return getHandlers().subscribe(DISCONNECT, handler);
    }
}
