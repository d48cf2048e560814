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

import me.golemcore.livechat.dispatch.HandlerCategory;
import me.golemcore.livechat.dispatch.HandlerRegistry;
import me.golemcore.livechat.dispatch.Subscription;
import me.golemcore.livechat.domain.exception.AlreadyRunningException;
import me.golemcore.livechat.domain.exception.NotRunningException;
import me.golemcore.livechat.domain.model.LiveChatBan;
import me.golemcore.livechat.domain.model.LiveChatMessage;
import me.golemcore.livechat.domain.model.LiveChatModerator;
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
import me.golemcore.livechat.lifecycle.LifecycleState;
import me.golemcore.livechat.port.inbound.IngestionPort;
import me.golemcore.livechat.port.outbound.CredentialsPort;
import me.golemcore.livechat.port.outbound.LiveChatModerationPort;
import me.golemcore.livechat.port.outbound.TokenProviderPort;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/**
 * Chat bot facade over one ingestion transport.
 *
 * <p>
 * On {@link #connect()} the bot installs a fresh access token (when a token
 * refresher is configured), replaces its subscriptions on the ingestion
 * handlers, starts the periodic token refresh and starts ingestion. Raw items
 * are classified into {@link ChatEvent} variants and dispatched through the
 * bot's own handler registry; items without a category are dropped.
 *
 * <p>
 * Moderation actions require an active connection and throw
 * {@link NotRunningException} otherwise.
 *
 * @since 1.0
 */
@Slf4j
public class ChatBotService {

    public static final HandlerCategory<Void> CONNECT = HandlerCategory.signal("connect");
    public static final HandlerCategory<Void> DISCONNECT = HandlerCategory.signal("disconnect");
    public static final HandlerCategory<Throwable> ERROR = HandlerCategory.of("error", Throwable.class);

    private final IngestionPort ingestion;
    private final LiveChatModerationPort moderation;
    private final ChatEventClassifier classifier;
    private final TokenRefreshScheduler tokenRefresh;
    private final Duration tokenRefreshInterval;
    private final HandlerRegistry handlers = new HandlerRegistry(ERROR);
    private final Object lifecycleLock = new Object();

    private Subscription ingestionSubscription;

    /**
     * @param tokenProvider
     *            token source, or {@code null} when requests use a fixed
     *            credential such as an API key
     * @param credentials
     *            receiver of refreshed tokens, usually the shared API client
     */
    public ChatBotService(IngestionPort ingestion, LiveChatModerationPort moderation, ChatEventClassifier classifier,
            TokenProviderPort tokenProvider, CredentialsPort credentials, Duration tokenRefreshInterval) {
        this.ingestion = ingestion;
        this.moderation = moderation;
        this.classifier = classifier;
        this.tokenRefresh = tokenProvider != null
                ? new TokenRefreshScheduler(tokenProvider, credentials, error -> handlers.dispatch(ERROR, error))
                : null;
        this.tokenRefreshInterval = tokenRefreshInterval;
    }

    public void connect() {
        synchronized (lifecycleLock) {
            if (ingestion.getState() != LifecycleState.STOPPED) {
                throw new AlreadyRunningException("chat bot is already connected to " + ingestion.getLiveChatId());
            }
            if (tokenRefresh != null) {
                tokenRefresh.refreshNow();
            }
            if (ingestionSubscription != null) {
                ingestionSubscription.unsubscribe();
                ingestionSubscription = null;
            }
            ingestionSubscription = subscribeToIngestion();
            if (tokenRefresh != null && tokenRefreshInterval != null && !tokenRefreshInterval.isZero()) {
                tokenRefresh.start(tokenRefreshInterval);
            }
            try {
                ingestion.start();
            } catch (RuntimeException e) {
                if (tokenRefresh != null) {
                    tokenRefresh.stop();
                }
                ingestionSubscription.unsubscribe();
                ingestionSubscription = null;
                throw e;
            }
            log.info("[ChatBot] Connected to {} via {}", ingestion.getLiveChatId(), ingestion.getTransport());
        }
    }

    public void close() {
        synchronized (lifecycleLock) {
            if (tokenRefresh != null) {
                tokenRefresh.stop();
            }
            ingestion.stop();
            if (ingestionSubscription != null) {
                ingestionSubscription.unsubscribe();
                ingestionSubscription = null;
            }
        }
    }

    public boolean isConnected() {
        return ingestion.isRunning();
    }

    public boolean isTokenRefreshRunning() {
        return tokenRefresh != null && tokenRefresh.isRunning();
    }

    public IngestionPort getIngestion() {
        return ingestion;
    }

    public HandlerRegistry getHandlers() {
        return handlers;
    }

    // ===== Subscriptions =====

    public <T> Subscription on(HandlerCategory<T> category, Consumer<? super T> handler) {
        return handlers.subscribe(category, handler);
    }

    public Subscription onTextMessage(Consumer<ChatMessageEvent> handler) {
        return handlers.subscribe(ChatEvent.TEXT_MESSAGE, handler);
    }

    public Subscription onSuperChat(Consumer<SuperChatEvent> handler) {
        return handlers.subscribe(ChatEvent.SUPER_CHAT, handler);
    }

    public Subscription onSuperSticker(Consumer<SuperStickerEvent> handler) {
        return handlers.subscribe(ChatEvent.SUPER_STICKER, handler);
    }

    public Subscription onMembership(Consumer<MembershipEvent> handler) {
        return handlers.subscribe(ChatEvent.MEMBERSHIP, handler);
    }

    public Subscription onMemberMilestone(Consumer<MemberMilestoneEvent> handler) {
        return handlers.subscribe(ChatEvent.MEMBER_MILESTONE, handler);
    }

    public Subscription onGiftMembership(Consumer<GiftMembershipEvent> handler) {
        return handlers.subscribe(ChatEvent.GIFT_MEMBERSHIP, handler);
    }

    public Subscription onGiftMembershipReceived(Consumer<GiftMembershipReceivedEvent> handler) {
        return handlers.subscribe(ChatEvent.GIFT_MEMBERSHIP_RECEIVED, handler);
    }

    public Subscription onMessageDeleted(Consumer<MessageDeletedEvent> handler) {
        return handlers.subscribe(ChatEvent.MESSAGE_DELETED, handler);
    }

    public Subscription onUserBanned(Consumer<BanEvent> handler) {
        return handlers.subscribe(ChatEvent.USER_BANNED, handler);
    }

    public Subscription onConnect(Runnable handler) {
        return handlers.subscribe(CONNECT, handler);
    }

    public Subscription onDisconnect(Runnable handler) {
        return handlers.subscribe(DISCONNECT, handler);
    }

    public Subscription onError(Consumer<Throwable> handler) {
        return handlers.subscribe(ERROR, handler);
    }

    /**
     * Subscribes one handler to every semantic event category.
     */
    public Subscription onAnyEvent(Consumer<ChatEvent> handler) {
        return Subscription.composite(List.of(
                onTextMessage(handler::accept),
                onSuperChat(handler::accept),
                onSuperSticker(handler::accept),
                onMembership(handler::accept),
                onMemberMilestone(handler::accept),
                onGiftMembership(handler::accept),
                onGiftMembershipReceived(handler::accept),
                onMessageDeleted(handler::accept),
                onUserBanned(handler::accept)));
    }

    // ===== Moderation =====

    public LiveChatMessage sendMessage(String text) {
        requireConnected();
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("message text must not be blank");
        }
        return moderation.sendMessage(ingestion.getLiveChatId(), text);
    }

    public void deleteMessage(String messageId) {
        requireConnected();
        moderation.deleteMessage(messageId);
    }

    public LiveChatBan banUser(String channelId) {
        requireConnected();
        return moderation.banUser(ingestion.getLiveChatId(), channelId);
    }

    public LiveChatBan timeoutUser(String channelId, Duration duration) {
        requireConnected();
        if (duration == null || duration.getSeconds() <= 0) {
            throw new IllegalArgumentException("timeout duration must be at least one second");
        }
        return moderation.timeoutUser(ingestion.getLiveChatId(), channelId, duration.getSeconds());
    }

    public void unbanUser(String banId) {
        requireConnected();
        moderation.unbanUser(banId);
    }

    public LiveChatModerator addModerator(String channelId) {
        requireConnected();
        return moderation.addModerator(ingestion.getLiveChatId(), channelId);
    }

    public void removeModerator(String moderatorId) {
        requireConnected();
        moderation.removeModerator(moderatorId);
    }

    public List<LiveChatModerator> listModerators() {
        requireConnected();
        return moderation.listModerators(ingestion.getLiveChatId());
    }

    private void requireConnected() {
        if (!isConnected()) {
            throw new NotRunningException("chat bot is not connected");
        }
    }

    private Subscription subscribeToIngestion() {
        return Subscription.composite(List.of(
                ingestion.onMessage(this::classifyAndDispatch),
                ingestion.onDelete(id -> classifier.classifyDeletion(id).ifPresent(this::dispatchEvent)),
                ingestion.onBan(details -> classifier.classifyBan(details).ifPresent(this::dispatchEvent)),
                ingestion.onError(error -> handlers.dispatch(ERROR, error)),
                ingestion.onConnect(() -> handlers.dispatch(CONNECT)),
                ingestion.onDisconnect(this::handleDisconnect)));
    }

    private void classifyAndDispatch(LiveChatMessage message) {
        classifier.classify(message).ifPresent(this::dispatchEvent);
    }

    private void dispatchEvent(ChatEvent event) {
        event.dispatchTo(handlers);
    }

    private void handleDisconnect() {
        if (tokenRefresh != null) {
            tokenRefresh.stop();
        }
        handlers.dispatch(DISCONNECT);
    }
}
