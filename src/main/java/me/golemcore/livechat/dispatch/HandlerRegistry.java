package me.golemcore.livechat.dispatch;

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

import me.golemcore.livechat.domain.exception.HandlerInvocationException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Fan-out of events to handlers grouped by named category.
 *
 * <p>
 * Dispatch copies the category's handler list under the lock, releases it,
 * then calls each handler in registration order. Handlers may therefore
 * subscribe or unsubscribe while being dispatched to; such changes apply from
 * the next dispatch.
 *
 * <p>
 * A handler that throws does not stop the remaining handlers. Its exception is
 * wrapped in {@link HandlerInvocationException} and dispatched to the error
 * category. Exceptions thrown by error handlers are logged and dropped.
 *
 * @since 1.0
 */
@Slf4j
public class HandlerRegistry {

    private final HandlerCategory<Throwable> errorCategory;
    private final Object lock = new Object();
    private final Map<HandlerCategory<?>, List<Registration<?>>> handlers = new HashMap<>();

    public HandlerRegistry(HandlerCategory<Throwable> errorCategory) {
        this.errorCategory = errorCategory;
    }

    public HandlerCategory<Throwable> getErrorCategory() {
        return errorCategory;
    }

    public <T> Subscription subscribe(HandlerCategory<T> category, Consumer<? super T> handler) {
        Registration<T> registration = new Registration<>(handler);
        synchronized (lock) {
            handlers.computeIfAbsent(category, key -> new ArrayList<>()).add(registration);
        }
        return Subscription.once(() -> remove(category, registration));
    }

    /**
     * Subscribes a handler to a category without payload.
     */
    public Subscription subscribe(HandlerCategory<Void> category, Runnable handler) {
        return subscribe(category, (Consumer<Void>) ignored -> handler.run());
    }

    public <T> void dispatch(HandlerCategory<T> category, T payload) {
        List<Registration<?>> snapshot = snapshot(category);
        boolean errorDispatch = category.equals(errorCategory);
        for (Registration<?> registration : snapshot) {
            try {
                @SuppressWarnings("unchecked")
                Consumer<? super T> handler = (Consumer<? super T>) registration.handler();
                handler.accept(payload);
            } catch (RuntimeException e) {
                if (errorDispatch) {
                    log.debug("[Dispatch] Error handler failed: {}", e.getMessage());
                } else {
                    dispatchHandlerFault(category, e);
                }
            }
        }
    }

    public void dispatch(HandlerCategory<Void> category) {
        dispatch(category, null);
    }

    public int handlerCount(HandlerCategory<?> category) {
        synchronized (lock) {
            List<Registration<?>> list = handlers.get(category);
            return list == null ? 0 : list.size();
        }
    }

    /**
     * Removes every handler from every category.
     */
    public void clear() {
        synchronized (lock) {
            handlers.clear();
        }
    }

    private void dispatchHandlerFault(HandlerCategory<?> category, RuntimeException fault) {
        HandlerInvocationException wrapped = new HandlerInvocationException(category.getName(), fault);
        for (Registration<?> registration : snapshot(errorCategory)) {
            try {
                @SuppressWarnings("unchecked")
                Consumer<Throwable> handler = (Consumer<Throwable>) registration.handler();
                handler.accept(wrapped);
            } catch (RuntimeException e) {
                log.debug("[Dispatch] Error handler failed: {}", e.getMessage());
            }
        }
    }

    private List<Registration<?>> snapshot(HandlerCategory<?> category) {
        synchronized (lock) {
            List<Registration<?>> list = handlers.get(category);
            return list == null ? List.of() : List.copyOf(list);
        }
    }

    private void remove(HandlerCategory<?> category, Registration<?> registration) {
        synchronized (lock) {
            List<Registration<?>> list = handlers.get(category);
            if (list == null) {
                return;
            }
            // identity removal, the same handler may be registered twice
            list.removeIf(existing -> existing == registration);
            if (list.isEmpty()) {
                handlers.remove(category);
            }
        }
    }

    private static final class Registration<T> {

        private final Consumer<? super T> handler;

        private Registration(Consumer<? super T> handler) {
            this.handler = handler;
        }

        private Consumer<? super T> handler() {
            return handler;
        }
    }
}
