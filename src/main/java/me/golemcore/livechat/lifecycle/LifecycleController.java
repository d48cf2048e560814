package me.golemcore.livechat.lifecycle;

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

import me.golemcore.livechat.domain.exception.AlreadyRunningException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Start/stop state machine shared by the ingestion loops.
 *
 * <p>
 * The state is an atomic value readable without locking. A lock guards only
 * the start and stop transitions, never the loop body. Every {@link #start}
 * gets its own {@link CancellationToken} and completion latch, so
 * {@link #stop()} returns only after that session's worker has exited and a
 * later start is unaffected by an earlier stop.
 *
 * @since 1.0
 */
@Slf4j
public class LifecycleController {

    private final String name;
    private final AtomicReference<LifecycleState> state = new AtomicReference<>(LifecycleState.STOPPED);
    private final Object transitionLock = new Object();
    private Session current;

    public LifecycleController(String name) {
        this.name = name;
    }

    public LifecycleState getState() {
        return state.get();
    }

    public boolean isRunning() {
        return state.get() == LifecycleState.RUNNING;
    }

    /**
     * Launches {@code body} on a new worker thread.
     *
     * @throws AlreadyRunningException
     *             if the controller is not {@link LifecycleState#STOPPED}
     */
    public void start(Consumer<CancellationToken> body) {
        synchronized (transitionLock) {
            if (!state.compareAndSet(LifecycleState.STOPPED, LifecycleState.STARTING)) {
                throw new AlreadyRunningException(name + " is already running (state " + state.get() + ")");
            }
            Session session = new Session(new CancellationToken());
            Thread worker = new Thread(() -> runSession(session, body), name);
            worker.setDaemon(true);
            session.thread = worker;
            current = session;
            worker.start();
            state.set(LifecycleState.RUNNING);
            log.debug("[Lifecycle] {} started", name);
        }
    }

    /**
     * Cancels the active session and waits for its worker to exit. Does nothing
     * when already stopped or stopping. When called from the worker thread
     * itself the wait is skipped; the worker finishes the transition on exit.
     */
    public void stop() {
        Session session;
        synchronized (transitionLock) {
            LifecycleState observed = state.get();
            if (observed == LifecycleState.STOPPED || observed == LifecycleState.STOPPING) {
                return;
            }
            state.set(LifecycleState.STOPPING);
            session = current;
        }
        if (session == null) {
            return;
        }
        session.token.cancel();
        if (Thread.currentThread() == session.thread) {
            return;
        }
        session.awaitExit();
        synchronized (transitionLock) {
            if (current == session) {
                current = null;
                state.set(LifecycleState.STOPPED);
            }
        }
        log.debug("[Lifecycle] {} stopped", name);
    }

    private void runSession(Session session, Consumer<CancellationToken> body) {
        try {
            body.accept(session.token);
        } catch (RuntimeException e) {
            log.error("[Lifecycle] {} worker terminated unexpectedly", name, e);
        } finally {
            synchronized (transitionLock) {
                if (current == session) {
                    current = null;
                    state.set(LifecycleState.STOPPED);
                }
            }
            session.exited.countDown();
        }
    }

    private static final class Session {

        private final CancellationToken token;
        private final CountDownLatch exited = new CountDownLatch(1);
        private Thread thread;

        private Session(CancellationToken token) {
            this.token = token;
        }

        private void awaitExit() {
            try {
                exited.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
