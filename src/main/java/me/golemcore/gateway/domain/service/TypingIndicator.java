package me.golemcore.gateway.domain.service;

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
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.inbound.ChannelPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic "typing" signal shown while the agent is working.
 *
 * <p>
 * Each {@link Handle} runs a cooperative loop on the typing executor: send the
 * indicator, then wait on the stop signal for at most one interval. Closing the
 * handle raises the stop signal, cancels the task and waits for the loop to
 * exit.
 */
@Component
@Slf4j
public class TypingIndicator {

    private static final long JOIN_TIMEOUT_MS = 5000;

    private final ExecutorService typingExecutor;
    private final Duration interval;

    @Autowired
    public TypingIndicator(@Qualifier("typingExecutor") ExecutorService typingExecutor,
            GatewayProperties properties) {
        this(typingExecutor, properties.getAgent().getTypingInterval());
    }

    public TypingIndicator(ExecutorService typingExecutor, Duration interval) {
        this.typingExecutor = typingExecutor;
        this.interval = interval;
    }

    public Handle start(ChannelPort channel, long chatId) {
        Handle handle = new Handle(chatId);
        handle.task = typingExecutor.submit(() -> handle.run(channel));
        return handle;
    }

    /**
     * Running typing loop for one chat.
     */
    public final class Handle implements AutoCloseable {

        private final long chatId;
        private final CountDownLatch stopSignal = new CountDownLatch(1);
        private final CountDownLatch finished = new CountDownLatch(1);
        private final AtomicBoolean claimed = new AtomicBoolean();
        private volatile Future<?> task;

        private Handle(long chatId) {
            this.chatId = chatId;
        }

        private void run(ChannelPort channel) {
            if (!claimed.compareAndSet(false, true)) {
                return;
            }
            try {
                while (stopSignal.getCount() > 0) {
                    try {
                        channel.sendTyping(chatId);
                    } catch (RuntimeException e) { // NOSONAR - typing is best effort
                        log.debug("[Typing] Failed to send typing indicator to chat {}", chatId, e);
                    }
                    if (stopSignal.await(interval.toMillis(), TimeUnit.MILLISECONDS)) {
                        return;
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                finished.countDown();
            }
        }

        public boolean isStopped() {
            return finished.getCount() == 0;
        }

        @Override
        public void close() {
            stopSignal.countDown();
            if (claimed.compareAndSet(false, true)) {
                // loop never started
                finished.countDown();
            }
            Future<?> running = task;
            if (running != null) {
                running.cancel(true);
            }
            try {
                if (!finished.await(JOIN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                    log.warn("[Typing] Typing loop for chat {} did not stop in time", chatId);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
