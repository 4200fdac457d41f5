package me.golemcore.gateway.domain.service;

import me.golemcore.gateway.port.inbound.ChannelPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class TypingIndicatorTest {

    private static final long CHAT_ID = 7L;

    private ExecutorService executor;
    private ChannelPort channel;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        channel = mock(ChannelPort.class);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldSendTypingRepeatedlyUntilClosed() throws InterruptedException {
        CountDownLatch sent = new CountDownLatch(3);
        doAnswer(invocation -> {
            sent.countDown();
            return null;
        }).when(channel).sendTyping(CHAT_ID);
        TypingIndicator indicator = new TypingIndicator(executor, Duration.ofMillis(10));

        TypingIndicator.Handle handle = indicator.start(channel, CHAT_ID);
        assertTrue(sent.await(5, TimeUnit.SECONDS));
        handle.close();

        assertTrue(handle.isStopped());
        verify(channel, atLeast(3)).sendTyping(CHAT_ID);
    }

    @Test
    void shouldStopPromptlyWithLongInterval() {
        TypingIndicator indicator = new TypingIndicator(executor, Duration.ofMinutes(5));

        long started = System.nanoTime();
        TypingIndicator.Handle handle = indicator.start(channel, CHAT_ID);
        assertFalse(handle.isStopped());
        handle.close();

        assertTrue(handle.isStopped());
        assertTrue(TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - started) < 5);
    }

    @Test
    void shouldKeepRunningWhenTypingFails() throws InterruptedException {
        CountDownLatch attempts = new CountDownLatch(2);
        doAnswer(invocation -> {
            attempts.countDown();
            throw new IllegalStateException("network down");
        }).when(channel).sendTyping(anyLong());
        TypingIndicator indicator = new TypingIndicator(executor, Duration.ofMillis(10));

        TypingIndicator.Handle handle = indicator.start(channel, CHAT_ID);
        assertTrue(attempts.await(5, TimeUnit.SECONDS));
        handle.close();

        assertTrue(handle.isStopped());
    }

    @Test
    void shouldStopWhenClosedBeforeLoopStarts() {
        ExecutorService idle = Executors.newSingleThreadExecutor();
        CountDownLatch blocker = new CountDownLatch(1);
        idle.submit(() -> {
            blocker.await();
            return null;
        });
        try {
            TypingIndicator indicator = new TypingIndicator(idle, Duration.ofMillis(10));
            TypingIndicator.Handle handle = indicator.start(channel, CHAT_ID);
            handle.close();

            assertTrue(handle.isStopped());
            blocker.countDown();
            verify(channel, never()).sendTyping(anyLong());
        } finally {
            blocker.countDown();
            idle.shutdownNow();
        }
    }
}
