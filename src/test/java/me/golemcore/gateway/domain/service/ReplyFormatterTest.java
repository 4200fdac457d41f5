package me.golemcore.gateway.domain.service;

import me.golemcore.gateway.domain.exception.ReplyFormatRejectedException;
import me.golemcore.gateway.domain.model.FormatMode;
import me.golemcore.gateway.port.inbound.ChannelPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class ReplyFormatterTest {

    private static final long CHAT_ID = 100L;

    private ChannelPort channel;
    private ReplyFormatter formatter;

    @BeforeEach
    void setUp() {
        channel = mock(ChannelPort.class);
        formatter = new ReplyFormatter(50, 20);
    }

    // ===== split =====

    @Test
    void shouldReturnSingleChunkWhenTextFits() {
        assertEquals(List.of("short"), ReplyFormatter.split("short", 10));
        assertEquals(List.of(""), ReplyFormatter.split("", 10));
    }

    @Test
    void shouldSplitAtLastNewlineWithinLimit() {
        List<String> parts = ReplyFormatter.split("aaaaaaa\nbbbbbbb", 10);

        assertEquals(List.of("aaaaaaa", "bbbbbbb"), parts);
    }

    @Test
    void shouldHardSplitWhenNewlineIsTooEarly() {
        List<String> parts = ReplyFormatter.split("a\nbbbbbbbbbbbbbbbbbb", 10);

        assertEquals(List.of("a\nbbbbbbbb", "bbbbbbbbbb"), parts);
    }

    @Test
    void shouldHardSplitWithoutNewlines() {
        List<String> parts = ReplyFormatter.split("x".repeat(25), 10);

        assertEquals(3, parts.size());
        assertEquals("x".repeat(10), parts.get(0));
        assertEquals("x".repeat(5), parts.get(2));
    }

    @Test
    void shouldKeepEveryChunkWithinLimitAndReconstructText() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 200; i++) {
            sb.append("line ").append(i).append(i % 7 == 0 ? "\n" : " ");
        }
        String text = sb.toString();

        List<String> parts = ReplyFormatter.split(text, 37);

        assertTrue(parts.stream().allMatch(part -> part.length() <= 37));
        String joined = String.join("", parts).replace("\n", "");
        assertEquals(text.replace("\n", ""), joined);
    }

    @Test
    void shouldRejectNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> ReplyFormatter.split("text", 0));
    }

    // ===== reply =====

    @Test
    void shouldSendShortFormattedAnswerAsMarkdown() {
        formatter.reply(channel, CHAT_ID, "*bold*", true);

        verify(channel).sendText(CHAT_ID, "*bold*", FormatMode.MARKDOWN, true);
    }

    @Test
    void shouldFallBackToPlainWhenAnswerExceedsMarkdownLimit() {
        String text = "y".repeat(30);

        formatter.reply(channel, CHAT_ID, text, true);

        verify(channel).sendText(CHAT_ID, text, FormatMode.PLAIN, true);
    }

    @Test
    void shouldSendChunksInOrder() {
        String text = "a".repeat(50) + "b".repeat(50) + "c";

        formatter.reply(channel, CHAT_ID, text, false);

        InOrder order = inOrder(channel);
        order.verify(channel).sendText(CHAT_ID, "a".repeat(50), FormatMode.PLAIN, true);
        order.verify(channel).sendText(CHAT_ID, "b".repeat(50), FormatMode.PLAIN, true);
        order.verify(channel).sendText(CHAT_ID, "c", FormatMode.PLAIN, true);
    }

    @Test
    void shouldNotSendEmptyText() {
        formatter.reply(channel, CHAT_ID, "", false);

        verify(channel, never()).sendText(anyLong(), anyString(), any(), anyBoolean());
    }

    @Test
    void shouldStopOnFirstFailedChunk() {
        doThrow(new ReplyFormatRejectedException("bad markup", null))
                .when(channel).sendText(eq(CHAT_ID), anyString(), eq(FormatMode.MARKDOWN), anyBoolean());

        assertThrows(ReplyFormatRejectedException.class, () -> formatter.reply(channel, CHAT_ID, "_oops", true));
        verify(channel, times(1)).sendText(anyLong(), anyString(), any(), anyBoolean());
    }
}
