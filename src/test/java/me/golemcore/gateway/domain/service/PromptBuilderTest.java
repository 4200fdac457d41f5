package me.golemcore.gateway.domain.service;

import me.golemcore.gateway.domain.model.ChatEvent;
import me.golemcore.gateway.domain.model.ChatType;
import me.golemcore.gateway.domain.model.ConversationEntry;
import me.golemcore.gateway.domain.model.Sandbox;
import me.golemcore.gateway.domain.sandbox.SandboxService;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PromptBuilderTest {

    private static final long CHAT_ID = -42L;
    private static final Path LINK = Path.of("/work/.tg-sandboxes/-42/s1");

    private ConversationLogService conversationLog;
    private SandboxService sandboxService;
    private PromptBuilder promptBuilder;
    private Sandbox sandbox;

    @BeforeEach
    void setUp() {
        conversationLog = new ConversationLogService(30);
        sandboxService = mock(SandboxService.class);
        promptBuilder = new PromptBuilder(conversationLog, sandboxService, new GatewayProperties());
        sandbox = new Sandbox("s1", Path.of("/tmp/tg-codex/-42/s1"), LINK);
        when(sandboxService.find(CHAT_ID)).thenReturn(Optional.empty());
    }

    @Test
    void shouldUseMessageTextInPrivateChat() {
        ChatEvent event = ChatEvent.builder().chatId(CHAT_ID).chatType(ChatType.PRIVATE).text("hello").build();

        assertEquals("hello", promptBuilder.buildChatPrompt(event));
    }

    @Test
    void shouldUseRenderedLogInGroup() {
        conversationLog.append(CHAT_ID, ConversationEntry.of("alice", "first"));
        conversationLog.append(CHAT_ID, ConversationEntry.of("bob", "@bot help"));
        ChatEvent event = ChatEvent.builder().chatId(CHAT_ID).chatType(ChatType.SUPERGROUP).text("@bot help").build();

        String prompt = promptBuilder.buildChatPrompt(event);

        assertEquals(conversationLog.render(CHAT_ID), prompt);
    }

    @Test
    void shouldAppendSandboxBlockWhenFilesExist() {
        when(sandboxService.find(CHAT_ID)).thenReturn(Optional.of(sandbox));
        when(sandboxService.listFiles(any(), anyInt())).thenReturn(List.of("uploads/app.log", "work/report.md"));
        ChatEvent event = ChatEvent.builder().chatId(CHAT_ID).chatType(ChatType.PRIVATE).text("why?").build();

        String prompt = promptBuilder.buildChatPrompt(event);

        assertEquals("why?\n\n$log-archive-triage\n"
                + "Request: why?\n"
                + "Sandbox path: " + LINK + "\n"
                + "Files available in the sandbox:\n"
                + "- uploads/app.log\n"
                + "- work/report.md", prompt);
    }

    @Test
    void shouldSkipSandboxBlockWhenSandboxIsEmpty() {
        when(sandboxService.find(CHAT_ID)).thenReturn(Optional.of(sandbox));
        when(sandboxService.listFiles(any(), anyInt())).thenReturn(List.of());
        ChatEvent event = ChatEvent.builder().chatId(CHAT_ID).chatType(ChatType.PRIVATE).text("why?").build();

        assertEquals("why?", promptBuilder.buildChatPrompt(event));
    }

    @Test
    void shouldIncludeUploadedFileLine() {
        when(sandboxService.listFiles(any(), anyInt())).thenReturn(List.of("uploads/a.zip"));

        String block = promptBuilder.buildSandboxPrompt(sandbox, "check", LINK.resolve("a.zip"));

        assertEquals("$log-archive-triage\n"
                + "Request: check\n"
                + "Sandbox path: " + LINK + "\n"
                + "Uploaded file: " + LINK.resolve("a.zip") + "\n"
                + "Files available in the sandbox:\n"
                + "- uploads/a.zip", block);
    }

    @Test
    void shouldUseCaptionWhenTextMissing() {
        ChatEvent event = ChatEvent.builder().chatId(CHAT_ID).chatType(ChatType.PRIVATE).caption("from caption")
                .build();

        assertEquals("from caption", promptBuilder.buildChatPrompt(event));
    }
}
