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
import me.golemcore.gateway.domain.exception.AgentInvocationException;
import me.golemcore.gateway.domain.exception.EmptyResponseException;
import me.golemcore.gateway.domain.exception.ReplyFormatRejectedException;
import me.golemcore.gateway.domain.exception.UploadException;
import me.golemcore.gateway.domain.model.AgentInvocationResult;
import me.golemcore.gateway.domain.model.AttachedDocument;
import me.golemcore.gateway.domain.model.BotIdentity;
import me.golemcore.gateway.domain.model.ChatEvent;
import me.golemcore.gateway.domain.model.ConversationEntry;
import me.golemcore.gateway.domain.model.MessageEntity;
import me.golemcore.gateway.domain.model.Sandbox;
import me.golemcore.gateway.domain.sandbox.ArchiveExtractor;
import me.golemcore.gateway.domain.sandbox.SandboxService;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.infrastructure.i18n.MessageService;
import me.golemcore.gateway.port.inbound.ChannelPort;
import me.golemcore.gateway.port.outbound.AgentPort;
import me.golemcore.gateway.security.AllowlistValidator;
import me.golemcore.gateway.security.FilenameSanitizer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Routes inbound chat events to the agent and relays its answers.
 *
 * <p>
 * Every message is captured into the conversation log on arrival, in arrival
 * order. Triggers (a private text message, a mention of the bot in a group, a
 * document upload) are then handled on a per-chat lane of the update executor:
 * one chat is served in order while other chats proceed in parallel. The agent
 * itself runs on the agent executor with a typing indicator shown for the
 * duration of the run.
 *
 * <p>
 * No exception escapes an event handler; failures are logged and reported to
 * the chat.
 */
@Service
@Slf4j
public class GatewayOrchestrator {

    static final String NON_TEXT_PLACEHOLDER = "[non-text message]";
    static final String UNKNOWN_SPEAKER = "unknown";

    private final ChannelPort channel;
    private final AgentPort agentPort;
    private final AllowlistValidator allowlistValidator;
    private final ConversationLogService conversationLog;
    private final AgentSessionStore sessionStore;
    private final SandboxService sandboxService;
    private final ArchiveExtractor archiveExtractor;
    private final PromptBuilder promptBuilder;
    private final ReplyFormatter replyFormatter;
    private final TypingIndicator typingIndicator;
    private final MessageService messageService;
    private final GatewayProperties properties;
    private final ExecutorService updateExecutor;
    private final ExecutorService agentExecutor;

    private final Map<Long, CompletableFuture<Void>> chatLanes = new ConcurrentHashMap<>();

    @SuppressWarnings("PMD.ExcessiveParameterList") // one collaborator per pipeline stage
    public GatewayOrchestrator(ChannelPort channel, AgentPort agentPort, AllowlistValidator allowlistValidator,
            ConversationLogService conversationLog, AgentSessionStore sessionStore, SandboxService sandboxService,
            ArchiveExtractor archiveExtractor, PromptBuilder promptBuilder, ReplyFormatter replyFormatter,
            TypingIndicator typingIndicator, MessageService messageService, GatewayProperties properties,
            @Qualifier("updateExecutor") ExecutorService updateExecutor,
            @Qualifier("agentExecutor") ExecutorService agentExecutor) {
        this.channel = channel;
        this.agentPort = agentPort;
        this.allowlistValidator = allowlistValidator;
        this.conversationLog = conversationLog;
        this.sessionStore = sessionStore;
        this.sandboxService = sandboxService;
        this.archiveExtractor = archiveExtractor;
        this.promptBuilder = promptBuilder;
        this.replyFormatter = replyFormatter;
        this.typingIndicator = typingIndicator;
        this.messageService = messageService;
        this.properties = properties;
        this.updateExecutor = updateExecutor;
        this.agentExecutor = agentExecutor;
    }

    /**
     * Inbound chat event published by a channel adapter.
     */
    public record InboundChatEvent(ChatEvent event, Instant timestamp) {

        public InboundChatEvent(ChatEvent event) {
            this(event, Instant.now());
        }
    }

    @EventListener
    public void onInboundEvent(InboundChatEvent inbound) {
        ChatEvent event = inbound.event();
        try {
            capture(event);
        } catch (RuntimeException e) { // NOSONAR - must not break the polling thread
            log.error("[Gateway] Failed to capture message for chat {}", event.getChatId(), e);
        }
        enqueue(event.getChatId(), () -> handle(event));
    }

    private void enqueue(long chatId, Runnable task) {
        CompletableFuture<Void> lane = chatLanes.compute(chatId, (key, tail) -> {
            CompletableFuture<Void> previous = tail != null ? tail : CompletableFuture.completedFuture(null);
            return previous.thenRunAsync(task, updateExecutor);
        });
        lane.whenComplete((ignored, error) -> chatLanes.remove(chatId, lane));
    }

    /**
     * Handle one inbound event. Never throws.
     */
    void handle(ChatEvent event) {
        try {
            if (event.hasDocument()) {
                handleDocument(event);
            } else {
                handleMessage(event);
            }
        } catch (RuntimeException e) { // NOSONAR - keep the lane alive
            log.error("[Gateway] Unhandled failure for chat {}", event.getChatId(), e);
            sendPlain(event.getChatId(), messageService.getMessage("agent.error", reasonOf(e)));
        }
    }

    // ==================== CAPTURE ====================

    /**
     * Authorize the chat through an allowed sender and append the message to the
     * chat's log when the chat is authorized.
     */
    void capture(ChatEvent event) {
        long chatId = event.getChatId();
        if (allowlistValidator.isAllowedUser(event.getSenderId(), event.getSenderUsername())) {
            allowlistValidator.authorizeChat(chatId);
        }
        if (!allowlistValidator.isAuthorizedChat(chatId, event.getChatUsername())) {
            log.debug("[Gateway] Chat {} not authorized; message not logged", chatId);
            return;
        }
        conversationLog.append(chatId, toEntry(event));
    }

    static ConversationEntry toEntry(ChatEvent event) {
        String speaker = event.getSenderHandle() != null ? event.getSenderHandle() : UNKNOWN_SPEAKER;
        String text = event.requestText();
        if (text.isEmpty()) {
            text = NON_TEXT_PLACEHOLDER;
        }
        return new ConversationEntry(speaker, text, event.getRepliedToSenderHandle());
    }

    // ==================== MESSAGES ====================

    private void handleMessage(ChatEvent event) {
        long chatId = event.getChatId();
        if (event.isSenderIsBot()) {
            log.debug("[Gateway] Ignoring bot message in chat {}", chatId);
            return;
        }
        if (!isTrigger(event)) {
            return;
        }
        if (!isAuthorized(event)) {
            log.info("[Gateway] Request denied: chat={}, sender={}", chatId, event.getSenderId());
            sendPlain(chatId, messageService.getMessage("access.denied"));
            return;
        }

        String prompt = promptBuilder.buildChatPrompt(event);
        log.info("[Gateway] Request: chat={}, type={}, text={}", chatId,
                event.isPrivateChat() ? "private" : "group_log", oneLine(event.requestText()));
        runAgentAndReply(chatId, prompt);
    }

    private boolean isTrigger(ChatEvent event) {
        if (event.isPrivateChat()) {
            return !event.requestText().isEmpty();
        }
        return isMentioned(event, channel.getBotIdentity());
    }

    private boolean isAuthorized(ChatEvent event) {
        return allowlistValidator.isAllowedUser(event.getSenderId(), event.getSenderUsername())
                || allowlistValidator.isAuthorizedChat(event.getChatId(), event.getChatUsername());
    }

    /**
     * A group message addresses the bot through an {@code @username} mention, a
     * text mention of the bot account, or a reply to one of the bot's messages.
     */
    static boolean isMentioned(ChatEvent event, BotIdentity bot) {
        if (!event.hasText()) {
            return false;
        }
        String username = bot.username() != null ? bot.username() : "";
        for (MessageEntity entity : event.entitiesOrEmpty()) {
            if (MessageEntity.MENTION.equals(entity.kind())) {
                String mention = stripLeadingAt(entity.slice(event.getText()));
                if (!username.isEmpty() && mention.toLowerCase(Locale.ROOT).equals(username.toLowerCase(Locale.ROOT))) {
                    return true;
                }
            } else if (MessageEntity.TEXT_MENTION.equals(entity.kind())
                    && entity.mentionedUserId() != null && entity.mentionedUserId() == bot.id()) {
                return true;
            }
        }
        return event.isRepliedToSenderIsBot() && event.getRepliedToSenderId() != null
                && event.getRepliedToSenderId() == bot.id();
    }

    private static String stripLeadingAt(String mention) {
        int start = 0;
        while (start < mention.length() && mention.charAt(start) == '@') {
            start++;
        }
        return mention.substring(start);
    }

    // ==================== DOCUMENTS ====================

    private void handleDocument(ChatEvent event) {
        long chatId = event.getChatId();
        AttachedDocument document = event.getAttachedDocument();
        String requestText = event.requestText().strip();
        if (requestText.isEmpty()) {
            requestText = messageService.getMessage("upload.default-request");
        }

        if (!isAuthorized(event)) {
            log.info("[Gateway] Upload denied: chat={}, sender={}", chatId, event.getSenderId());
            sendPlain(chatId, messageService.getMessage("access.denied"));
            return;
        }
        if (document.fileSize() != null && document.fileSize() > properties.getUploads().getMaxBytes()) {
            log.info("[Gateway] Upload rejected: {} bytes exceeds limit in chat {}", document.fileSize(), chatId);
            sendPlain(chatId, messageService.getMessage("upload.too-large"));
            return;
        }

        String fileName = FilenameSanitizer.sanitize(
                document.fileName() != null ? document.fileName() : document.fileUniqueId());
        Sandbox sandbox;
        int extracted;
        try {
            sandbox = prepareSandbox(chatId, fileName);
            Path destination = download(document, sandbox, fileName);
            extracted = unpack(destination, sandbox, fileName);
        } catch (UploadException e) {
            log.error("[Gateway] Upload {} failed for chat {}", e.getStage(), chatId, e);
            String key = e.getStage() == UploadException.Stage.DOWNLOAD
                    ? "upload.download-failed"
                    : "upload.process-failed";
            sendPlain(chatId, messageService.getMessage(key));
            return;
        }

        Path uploadedLink = sandbox.exposedLink().resolve(fileName);
        log.info("[Gateway] Document request: chat={}, file={}, extracted={}, text={}",
                chatId, fileName, extracted, oneLine(requestText));
        String prompt = promptBuilder.buildSandboxPrompt(sandbox, requestText, uploadedLink);
        if (prompt.isEmpty()) {
            String saved = extracted > 0
                    ? messageService.getMessage("upload.saved.extracted", uploadedLink.toString(),
                            String.valueOf(extracted))
                    : messageService.getMessage("upload.saved", uploadedLink.toString());
            sendPlain(chatId, saved);
            return;
        }
        runAgentAndReply(chatId, prompt);
    }

    private Sandbox prepareSandbox(long chatId, String fileName) {
        try {
            return sandboxService.ensure(chatId);
        } catch (RuntimeException e) {
            throw new UploadException(UploadException.Stage.EXTRACTION, "No sandbox for " + fileName, e);
        }
    }

    private Path download(AttachedDocument document, Sandbox sandbox, String fileName) {
        Path destination = sandbox.uploadsPath().resolve(fileName);
        try {
            channel.downloadDocument(document.fileId(), destination);
            return destination;
        } catch (IOException | RuntimeException e) {
            throw new UploadException(UploadException.Stage.DOWNLOAD, "Failed to download " + fileName, e);
        }
    }

    /**
     * Extract an archive into {@code work/}, or copy the file there verbatim
     * when it is not an archive.
     */
    private int unpack(Path uploaded, Sandbox sandbox, String fileName) {
        try {
            int extracted = archiveExtractor.extract(uploaded, sandbox.workPath());
            if (extracted == 0) {
                Path target = sandbox.workPath().resolve(fileName);
                if (!target.equals(uploaded)) {
                    Files.copy(uploaded, target, StandardCopyOption.REPLACE_EXISTING,
                            StandardCopyOption.COPY_ATTRIBUTES);
                }
            }
            return extracted;
        } catch (IOException | RuntimeException e) {
            throw new UploadException(UploadException.Stage.EXTRACTION, "Failed to process " + fileName, e);
        }
    }

    // ==================== AGENT RUN ====================

    /**
     * Run the agent with a typing indicator and reply with its answer.
     */
    void runAgentAndReply(long chatId, String prompt) {
        String previousSession = sessionStore.get(chatId).orElse(null);
        String answer = null;
        long startedAt = System.nanoTime();
        try (TypingIndicator.Handle typing = typingIndicator.start(channel, chatId)) {
            AgentInvocationResult result = invokeAgent(prompt, previousSession);
            bindSession(chatId, previousSession, result.session().orElse(null));

            answer = result.answer().orElse(null);
            if (answer == null) {
                throw new EmptyResponseException(messageService.getMessage("agent.empty-response"));
            }
            replyFormatter.reply(channel, chatId, answer, true);
            log.info("[Gateway] Response sent: chat={}, elapsed={}ms, text={}", chatId,
                    (System.nanoTime() - startedAt) / 1_000_000, oneLine(answer));
        } catch (ReplyFormatRejectedException e) {
            log.warn("[Gateway] Markdown rejected for chat {}, resending as plain text", chatId);
            sendPlain(chatId, answer != null ? answer : messageService.getMessage("agent.invalid-markdown"));
        } catch (RuntimeException e) { // NOSONAR - every failure is reported to the chat
            log.error("[Gateway] Handler error for chat {}", chatId, e);
            sendPlain(chatId, messageService.getMessage("agent.error", reasonOf(e)));
        }
    }

    private AgentInvocationResult invokeAgent(String prompt, String sessionId) {
        Path workdir = sandboxService.getAgentWorkdir();
        Future<AgentInvocationResult> future = agentExecutor.submit(
                () -> agentPort.invoke(prompt, workdir, sessionId));
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new AgentInvocationException("Agent run interrupted", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new AgentInvocationException("Agent run failed: " + e.getCause().getMessage(), e.getCause());
        }
    }

    /**
     * Keep the chat's sandbox in step with the agent session: a changed session
     * gets a fresh sandbox, a first session adopts its id for a new sandbox.
     */
    void bindSession(long chatId, String previousSession, String newSession) {
        if (newSession == null) {
            if (previousSession == null) {
                log.warn("[Gateway] No session id returned from agent for chat {}", chatId);
            }
            return;
        }
        if (previousSession != null && !previousSession.equals(newSession)) {
            log.info("[Gateway] Session changed for chat {}: {} -> {}", chatId, previousSession, newSession);
            sandboxService.ensure(chatId, newSession, true);
        } else if (previousSession == null && sandboxService.find(chatId).isEmpty()) {
            sandboxService.ensure(chatId, newSession);
        }
        sessionStore.set(chatId, newSession);
    }

    private void sendPlain(long chatId, String text) {
        try {
            replyFormatter.reply(channel, chatId, text, false);
        } catch (RuntimeException e) {
            log.error("[Gateway] Failed to send reply to chat {}", chatId, e);
        }
    }

    private static String reasonOf(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static String oneLine(String text) {
        return text.replace("\n", "\\n");
    }
}
