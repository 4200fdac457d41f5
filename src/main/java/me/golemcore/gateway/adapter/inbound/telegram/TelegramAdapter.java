package me.golemcore.gateway.adapter.inbound.telegram;

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

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.exception.ReplyFormatRejectedException;
import me.golemcore.gateway.domain.model.AttachedDocument;
import me.golemcore.gateway.domain.model.BotIdentity;
import me.golemcore.gateway.domain.model.ChatEvent;
import me.golemcore.gateway.domain.model.ChatType;
import me.golemcore.gateway.domain.model.FormatMode;
import me.golemcore.gateway.domain.model.MessageEntity;
import me.golemcore.gateway.domain.service.GatewayOrchestrator;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.inbound.ChannelPort;
import me.golemcore.gateway.port.inbound.CommandPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.longpolling.util.LongPollingSingleThreadUpdateConsumer;
import org.telegram.telegrambots.meta.api.methods.ActionType;
import org.telegram.telegrambots.meta.api.methods.GetFile;
import org.telegram.telegrambots.meta.api.methods.GetMe;
import org.telegram.telegrambots.meta.api.methods.ParseMode;
import org.telegram.telegrambots.meta.api.methods.send.SendChatAction;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.Document;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Telegram channel adapter using long polling.
 *
 * <p>
 * Implements {@link ChannelPort} for outbound replies and
 * {@link LongPollingSingleThreadUpdateConsumer} for inbound updates. Slash
 * commands known to the {@link CommandPort} are answered here; every other
 * message is translated into a {@link ChatEvent} and published as a
 * {@link GatewayOrchestrator.InboundChatEvent}.
 *
 * <p>
 * Rate-limited calls (HTTP 429) are retried up to three times, honoring the
 * {@code retry_after} hint.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TelegramAdapter implements ChannelPort, LongPollingSingleThreadUpdateConsumer {

    private static final String CHANNEL_TYPE = "telegram";
    private static final String FILE_URL_TEMPLATE = "https://api.telegram.org/file/bot%s/%s";
    private static final int HTTP_BAD_REQUEST = 400;
    private static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final int MAX_RETRY_ATTEMPTS = 3;
    private static final int RETRY_AFTER_CAP_SECONDS = 30;
    private static final int RETRY_AFTER_DEFAULT_SECONDS = 5;
    private static final Pattern RETRY_AFTER_PATTERN = Pattern.compile("retry after (\\d+)");

    private final GatewayProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final TelegramBotsLongPollingApplication botsApplication;
    private final ObjectProvider<CommandPort> commandRouter;

    private TelegramClient telegramClient;
    private volatile BotIdentity botIdentity;
    private volatile boolean running = false;
    private final Object lifecycleLock = new Object();

    /**
     * Package-private setter for testing, allows injecting a mock client.
     */
    void setTelegramClient(TelegramClient client) {
        this.telegramClient = client;
    }

    private String token() {
        return properties.getTelegram().getToken();
    }

    private synchronized TelegramClient client() {
        if (telegramClient == null) {
            String token = token();
            if (token == null || token.isBlank()) {
                throw new IllegalStateException("Telegram token not configured");
            }
            telegramClient = new OkHttpTelegramClient(token);
        }
        return telegramClient;
    }

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                log.debug("Telegram adapter already running");
                return;
            }
            if (!properties.getTelegram().isEnabled()) {
                log.info("Telegram channel disabled");
                return;
            }
            try {
                client();
                botsApplication.registerBot(token(), this);
                running = true;
                BotIdentity identity = getBotIdentity();
                log.info("Telegram adapter started as @{} (id {})", identity.username(), identity.id());
            } catch (TelegramApiException | RuntimeException e) {
                log.error("Failed to start Telegram adapter", e);
            }
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            running = false;
            try {
                botsApplication.close();
                log.info("Telegram adapter stopped");
            } catch (Exception e) {
                log.error("Error stopping Telegram adapter", e);
            }
        }
    }

    @PreDestroy
    public void destroy() {
        stop();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // ==================== INBOUND ====================

    @Override
    public void consume(Update update) {
        Message message = null;
        if (update.hasMessage()) {
            message = update.getMessage();
        } else if (update.hasChannelPost()) {
            message = update.getChannelPost();
        }
        if (message == null) {
            return;
        }
        try {
            if (message.hasText() && handleCommand(message)) {
                return;
            }
            eventPublisher.publishEvent(new GatewayOrchestrator.InboundChatEvent(toChatEvent(message)));
        } catch (RuntimeException e) { // NOSONAR - never break the polling loop
            log.error("Failed to process update {}", update.getUpdateId(), e);
        }
    }

    /**
     * Answer the message if it is a command the router knows.
     *
     * @return {@code true} if the message was consumed as a command
     */
    private boolean handleCommand(Message message) {
        String text = message.getText();
        if (!text.startsWith("/")) {
            return false;
        }
        String[] parts = text.split("\\s+", 2);
        String cmd = parts[0].substring(1).split("@")[0];
        CommandPort router = commandRouter.getIfAvailable();
        if (router == null || !router.hasCommand(cmd)) {
            return false;
        }

        long chatId = message.getChatId();
        List<String> args = parts.length > 1 ? Arrays.asList(parts[1].split("\\s+")) : List.of();
        Map<String, Object> ctx = new HashMap<>();
        ctx.put(CommandPort.CTX_CHAT_ID, chatId);
        User from = message.getFrom();
        if (from != null) {
            ctx.put(CommandPort.CTX_SENDER_ID, from.getId());
            ctx.put(CommandPort.CTX_SENDER_USERNAME, from.getUserName());
        }
        try {
            CommandPort.CommandResult result = router.execute(cmd, args, ctx);
            sendText(chatId, result.output(), FormatMode.PLAIN, true);
        } catch (RuntimeException e) {
            log.error("Command execution failed: /{}", cmd, e);
        }
        return true;
    }

    static ChatEvent toChatEvent(Message message) {
        User from = message.getFrom();
        Message replyTo = message.getReplyToMessage();
        User replyFrom = replyTo != null ? replyTo.getFrom() : null;

        ChatEvent.ChatEventBuilder builder = ChatEvent.builder()
                .chatId(message.getChatId())
                .chatType(message.getChat() != null ? ChatType.fromTelegram(message.getChat().getType()) : null)
                .chatUsername(message.getChat() != null ? message.getChat().getUserName() : null)
                .text(message.getText())
                .caption(message.getCaption())
                .entities(toEntities(message.getEntities()));

        if (from != null) {
            builder.senderId(from.getId())
                    .senderUsername(from.getUserName())
                    .senderHandle(displayName(from))
                    .senderIsBot(Boolean.TRUE.equals(from.getIsBot()));
        }
        if (replyFrom != null) {
            builder.repliedToSenderId(replyFrom.getId())
                    .repliedToSenderHandle(displayName(replyFrom))
                    .repliedToSenderIsBot(Boolean.TRUE.equals(replyFrom.getIsBot()));
        }
        if (message.hasDocument()) {
            Document document = message.getDocument();
            builder.attachedDocument(new AttachedDocument(document.getFileId(), document.getFileUniqueId(),
                    document.getFileName(), document.getFileSize()));
        }
        return builder.build();
    }

    private static List<MessageEntity> toEntities(
            List<org.telegram.telegrambots.meta.api.objects.MessageEntity> entities) {
        if (entities == null) {
            return List.of();
        }
        List<MessageEntity> result = new ArrayList<>(entities.size());
        for (org.telegram.telegrambots.meta.api.objects.MessageEntity entity : entities) {
            Long userId = entity.getUser() != null ? entity.getUser().getId() : null;
            int offset = entity.getOffset() != null ? entity.getOffset() : 0;
            int length = entity.getLength() != null ? entity.getLength() : 0;
            result.add(new MessageEntity(entity.getType(), offset, length, userId));
        }
        return result;
    }

    /**
     * Username, else first name, else last name, else numeric id.
     */
    static String displayName(User user) {
        if (user.getUserName() != null && !user.getUserName().isEmpty()) {
            return user.getUserName();
        }
        if (user.getFirstName() != null && !user.getFirstName().isEmpty()) {
            return user.getFirstName();
        }
        if (user.getLastName() != null && !user.getLastName().isEmpty()) {
            return user.getLastName();
        }
        return String.valueOf(user.getId());
    }

    // ==================== OUTBOUND ====================

    @Override
    public void sendText(long chatId, String text, FormatMode formatMode, boolean suppressLinkPreview) {
        boolean markdown = formatMode == FormatMode.MARKDOWN;
        SendMessage sendMessage = SendMessage.builder()
                .chatId(String.valueOf(chatId))
                .text(text)
                .parseMode(markdown ? ParseMode.MARKDOWN : null)
                .disableWebPagePreview(suppressLinkPreview)
                .build();
        try {
            executeWithRetry(() -> client().execute(sendMessage));
        } catch (TelegramApiRequestException e) {
            if (markdown && isBadRequest(e)) {
                throw new ReplyFormatRejectedException("Telegram rejected markdown: " + e.getApiResponse(), e);
            }
            throw new IllegalStateException("Failed to send message to chat " + chatId, e);
        } catch (TelegramApiException e) {
            throw new IllegalStateException("Failed to send message to chat " + chatId, e);
        }
    }

    @Override
    public void sendTyping(long chatId) {
        try {
            SendChatAction action = SendChatAction.builder()
                    .chatId(String.valueOf(chatId))
                    .action(ActionType.TYPING.toString())
                    .build();
            executeWithRetry(() -> client().execute(action));
        } catch (Exception e) {
            log.debug("Failed to send typing indicator", e);
        }
    }

    @Override
    public void downloadDocument(String fileId, Path destination) throws IOException {
        org.telegram.telegrambots.meta.api.objects.File file;
        try {
            GetFile getFile = new GetFile(fileId);
            file = executeWithRetry(() -> client().execute(getFile));
        } catch (TelegramApiException e) {
            throw new IOException("Failed to resolve file " + fileId, e);
        }

        String fileUrl = String.format(FILE_URL_TEMPLATE, token(), file.getFilePath());
        Files.createDirectories(destination.getParent());
        try (InputStream is = URI.create(fileUrl).toURL().openStream()) {
            long bytes = Files.copy(is, destination, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Downloaded {} ({} bytes)", destination.getFileName(), bytes);
        }
    }

    @Override
    public BotIdentity getBotIdentity() {
        BotIdentity identity = botIdentity;
        if (identity != null) {
            return identity;
        }
        synchronized (this) {
            if (botIdentity == null) {
                try {
                    User me = executeWithRetry(() -> client().execute(new GetMe()));
                    botIdentity = new BotIdentity(me.getId(), me.getUserName() != null ? me.getUserName() : "");
                    log.info("Resolved bot identity: id={}, username={}", me.getId(), me.getUserName());
                } catch (TelegramApiException e) {
                    throw new IllegalStateException("Failed to resolve bot identity", e);
                }
            }
            return botIdentity;
        }
    }

    // ===== Rate-limit retry logic =====

    @FunctionalInterface
    interface TelegramApiCall<T> {
        T execute() throws TelegramApiException;
    }

    <T> T executeWithRetry(TelegramApiCall<T> call) throws TelegramApiException {
        for (int attempt = 0;; attempt++) {
            try {
                return call.execute();
            } catch (TelegramApiRequestException e) {
                if (!isRateLimited(e) || attempt >= MAX_RETRY_ATTEMPTS) {
                    throw e;
                }
                int retryAfter = extractRetryAfterSeconds(e);
                log.warn("[Telegram] Rate limited (429), waiting {}s before retry (attempt {}/{})",
                        retryAfter, attempt + 1, MAX_RETRY_ATTEMPTS);
                sleepForRetry(retryAfter);
            }
        }
    }

    private static boolean isRateLimited(TelegramApiRequestException e) {
        Integer errorCode = e.getErrorCode();
        return errorCode != null && errorCode == HTTP_TOO_MANY_REQUESTS;
    }

    private static boolean isBadRequest(TelegramApiRequestException e) {
        Integer errorCode = e.getErrorCode();
        return errorCode != null && errorCode == HTTP_BAD_REQUEST;
    }

    int extractRetryAfterSeconds(TelegramApiRequestException e) {
        if (e.getParameters() != null && e.getParameters().getRetryAfter() != null) {
            return Math.min(e.getParameters().getRetryAfter(), RETRY_AFTER_CAP_SECONDS);
        }
        String message = e.getMessage();
        if (message != null) {
            Matcher matcher = RETRY_AFTER_PATTERN.matcher(message);
            if (matcher.find()) {
                return Math.min(Integer.parseInt(matcher.group(1)), RETRY_AFTER_CAP_SECONDS);
            }
        }
        return RETRY_AFTER_DEFAULT_SECONDS;
    }

    /**
     * Package-private for testing, allows tests to override sleep behavior.
     */
    void sleepForRetry(int seconds) {
        try {
            Thread.sleep(seconds * 1000L);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
