package me.golemcore.gateway.port.inbound;

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

import me.golemcore.gateway.domain.model.BotIdentity;
import me.golemcore.gateway.domain.model.FormatMode;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Bidirectional port for the chat platform. Implementations manage connection
 * lifecycle and translate native updates into
 * {@link me.golemcore.gateway.domain.model.ChatEvent}s; the orchestrator uses
 * the outbound half to reply.
 *
 * <p>
 * Every outbound operation is independently fallible: a failed send does not
 * roll back earlier sends.
 */
public interface ChannelPort {

    /**
     * Returns the channel type identifier (e.g., "telegram").
     */
    String getChannelType();

    /**
     * Starts listening for incoming updates from the channel.
     */
    void start();

    /**
     * Stops listening for updates and disconnects from the channel.
     */
    void stop();

    /**
     * Checks if the channel is currently active and listening.
     */
    boolean isRunning();

    /**
     * Sends a single text message. The text must already fit the platform's
     * message size limit.
     *
     * @throws me.golemcore.gateway.domain.exception.ReplyFormatRejectedException
     *             if {@code formatMode} is rich and the platform rejected the
     *             markup
     */
    void sendText(long chatId, String text, FormatMode formatMode, boolean suppressLinkPreview);

    /**
     * Shows a typing indicator in the chat. Best effort; implementations must not
     * throw.
     */
    void sendTyping(long chatId);

    /**
     * Downloads an attached document to {@code destination}.
     */
    void downloadDocument(String fileId, Path destination) throws IOException;

    /**
     * Returns the bot account identity, resolving it on first use.
     */
    BotIdentity getBotIdentity();
}
