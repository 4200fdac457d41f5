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
import me.golemcore.gateway.domain.model.FormatMode;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.inbound.ChannelPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits long answers into platform-sized chunks and dispatches them.
 *
 * <p>
 * Markdown is only used when the whole answer fits the stricter markdown
 * limit; longer answers fall back to plain text under the larger plain limit
 * so no rich chunk can exceed what the platform accepts.
 */
@Component
@Slf4j
public class ReplyFormatter {

    private static final double MIN_SPLIT_RATIO = 0.4;

    private final int maxPlainLength;
    private final int maxMarkdownLength;

    @Autowired
    public ReplyFormatter(GatewayProperties properties) {
        this(properties.getReply().getMaxPlainLength(), properties.getReply().getMaxMarkdownLength());
    }

    public ReplyFormatter(int maxPlainLength, int maxMarkdownLength) {
        this.maxPlainLength = maxPlainLength;
        this.maxMarkdownLength = maxMarkdownLength;
    }

    /**
     * Split text at the last newline within {@code limit}, or hard-split at
     * {@code limit} when there is none or it would leave a chunk shorter than 40%
     * of the limit. The newline a split consumed is not part of either chunk.
     */
    public static List<String> split(String text, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        if (text == null || text.isEmpty()) {
            return List.of("");
        }

        List<String> parts = new ArrayList<>();
        String remaining = text;
        int minCut = (int) (limit * MIN_SPLIT_RATIO);
        while (!remaining.isEmpty()) {
            if (remaining.length() <= limit) {
                parts.add(remaining);
                break;
            }
            int cut = remaining.lastIndexOf('\n', limit);
            if (cut == -1 || cut < minCut) {
                cut = limit;
            }
            parts.add(remaining.substring(0, cut));
            remaining = remaining.substring(cut);
            if (remaining.startsWith("\n")) {
                remaining = remaining.substring(1);
            }
        }
        return parts;
    }

    /**
     * Send {@code text} to the chat in order-preserving chunks. Each send is
     * independent; a failure stops the remaining chunks and propagates.
     */
    public void reply(ChannelPort channel, long chatId, String text, boolean formatted) {
        if (text == null || text.isEmpty()) {
            return;
        }
        FormatMode mode = FormatMode.PLAIN;
        int limit = maxPlainLength;
        if (formatted && text.length() <= maxMarkdownLength) {
            mode = FormatMode.MARKDOWN;
            limit = maxMarkdownLength;
        } else if (formatted) {
            log.debug("[Reply] {} chars exceed markdown limit {}, sending plain", text.length(), maxMarkdownLength);
        }

        List<String> chunks = split(text, limit);
        for (String chunk : chunks) {
            channel.sendText(chatId, chunk, mode, true);
        }
        log.debug("[Reply] Sent {} chunk(s) to chat {} as {}", chunks.size(), chatId, mode);
    }
}
