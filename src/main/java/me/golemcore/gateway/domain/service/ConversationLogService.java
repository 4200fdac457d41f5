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
import me.golemcore.gateway.domain.model.ConversationEntry;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Bounded ring buffer of recent messages per chat, used to build group-context
 * prompts.
 *
 * <p>
 * Each chat keeps at most {@code maxEntries} entries; the oldest entry is
 * evicted first. Each chat's log is replaced atomically with an immutable
 * copy, so readers never observe a partial update.
 */
@Service
@Slf4j
public class ConversationLogService {

    public static final int DEFAULT_MAX_ENTRIES = 30;

    private final int maxEntries;
    private final Map<Long, List<ConversationEntry>> logs = new ConcurrentHashMap<>();

    @Autowired
    public ConversationLogService(GatewayProperties properties) {
        this(properties.getConversation().getMaxLogEntries());
    }

    public ConversationLogService(int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        this.maxEntries = maxEntries;
    }

    public void append(long chatId, ConversationEntry entry) {
        logs.compute(chatId, (key, existing) -> {
            List<ConversationEntry> entries = existing != null ? new ArrayList<>(existing) : new ArrayList<>();
            entries.add(entry);
            int overflow = entries.size() - maxEntries;
            if (overflow > 0) {
                entries.subList(0, overflow).clear();
            }
            return List.copyOf(entries);
        });
        log.trace("[ConversationLog] Appended entry for chat {}", chatId);
    }

    /**
     * Returns an immutable snapshot of the chat's entries in send order.
     */
    public List<ConversationEntry> entries(long chatId) {
        return logs.getOrDefault(chatId, List.of());
    }

    /**
     * Renders the transcript: a fixed header followed by one bullet per entry.
     */
    public String render(long chatId) {
        String header = "Chat log (last " + maxEntries + " messages, in send order):\n";
        String body = entries(chatId).stream()
                .map(entry -> "- " + entry.toLine())
                .collect(Collectors.joining("\n"));
        return header + body;
    }

    public int getMaxEntries() {
        return maxEntries;
    }
}
