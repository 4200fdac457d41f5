package me.golemcore.gateway.security;

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
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decides who may talk to the agent and in which chats.
 *
 * <p>
 * A chat becomes authorized either by being listed in {@code allow-from} or as
 * a side effect of an allowed user writing in it. Authorization lasts for the
 * process lifetime.
 */
@Component
@Slf4j
public class AllowlistValidator {

    private final AllowlistEntries entries;
    private final Set<Long> authorizedChats = ConcurrentHashMap.newKeySet();

    @Autowired
    public AllowlistValidator(GatewayProperties properties) {
        this(AllowlistEntries.parse(properties.getTelegram().getAllowFrom()));
    }

    AllowlistValidator(AllowlistEntries entries) {
        this.entries = entries;
        this.authorizedChats.addAll(entries.chatIds());
        if (!entries.unresolved().isEmpty()) {
            log.warn("[Security] Ignoring allow-from entries: {}", String.join(", ", entries.unresolved()));
        }
        log.info("[Security] Allowlist: users={}, chats={}, usernames={}, chatUsernames={}",
                entries.userIds(), entries.chatIds(), entries.usernames(), entries.chatUsernames());
    }

    public AllowlistEntries getEntries() {
        return entries;
    }

    /**
     * Check if a sender is allowed by id or (case-insensitive) username.
     */
    public boolean isAllowedUser(Long userId, String username) {
        if (userId != null && entries.userIds().contains(userId)) {
            return true;
        }
        boolean allowed = username != null && !username.isEmpty()
                && entries.usernames().contains(username.toLowerCase(Locale.ROOT));
        log.trace("[Security] Allowlist check: user={}, username={}, allowed={}", userId, username, allowed);
        return allowed;
    }

    /**
     * Check if a chat is authorized by id or by its public username.
     */
    public boolean isAuthorizedChat(long chatId, String chatUsername) {
        if (authorizedChats.contains(chatId)) {
            return true;
        }
        return chatUsername != null && !chatUsername.isEmpty()
                && entries.chatUsernames().contains(chatUsername.toLowerCase(Locale.ROOT));
    }

    public void authorizeChat(long chatId) {
        if (authorizedChats.add(chatId)) {
            log.debug("[Security] Authorized chat {} via allowed user", chatId);
        }
    }
}
