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

import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps a chat to the agent session id that continues its conversation.
 * Last write wins; entries live for the process lifetime.
 */
@Service
public class AgentSessionStore {

    private final Map<Long, String> sessions = new ConcurrentHashMap<>();

    public Optional<String> get(long chatId) {
        return Optional.ofNullable(sessions.get(chatId));
    }

    /**
     * Record the session for a chat, replacing any previous one.
     *
     * @throws IllegalArgumentException
     *             if {@code sessionId} is null or empty; callers drop absent ids
     *             before storing
     */
    public void set(long chatId, String sessionId) {
        if (sessionId == null || sessionId.isEmpty()) {
            throw new IllegalArgumentException("sessionId must not be empty");
        }
        sessions.put(chatId, sessionId);
    }
}
