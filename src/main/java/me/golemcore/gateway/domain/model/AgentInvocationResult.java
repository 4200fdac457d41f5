package me.golemcore.gateway.domain.model;

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

import java.util.Optional;

/**
 * Outcome of a single agent process run.
 */
public record AgentInvocationResult(
        String answerText,
        String sessionId,
        String errorText) {

    public static AgentInvocationResult answer(String answerText, String sessionId) {
        return new AgentInvocationResult(answerText, sessionId, null);
    }

    public static AgentInvocationResult failure(String errorText, String sessionId) {
        return new AgentInvocationResult(null, sessionId, errorText);
    }

    public Optional<String> answer() {
        return Optional.ofNullable(answerText).filter(text -> !text.isEmpty());
    }

    public Optional<String> session() {
        return Optional.ofNullable(sessionId).filter(id -> !id.isEmpty());
    }

    public boolean hasError() {
        return errorText != null;
    }
}
