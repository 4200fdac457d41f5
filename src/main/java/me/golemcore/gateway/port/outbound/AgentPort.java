package me.golemcore.gateway.port.outbound;

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

import me.golemcore.gateway.domain.model.AgentInvocationResult;

import java.nio.file.Path;

/**
 * Port to the external reasoning agent process.
 */
public interface AgentPort {

    /**
     * Runs the agent to completion and returns its final answer.
     *
     * @param prompt
     *            prompt written to the process's standard input
     * @param workdir
     *            directory the agent operates in
     * @param sessionId
     *            session to resume, or {@code null} for a fresh run
     * @throws me.golemcore.gateway.domain.exception.AgentInvocationException
     *             if the process cannot be started or exits non-zero
     */
    default AgentInvocationResult invoke(String prompt, Path workdir, String sessionId) {
        return invoke(prompt, workdir, sessionId, false);
    }

    /**
     * Runs the agent; with {@code allowFailure} a non-zero exit is reported in
     * {@link AgentInvocationResult#errorText()} instead of being thrown.
     */
    AgentInvocationResult invoke(String prompt, Path workdir, String sessionId, boolean allowFailure);
}
