package me.golemcore.gateway.adapter.outbound.agent;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.exception.AgentInvocationException;
import me.golemcore.gateway.domain.model.AgentInvocationResult;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.AgentPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link AgentPort} backed by a {@code codex exec} style command line tool.
 *
 * <p>
 * A fresh run starts the agent in {@code workdir} and prefixes the prompt with
 * the configured system prompt. A resumed run continues an earlier session and
 * is started with {@code workdir} as its current directory. In both cases the
 * prompt is written to standard input and the agent reports progress as one
 * JSON event per output line.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CodexAgentAdapter implements AgentPort {

    static final String DEFAULT_FAILURE_MESSAGE = "agent exec failed";

    private final GatewayProperties properties;
    private final AgentProcessRunner processRunner;
    private final AgentStreamParser streamParser;

    @Override
    public AgentInvocationResult invoke(String prompt, Path workdir, String sessionId, boolean allowFailure) {
        boolean resume = sessionId != null && !sessionId.isEmpty();
        List<String> command = buildCommand(workdir, sessionId);
        String input = resume ? prompt : withSystemPrompt(prompt);
        Path processDir = resume ? workdir : null;

        log.info("[Agent] {} session{} (prompt: {} chars)",
                resume ? "Resuming" : "Starting new", resume ? " " + sessionId : "", prompt.length());
        log.debug("[Agent] Command: {}", command);

        ProcessResult result;
        try {
            result = processRunner.run(command, input, processDir, Map.of());
        } catch (IOException e) {
            throw new AgentInvocationException("Failed to start agent process: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentInvocationException("Agent process interrupted", e);
        }

        if (!result.isSuccess()) {
            String error = result.stderr() == null ? "" : result.stderr().strip();
            if (error.isEmpty()) {
                error = DEFAULT_FAILURE_MESSAGE;
            }
            log.warn("[Agent] Process exited with code {}: {}", result.exitCode(), error);
            if (!allowFailure) {
                throw new AgentInvocationException(error, result.exitCode());
            }
            return AgentInvocationResult.failure(error, sessionId);
        }

        AgentStreamParser.StreamOutcome outcome = streamParser.parse(result.stdout());
        String answer = outcome.answer() == null ? null : outcome.answer().strip();
        if (answer != null && answer.isEmpty()) {
            answer = null;
        }
        String resultSessionId = outcome.sessionId() != null ? outcome.sessionId() : sessionId;
        log.info("[Agent] Finished: session={}, answer={} chars", resultSessionId,
                answer == null ? 0 : answer.length());
        return AgentInvocationResult.answer(answer, resultSessionId);
    }

    List<String> buildCommand(Path workdir, String sessionId) {
        GatewayProperties.AgentProperties agent = properties.getAgent();
        List<String> command = new ArrayList<>();
        command.add(agent.getExecutable());
        command.addAll(agent.getGlobalArgs());
        command.add("exec");
        if (sessionId != null && !sessionId.isEmpty()) {
            command.add("resume");
            command.add(sessionId);
            command.add("--json");
        } else {
            command.add("--json");
            command.add("-C");
            command.add(workdir.toString());
        }
        String model = agent.getModel();
        if (model != null && !model.isBlank()) {
            command.add("--model");
            command.add(model.strip());
        }
        command.add("-");
        return command;
    }

    private String withSystemPrompt(String prompt) {
        String systemPrompt = properties.getAgent().getSystemPrompt();
        if (systemPrompt == null || systemPrompt.isBlank()) {
            return prompt;
        }
        return systemPrompt.strip() + "\n\n" + prompt;
    }
}
