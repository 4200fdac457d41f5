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

import lombok.RequiredArgsConstructor;
import me.golemcore.gateway.domain.model.ChatEvent;
import me.golemcore.gateway.domain.model.Sandbox;
import me.golemcore.gateway.domain.sandbox.SandboxService;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Assembles the prompt handed to the agent.
 *
 * <p>
 * A private chat sends the message text as is; a group sends the rendered
 * conversation log. When the chat has a sandbox with files in it, a sandbox
 * block naming the request, the sandbox link and the available files is
 * appended after a blank line.
 */
@Component
@RequiredArgsConstructor
public class PromptBuilder {

    static final String SANDBOX_SKILL_MARKER = "$log-archive-triage";

    private final ConversationLogService conversationLog;
    private final SandboxService sandboxService;
    private final GatewayProperties properties;

    public String buildChatPrompt(ChatEvent event) {
        String requestText = event.requestText();
        String prompt = event.isPrivateChat() ? requestText : conversationLog.render(event.getChatId());
        Optional<Sandbox> sandbox = sandboxService.find(event.getChatId());
        if (sandbox.isPresent()) {
            String block = buildSandboxPrompt(sandbox.get(), requestText, null);
            if (!block.isEmpty()) {
                prompt = prompt + "\n\n" + block;
            }
        }
        return prompt;
    }

    /**
     * Sandbox block, or an empty string when the sandbox holds no files yet.
     *
     * @param uploadedFile
     *            path of the file that triggered the request, or {@code null}
     */
    public String buildSandboxPrompt(Sandbox sandbox, String requestText, Path uploadedFile) {
        List<String> files = sandboxService.listFiles(sandbox, properties.getSandbox().getMaxListedFiles());
        if (files.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        sb.append(SANDBOX_SKILL_MARKER).append('\n');
        sb.append("Request: ").append(requestText).append('\n');
        sb.append("Sandbox path: ").append(sandbox.exposedLink()).append('\n');
        if (uploadedFile != null) {
            sb.append("Uploaded file: ").append(uploadedFile).append('\n');
        }
        sb.append("Files available in the sandbox:");
        for (String file : files) {
            sb.append("\n- ").append(file);
        }
        return sb.toString();
    }
}
