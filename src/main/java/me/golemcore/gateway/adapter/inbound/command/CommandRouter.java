package me.golemcore.gateway.adapter.inbound.command;

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
import me.golemcore.gateway.domain.model.Sandbox;
import me.golemcore.gateway.domain.sandbox.SandboxService;
import me.golemcore.gateway.domain.service.AgentSessionStore;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.infrastructure.i18n.MessageService;
import me.golemcore.gateway.port.inbound.CommandPort;
import me.golemcore.gateway.security.AllowlistValidator;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Slash commands answered directly by the gateway, without the agent.
 *
 * <p>
 * Only allowed users may run commands; anyone else gets the access-denied
 * reply. Running a command as an allowed user also authorizes the chat.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CommandRouter implements CommandPort {

    private static final String CMD_HELP = "help";
    private static final String CMD_STATUS = "status";

    private final AllowlistValidator allowlistValidator;
    private final AgentSessionStore sessionStore;
    private final SandboxService sandboxService;
    private final MessageService messageService;
    private final GatewayProperties properties;

    @Override
    public CommandResult execute(String command, List<String> args, Map<String, Object> context) {
        Long chatId = (Long) context.get(CTX_CHAT_ID);
        Long senderId = (Long) context.get(CTX_SENDER_ID);
        String senderUsername = (String) context.get(CTX_SENDER_USERNAME);

        if (!allowlistValidator.isAllowedUser(senderId, senderUsername)) {
            log.info("[Command] /{} denied for user {} in chat {}", command, senderId, chatId);
            return CommandResult.failure(msg("access.denied"));
        }
        if (chatId != null) {
            allowlistValidator.authorizeChat(chatId);
        }
        log.debug("[Command] /{} in chat {}", command, chatId);

        return switch (command) {
        case CMD_HELP -> handleHelp();
        case CMD_STATUS -> handleStatus(chatId);
        default -> CommandResult.failure(msg("command.unknown", command));
        };
    }

    @Override
    public boolean hasCommand(String command) {
        return CMD_HELP.equals(command) || CMD_STATUS.equals(command);
    }

    @Override
    public List<CommandDefinition> listCommands() {
        return List.of(
                new CommandDefinition(CMD_HELP, msg("command.help.description")),
                new CommandDefinition(CMD_STATUS, msg("command.status.description")));
    }

    private CommandResult handleHelp() {
        StringBuilder sb = new StringBuilder();
        sb.append(msg("command.help.header")).append("\n");
        for (CommandDefinition definition : listCommands()) {
            sb.append('/').append(definition.name()).append(" - ").append(definition.description()).append("\n");
        }
        return CommandResult.success(sb.toString().trim());
    }

    private CommandResult handleStatus(Long chatId) {
        GatewayProperties.AgentProperties agent = properties.getAgent();
        String none = msg("command.status.none");
        String model = agent.getModel() == null || agent.getModel().isBlank()
                ? msg("command.status.default-model")
                : agent.getModel();
        String session = chatId != null ? sessionStore.get(chatId).orElse(none) : none;
        String sandbox = chatId != null
                ? sandboxService.find(chatId).map(Sandbox::exposedLink).map(Object::toString).orElse(none)
                : none;
        return CommandResult.success(msg("command.status",
                agent.getExecutable(), model, sandboxService.getAgentWorkdir().toString(), session, sandbox));
    }

    private String msg(String key, Object... args) {
        return messageService.getMessage(key, args);
    }
}
