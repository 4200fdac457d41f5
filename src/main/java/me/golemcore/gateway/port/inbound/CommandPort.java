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

import java.util.List;
import java.util.Map;

/**
 * Port for executing slash commands (/help, /status). Commands bypass the
 * agent and answer directly from gateway state.
 */
public interface CommandPort {

    String CTX_CHAT_ID = "chatId";
    String CTX_SENDER_ID = "senderId";
    String CTX_SENDER_USERNAME = "senderUsername";

    /**
     * Executes a command with the given arguments and context.
     *
     * @param command
     *            Command name (without leading slash or bot suffix)
     * @param args
     *            List of command arguments
     * @param context
     *            Execution context containing chatId and sender details
     * @return Command execution result with success status and output
     */
    CommandResult execute(String command, List<String> args, Map<String, Object> context);

    /**
     * Checks if a command with the given name is registered.
     */
    boolean hasCommand(String command);

    /**
     * Returns a list of all available commands with their definitions.
     */
    List<CommandDefinition> listCommands();

    /**
     * Result of a command execution including success status and output message.
     */
    record CommandResult(
            boolean success,
            String output) {

        public static CommandResult success(String output) {
            return new CommandResult(true, output);
        }

        public static CommandResult failure(String error) {
            return new CommandResult(false, error);
        }
    }

    /**
     * A command's name and one-line description.
     */
    record CommandDefinition(
            String name,
            String description) {
    }
}
