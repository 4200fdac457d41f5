package me.golemcore.gateway.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Gateway configuration bound from {@code gateway.*} properties.
 *
 * <p>
 * Defaults mirror the values the gateway has always run with; every property
 * can be overridden through {@code application.properties} or the environment
 * variables referenced there.
 */
@Component
@ConfigurationProperties(prefix = "gateway")
@Data
public class GatewayProperties {

    /** Language of user-visible replies ({@code en} or {@code ru}). */
    private String language = "en";

    private TelegramProperties telegram = new TelegramProperties();
    private AgentProperties agent = new AgentProperties();
    private SandboxProperties sandbox = new SandboxProperties();
    private UploadProperties uploads = new UploadProperties();
    private ReplyProperties reply = new ReplyProperties();
    private ConversationProperties conversation = new ConversationProperties();

    @Data
    public static class TelegramProperties {
        private boolean enabled = true;
        private String token;
        private List<String> allowFrom = new ArrayList<>();
    }

    // ==================== AGENT PROCESS ====================

    @Data
    public static class AgentProperties {
        private String executable = "codex";
        private List<String> globalArgs = new ArrayList<>(List.of("--dangerously-bypass-approvals-and-sandbox"));
        private String workdir = ".";
        private String model = "";

        /**
         * Optional persona preamble written before the prompt on fresh (non-resumed)
         * runs.
         */
        private String systemPrompt = "";

        /** Pause between two typing indications while the agent is running. */
        private Duration typingInterval = Duration.ofSeconds(4);
    }

    // ==================== SANDBOX ====================

    @Data
    public static class SandboxProperties {
        private String root = "/tmp/tg-codex";
        private String linkDirName = ".tg-sandboxes";
        private int maxListedFiles = 200;
    }

    @Data
    public static class UploadProperties {
        private long maxBytes = 50L * 1024 * 1024;
        private int maxExtractFiles = 2000;
    }

    @Data
    public static class ReplyProperties {
        private int maxPlainLength = 3900;
        private int maxMarkdownLength = 3500;
    }

    @Data
    public static class ConversationProperties {
        private int maxLogEntries = 30;
    }
}
