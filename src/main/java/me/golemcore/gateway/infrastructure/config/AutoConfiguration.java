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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.port.inbound.ChannelPort;
import me.golemcore.gateway.security.AllowlistValidator;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Validates the configuration on startup and starts the channels once the
 * application is ready.
 *
 * <p>
 * Also provides the shared {@link ObjectMapper} and the executors used by the
 * gateway:
 * <ul>
 * <li>{@code updateExecutor} - handles inbound triggers off the polling
 * thread</li>
 * <li>{@code agentExecutor} - runs agent processes</li>
 * <li>{@code typingExecutor} - drives typing indicators</li>
 * </ul>
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final GatewayProperties properties;
    private final AllowlistValidator allowlistValidator;
    private final List<ChannelPort> channelPorts;

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService updateExecutor() {
        return Executors.newCachedThreadPool(namedThreadFactory("gateway-update"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService agentExecutor() {
        return Executors.newCachedThreadPool(namedThreadFactory("gateway-agent"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService typingExecutor() {
        return Executors.newCachedThreadPool(namedThreadFactory("gateway-typing"));
    }

    static ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @PostConstruct
    public void init() {
        validate();
        String model = properties.getAgent().getModel();
        log.info("Agent: {} (model: {})", properties.getAgent().getExecutable(),
                model == null || model.isBlank() ? "default" : model);
        log.info("Agent workdir: {}", agentWorkdir());
        log.info("Sandbox root: {}", properties.getSandbox().getRoot());
    }

    /**
     * Channels start once the context is ready so no update arrives before the
     * inbound listeners are registered.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void startChannels() {
        for (ChannelPort channel : channelPorts) {
            log.info("Starting channel: {}", channel.getChannelType());
            channel.start();
        }
        log.info("Gateway started successfully");
    }

    /**
     * Fail fast on a configuration the gateway cannot run with.
     *
     * @throws IllegalStateException
     *             if the token or the allow list is missing, or the agent workdir
     *             does not exist
     */
    void validate() {
        GatewayProperties.TelegramProperties telegram = properties.getTelegram();
        if (telegram.isEnabled() && (telegram.getToken() == null || telegram.getToken().isBlank())) {
            throw new IllegalStateException("Missing gateway.telegram.token (TELEGRAM_BOT_TOKEN)");
        }
        if (allowlistValidator.getEntries().isEmpty()) {
            throw new IllegalStateException("Missing gateway.telegram.allow-from (ALLOWED_CHAT_USER_IDS)");
        }
        Path workdir = agentWorkdir();
        if (!Files.isDirectory(workdir)) {
            throw new IllegalStateException("Agent workdir does not exist: " + workdir);
        }
    }

    private Path agentWorkdir() {
        return Paths.get(properties.getAgent().getWorkdir()).toAbsolutePath().normalize();
    }
}
