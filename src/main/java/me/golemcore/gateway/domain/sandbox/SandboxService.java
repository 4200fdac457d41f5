package me.golemcore.gateway.domain.sandbox;

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
import me.golemcore.gateway.domain.model.Sandbox;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.security.FilenameSanitizer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Allocates and tracks the per-chat sandbox the agent works in.
 *
 * <p>
 * Layout:
 *
 * <pre>
 * {sandboxRoot}/{chatId}/{sandboxId}/uploads|work|notes      (quarantined storage)
 * {agentWorkdir}/.tg-sandboxes/{chatId}/{sandboxId} -> root  (link the agent sees)
 * </pre>
 *
 * <p>
 * At most one sandbox is bound to a chat. {@link #ensure} is idempotent unless
 * {@code forceNew} is requested, which happens when the agent starts a new
 * session.
 */
@Service
@Slf4j
public class SandboxService {

    private final Path sandboxRoot;
    private final Path agentWorkdir;
    private final String linkDirName;
    private final Map<Long, Sandbox> sandboxes = new ConcurrentHashMap<>();

    @Autowired
    public SandboxService(GatewayProperties properties) {
        this(Paths.get(properties.getSandbox().getRoot()),
                Paths.get(properties.getAgent().getWorkdir()),
                properties.getSandbox().getLinkDirName());
    }

    public SandboxService(Path sandboxRoot, Path agentWorkdir, String linkDirName) {
        this.sandboxRoot = sandboxRoot.toAbsolutePath().normalize();
        this.agentWorkdir = agentWorkdir.toAbsolutePath().normalize();
        this.linkDirName = linkDirName;
    }

    public Optional<Sandbox> find(long chatId) {
        return Optional.ofNullable(sandboxes.get(chatId));
    }

    public Sandbox ensure(long chatId) {
        return ensure(chatId, null, false);
    }

    public Sandbox ensure(long chatId, String sandboxId) {
        return ensure(chatId, sandboxId, false);
    }

    /**
     * Return the chat's sandbox, creating one when none is bound or when
     * {@code forceNew} is set.
     *
     * @param sandboxId
     *            preferred identifier (e.g. the agent session id); a random token
     *            is generated when {@code null} or empty
     * @throws UncheckedIOException
     *             if the directories or the link cannot be created
     */
    public Sandbox ensure(long chatId, String sandboxId, boolean forceNew) {
        return sandboxes.compute(chatId, (key, existing) -> {
            if (existing != null && !forceNew) {
                return existing;
            }
            return create(chatId, sandboxId);
        });
    }

    private Sandbox create(long chatId, String requestedId) {
        String rawId = requestedId == null || requestedId.isEmpty()
                ? UUID.randomUUID().toString().replace("-", "")
                : requestedId;
        String sandboxId = FilenameSanitizer.sanitize(rawId);
        Path root = sandboxRoot.resolve(String.valueOf(chatId)).resolve(sandboxId);
        try {
            Files.createDirectories(root.resolve(Sandbox.UPLOADS_DIR));
            Files.createDirectories(root.resolve(Sandbox.WORK_DIR));
            Files.createDirectories(root.resolve(Sandbox.NOTES_DIR));

            Path linkRoot = agentWorkdir.resolve(linkDirName).resolve(String.valueOf(chatId));
            Files.createDirectories(linkRoot);
            Path link = linkRoot.resolve(sandboxId);
            removeExisting(link);
            Files.createSymbolicLink(link, root);

            log.info("[Sandbox] Bound sandbox {} to chat {} (link: {})", sandboxId, chatId, link);
            return new Sandbox(sandboxId, root, link);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create sandbox for chat " + chatId, e);
        }
    }

    private void removeExisting(Path link) throws IOException {
        if (Files.isSymbolicLink(link)) {
            Files.delete(link);
        } else if (Files.isDirectory(link, LinkOption.NOFOLLOW_LINKS)) {
            deleteTreeQuietly(link);
        } else if (Files.exists(link, LinkOption.NOFOLLOW_LINKS)) {
            Files.delete(link);
        }
    }

    /**
     * Recursively delete a directory, logging and skipping entries that cannot be
     * removed.
     */
    static void deleteTreeQuietly(Path dir) {
        try {
            Files.walkFileTree(dir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    deleteQuietly(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.debug("[Sandbox] Cannot visit {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path directory, IOException exc) {
                    deleteQuietly(directory);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warn("[Sandbox] Failed to remove {}: {}", dir, e.getMessage());
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.debug("[Sandbox] Cannot delete {}: {}", path, e.getMessage());
        }
    }

    /**
     * Lists regular files under {@code uploads/} then {@code work/}, depth-first
     * in lexicographic order, as paths relative to the sandbox root.
     */
    public List<String> listFiles(Sandbox sandbox, int limit) {
        List<String> files = new ArrayList<>();
        for (Path dir : List.of(sandbox.uploadsPath(), sandbox.workPath())) {
            if (files.size() >= limit) {
                break;
            }
            if (!Files.isDirectory(dir)) {
                continue;
            }
            collectFiles(sandbox.rootPath(), dir, files, limit);
        }
        return files;
    }

    private void collectFiles(Path root, Path dir, List<String> files, int limit) {
        List<Path> children;
        try (Stream<Path> stream = Files.list(dir)) {
            children = stream.sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("[Sandbox] Failed to list {}: {}", dir, e.getMessage());
            return;
        }
        for (Path child : children) {
            if (files.size() >= limit) {
                return;
            }
            if (Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
                collectFiles(root, child, files, limit);
            } else if (Files.isRegularFile(child, LinkOption.NOFOLLOW_LINKS)) {
                files.add(root.relativize(child).toString());
            }
        }
    }

    public Path getSandboxRoot() {
        return sandboxRoot;
    }

    public Path getAgentWorkdir() {
        return agentWorkdir;
    }
}
