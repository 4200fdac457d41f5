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

import java.nio.file.Path;

/**
 * Isolated per-conversation working area handed to the agent process.
 *
 * <p>
 * {@code rootPath} lives under the quarantine root keyed by chat and sandbox
 * id; {@code exposedLink} is a symbolic link inside the agent working directory
 * pointing at {@code rootPath}.
 */
public record Sandbox(
        String id,
        Path rootPath,
        Path exposedLink) {

    public static final String UPLOADS_DIR = "uploads";
    public static final String WORK_DIR = "work";
    public static final String NOTES_DIR = "notes";

    public Path uploadsPath() {
        return rootPath.resolve(UPLOADS_DIR);
    }

    public Path workPath() {
        return rootPath.resolve(WORK_DIR);
    }

    public Path notesPath() {
        return rootPath.resolve(NOTES_DIR);
    }
}
