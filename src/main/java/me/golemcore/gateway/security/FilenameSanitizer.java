package me.golemcore.gateway.security;

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

import java.util.regex.Pattern;

/**
 * Allow-list filename sanitization applied to every externally supplied name
 * before it touches the disk.
 *
 * <p>
 * Only the last path component is kept; runs of characters outside
 * {@code [A-Za-z0-9._-]} become a single underscore and runs of dots collapse
 * to one, so the result never contains a separator or {@code ..}.
 */
public final class FilenameSanitizer {

    public static final String FALLBACK_NAME = "upload";

    private static final Pattern DISALLOWED = Pattern.compile("[^A-Za-z0-9._-]+");
    private static final Pattern DOT_RUN = Pattern.compile("\\.{2,}");

    private FilenameSanitizer() {
    }

    public static String sanitize(String name) {
        if (name == null || name.isEmpty()) {
            return FALLBACK_NAME;
        }
        String base = lastComponent(name);
        base = DISALLOWED.matcher(base).replaceAll("_");
        base = DOT_RUN.matcher(base).replaceAll(".");
        if (base.isEmpty() || ".".equals(base)) {
            return FALLBACK_NAME;
        }
        return base;
    }

    private static String lastComponent(String name) {
        String trimmed = name;
        while (trimmed.endsWith("/") || trimmed.endsWith("\\")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        int slash = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf('\\'));
        return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
    }
}
