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

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parsed form of the {@code allow-from} configuration list.
 *
 * <p>
 * Numeric entries (optionally negative) allow a user id and pre-authorize the
 * chat with the same id. {@code @name}, {@code t.me/name} and
 * {@code https://t.me/name} allow a username and the chat with that public
 * username. Anything else (invite links, paths) is unresolved.
 */
public record AllowlistEntries(
        Set<Long> userIds,
        Set<Long> chatIds,
        Set<String> usernames,
        Set<String> chatUsernames,
        List<String> unresolved) {

    private static final String TELEGRAM_HOST_PREFIX = "t.me/";

    public static AllowlistEntries parse(Collection<String> rawEntries) {
        Set<Long> userIds = new LinkedHashSet<>();
        Set<Long> chatIds = new LinkedHashSet<>();
        Set<String> usernames = new LinkedHashSet<>();
        Set<String> chatUsernames = new LinkedHashSet<>();
        List<String> unresolved = new ArrayList<>();

        for (String entry : splitEntries(rawEntries)) {
            Long numeric = parseNumeric(entry);
            if (numeric != null) {
                userIds.add(numeric);
                chatIds.add(numeric);
                continue;
            }
            String username = extractUsername(entry);
            if (username != null) {
                String normalized = username.toLowerCase(Locale.ROOT);
                usernames.add(normalized);
                chatUsernames.add(normalized);
                continue;
            }
            unresolved.add(entry);
        }
        return new AllowlistEntries(Set.copyOf(userIds), Set.copyOf(chatIds), Set.copyOf(usernames),
                Set.copyOf(chatUsernames), List.copyOf(unresolved));
    }

    public boolean isEmpty() {
        return userIds.isEmpty() && chatIds.isEmpty() && usernames.isEmpty() && chatUsernames.isEmpty();
    }

    /**
     * Extracts a bare username from {@code @name} or a t.me link, or returns
     * {@code null} for invite links and anything with a path.
     */
    static String extractUsername(String raw) {
        String trimmed = raw.trim();
        if (trimmed.startsWith("@")) {
            trimmed = trimmed.substring(1);
        }
        for (String prefix : List.of("https://", "http://")) {
            if (trimmed.startsWith(prefix)) {
                trimmed = trimmed.substring(prefix.length());
            }
        }
        if (trimmed.startsWith(TELEGRAM_HOST_PREFIX)) {
            trimmed = trimmed.substring(TELEGRAM_HOST_PREFIX.length());
        }
        if (trimmed.isEmpty() || trimmed.startsWith("+") || trimmed.contains("/")) {
            return null;
        }
        return trimmed;
    }

    private static Long parseNumeric(String entry) {
        String digits = entry.startsWith("-") ? entry.substring(1) : entry;
        if (digits.isEmpty() || !digits.chars().allMatch(Character::isDigit)) {
            return null;
        }
        try {
            return Long.parseLong(entry);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static List<String> splitEntries(Collection<String> rawEntries) {
        List<String> entries = new ArrayList<>();
        if (rawEntries == null) {
            return entries;
        }
        for (String raw : rawEntries) {
            if (raw == null) {
                continue;
            }
            for (String part : raw.split(",")) {
                String trimmed = part.trim();
                if (!trimmed.isEmpty()) {
                    entries.add(trimmed);
                }
            }
        }
        return entries;
    }
}
