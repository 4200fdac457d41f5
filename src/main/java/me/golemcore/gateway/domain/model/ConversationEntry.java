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

/**
 * One captured chat message in a conversation log.
 *
 * @param speaker
 *            display name of the sender
 * @param text
 *            message text, caption or a placeholder for non-text messages
 * @param repliedTo
 *            display name of the replied-to sender, or {@code null}
 */
public record ConversationEntry(String speaker, String text, String repliedTo) {

    public static ConversationEntry of(String speaker, String text) {
        return new ConversationEntry(speaker, text, null);
    }

    public boolean isReply() {
        return repliedTo != null && !repliedTo.isEmpty();
    }

    /**
     * Renders the entry as a single transcript line (without the bullet).
     */
    public String toLine() {
        if (isReply()) {
            return speaker + " (reply to " + repliedTo + "): " + text;
        }
        return speaker + ": " + text;
    }
}
