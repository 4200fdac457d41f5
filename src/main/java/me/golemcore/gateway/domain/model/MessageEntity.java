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
 * Formatting entity attached to an inbound message text.
 *
 * @param kind
 *            entity type as reported by the platform ({@code mention},
 *            {@code text_mention}, ...)
 * @param offset
 *            UTF-16 offset of the entity in the text
 * @param length
 *            UTF-16 length of the entity
 * @param mentionedUserId
 *            user id for {@code text_mention} entities, otherwise {@code null}
 */
public record MessageEntity(String kind, int offset, int length, Long mentionedUserId) {

    public static final String MENTION = "mention";
    public static final String TEXT_MENTION = "text_mention";

    /**
     * Returns the slice of {@code text} this entity covers, or an empty string if
     * the bounds do not fit.
     */
    public String slice(String text) {
        if (text == null || offset < 0 || length < 0 || offset + length > text.length()) {
            return "";
        }
        return text.substring(offset, offset + length);
    }
}
