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

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Platform-neutral inbound message event.
 *
 * <p>
 * Channel adapters translate their native updates into this shape before
 * handing them to the orchestrator.
 */
@Data
@Builder
public class ChatEvent {

    private long chatId;
    private ChatType chatType;
    private String chatUsername;

    private Long senderId;
    private String senderHandle;
    private String senderUsername;
    private boolean senderIsBot;

    private String text;
    private String caption;

    private Long repliedToSenderId;
    private String repliedToSenderHandle;
    private boolean repliedToSenderIsBot;

    private List<MessageEntity> entities;
    private AttachedDocument attachedDocument;

    public boolean isPrivateChat() {
        return chatType == null || chatType == ChatType.PRIVATE;
    }

    public boolean hasText() {
        return text != null && !text.isEmpty();
    }

    public boolean hasDocument() {
        return attachedDocument != null;
    }

    public boolean isReply() {
        return repliedToSenderHandle != null;
    }

    /**
     * Returns the message text, falling back to the caption, or an empty string.
     */
    public String requestText() {
        if (text != null && !text.isEmpty()) {
            return text;
        }
        return caption != null ? caption : "";
    }

    public List<MessageEntity> entitiesOrEmpty() {
        return entities != null ? entities : List.of();
    }
}
