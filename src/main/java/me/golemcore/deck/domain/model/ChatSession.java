package me.golemcore.deck.domain.model;

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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Conversational state of one client: the ordered transcript and the most
 * recent exported presentation. A session is owned by one loop at a time; the
 * streaming relay works on a {@link #fork()} and commits it back.
 */
@Data
@Builder
public class ChatSession {

    private String id;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    private String latestPresentation;
    private Instant createdAt;
    private Instant updatedAt;

    public static ChatSession create(String id, Instant now) {
        return ChatSession.builder()
                .id(id)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public void addMessage(Message message) {
        if (messages == null) {
            messages = new ArrayList<>();
        }
        messages.add(message);
    }

    /**
     * Returns an independent copy whose transcript can be appended to without
     * affecting this session.
     */
    public ChatSession fork() {
        List<Message> copies = new ArrayList<>();
        if (messages != null) {
            for (Message message : messages) {
                copies.add(message.copy());
            }
        }
        return ChatSession.builder()
                .id(id)
                .messages(copies)
                .latestPresentation(latestPresentation)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }
}
