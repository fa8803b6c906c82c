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

package me.golemcore.deck.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.deck.domain.model.ChatReply;
import me.golemcore.deck.domain.model.ChatRequest;
import me.golemcore.deck.domain.model.ChatSession;
import me.golemcore.deck.domain.model.ProgressListener;
import me.golemcore.deck.port.outbound.SessionPort;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Session-level entry points: blocking chat turns, the latest presentation of
 * a session, and reset.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatSessionService {

    private final SessionPort sessionPort;
    private final ChatService chatService;
    private final Clock clock;

    public static String newSessionId() {
        return UUID.randomUUID().toString();
    }

    public ChatSession getOrCreate(String sessionId) {
        return sessionPort.get(sessionId).orElseGet(() -> {
            log.debug("[Chat] Creating session {}", sessionId);
            return ChatSession.create(sessionId, clock.instant());
        });
    }

    /**
     * Runs one turn to completion and stores the session afterwards.
     */
    public ChatReply chat(String sessionId, ChatRequest request) {
        ChatSession session = getOrCreate(sessionId);
        ChatReply reply = chatService.sendMessage(session, request, ProgressListener.NOOP);
        sessionPort.put(session);
        return reply;
    }

    /**
     * Path of the latest exported presentation of the session, when it still
     * exists on disk.
     */
    public Optional<Path> latestPresentation(String sessionId) {
        return sessionPort.get(sessionId)
                .map(ChatSession::getLatestPresentation)
                .map(Path::of)
                .filter(Files::isRegularFile);
    }

    public void reset(String sessionId) {
        sessionPort.delete(sessionId);
        log.info("[Chat] Session reset: {}", sessionId);
    }
}
