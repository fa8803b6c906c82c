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

package me.golemcore.deck.adapter.outbound.storage;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.deck.domain.model.ChatSession;
import me.golemcore.deck.port.outbound.SessionPort;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local session store. Sessions are lost on restart. Stored sessions
 * are forked on the way in and out, so concurrent turns never append to the
 * same transcript.
 */
@Component
@Slf4j
public class InMemorySessionAdapter implements SessionPort {

    private final Map<String, ChatSession> sessions = new ConcurrentHashMap<>();

    @Override
    public Optional<ChatSession> get(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(sessionId)).map(ChatSession::fork);
    }

    @Override
    public void put(ChatSession session) {
        if (session == null || session.getId() == null) {
            throw new IllegalArgumentException("Session must have an id");
        }
        sessions.put(session.getId(), session.fork());
        log.debug("[Sessions] Stored session {} ({} messages)", session.getId(),
                session.getMessages() != null ? session.getMessages().size() : 0);
    }

    @Override
    public void delete(String sessionId) {
        if (sessionId != null && sessions.remove(sessionId) != null) {
            log.debug("[Sessions] Deleted session {}", sessionId);
        }
    }
}
