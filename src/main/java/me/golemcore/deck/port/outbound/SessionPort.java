package me.golemcore.deck.port.outbound;

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

import me.golemcore.deck.domain.model.ChatSession;

import java.util.Optional;

/**
 * Port for chat session storage. Sessions are replaced whole on {@link #put}.
 * Implementations never share a stored transcript with callers: {@link #get}
 * hands out an independent copy and {@link #put} keeps its own.
 */
public interface SessionPort {

    Optional<ChatSession> get(String sessionId);

    void put(ChatSession session);

    void delete(String sessionId);
}
