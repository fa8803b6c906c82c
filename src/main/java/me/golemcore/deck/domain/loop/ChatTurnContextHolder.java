package me.golemcore.deck.domain.loop;

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

import me.golemcore.deck.domain.model.ChatTurnContext;

/**
 * ThreadLocal holder for the current {@link ChatTurnContext}, so tools can
 * reach the turn's progress listener without explicit parameter passing.
 * Values don't propagate to async operations (CompletableFuture.supplyAsync);
 * tools that read it run on the calling thread.
 */
public class ChatTurnContextHolder {

    private static final ThreadLocal<ChatTurnContext> CONTEXT = new ThreadLocal<>();

    public static void set(ChatTurnContext ctx) {
        CONTEXT.set(ctx);
    }

    public static ChatTurnContext get() {
        return CONTEXT.get();
    }

    public static void clear() {
        CONTEXT.remove();
    }

    private ChatTurnContextHolder() {
    }
}
