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

import lombok.Getter;
import lombok.Setter;

/**
 * State shared between a chat turn and the tools it dispatches: where to send
 * progress, and the presentation produced during the turn, if any.
 */
@Getter
public class ChatTurnContext {

    private final ProgressListener listener;

    @Setter
    private String presentationFile;

    public ChatTurnContext(ProgressListener listener) {
        this.listener = listener != null ? listener : ProgressListener.NOOP;
    }
}
