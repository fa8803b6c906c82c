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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.deck.domain.component.ToolComponent;
import me.golemcore.deck.domain.loop.ChatTurnContextHolder;
import me.golemcore.deck.domain.model.ChatReply;
import me.golemcore.deck.domain.model.ChatRequest;
import me.golemcore.deck.domain.model.ChatSession;
import me.golemcore.deck.domain.model.ChatTurnContext;
import me.golemcore.deck.domain.model.ContentPart;
import me.golemcore.deck.domain.model.ImageAttachment;
import me.golemcore.deck.domain.model.Message;
import me.golemcore.deck.domain.model.ProgressListener;
import me.golemcore.deck.domain.model.ToolName;
import me.golemcore.deck.domain.system.toolloop.LoopMode;
import me.golemcore.deck.domain.system.toolloop.ToolLoopRequest;
import me.golemcore.deck.domain.system.toolloop.ToolLoopResult;
import me.golemcore.deck.domain.system.toolloop.ToolLoopSystem;
import me.golemcore.deck.infrastructure.config.DeckProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Runs one conversation turn over a {@link ChatSession}: appends the user
 * message (text plus reference images), runs the conversation loop, and
 * records the presentation produced during the turn.
 */
@Service
@Slf4j
public class ChatService {

    static final Set<String> SUPPORTED_IMAGE_TYPES = Set.of("image/png", "image/jpeg", "image/gif",
            "image/webp");

    private static final Map<String, String> IMAGE_TYPES_BY_EXTENSION = Map.of(
            "png", "image/png",
            "jpg", "image/jpeg",
            "jpeg", "image/jpeg",
            "gif", "image/gif",
            "webp", "image/webp");

    private final ToolLoopSystem toolLoopSystem;
    private final ToolRegistry tools;
    private final PromptCatalog prompts;
    private final DeckProperties properties;
    private final Clock clock;

    @Autowired
    public ChatService(ToolLoopSystem toolLoopSystem, List<ToolComponent> toolComponents, PromptCatalog prompts,
            DeckProperties properties, Clock clock) {
        this(toolLoopSystem, ToolRegistry.forScope(ToolName.ToolScope.CONVERSATION, toolComponents), prompts,
                properties, clock);
    }

    ChatService(ToolLoopSystem toolLoopSystem, ToolRegistry tools, PromptCatalog prompts,
            DeckProperties properties, Clock clock) {
        this.toolLoopSystem = toolLoopSystem;
        this.tools = tools;
        this.prompts = prompts;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Sends a user message in the session and returns the assistant's reply.
     * The session transcript is appended to in place. Never throws.
     */
    public ChatReply sendMessage(ChatSession session, ChatRequest request, ProgressListener listener) {
        ChatTurnContext turn = new ChatTurnContext(listener);
        ChatTurnContextHolder.set(turn);
        try {
            session.addMessage(buildUserMessage(request));

            DeckProperties.LlmProperties llm = properties.getLlm();
            ToolLoopResult result = toolLoopSystem.run(ToolLoopRequest.builder()
                    .systemPrompt(prompts.conversationSystemPrompt())
                    .transcript(session.getMessages())
                    .tools(tools)
                    .mode(LoopMode.CONVERSATION)
                    .maxIterations(properties.getLoop().getConversationMaxIterations())
                    .model(llm.getChatModel())
                    .maxTokens(llm.getChatMaxTokens())
                    .listener(turn.getListener())
                    .build());

            if (turn.getPresentationFile() != null) {
                session.setLatestPresentation(turn.getPresentationFile());
            }
            session.setUpdatedAt(clock.instant());
            log.info("[Chat] Turn in session {} ended with {} after {} iteration(s)", session.getId(),
                    result.status(), result.iterations());
            return toReply(result, turn.getPresentationFile());
        } catch (RuntimeException e) {
            log.error("[Chat] Turn failed in session {}: {}", session.getId(), e.getMessage(), e);
            return ChatReply.failure("Error: " + e.getMessage());
        } finally {
            ChatTurnContextHolder.clear();
        }
    }

    private ChatReply toReply(ToolLoopResult result, String presentationFile) {
        return switch (result.status()) {
        case ANSWERED -> ChatReply.builder()
                .text(result.answer())
                .success(true)
                .presentationFile(presentationFile)
                .build();
        case COMPLETED -> ChatReply.builder()
                .text(result.generationResult().getMessage())
                .success(result.generationResult().isSuccess())
                .presentationFile(presentationFile)
                .build();
        case BUDGET_EXCEEDED -> ChatReply.builder()
                .text(result.answer())
                .success(false)
                .presentationFile(presentationFile)
                .build();
        case FAILED -> ChatReply.builder()
                .text("Error: " + result.error())
                .success(false)
                .presentationFile(presentationFile)
                .build();
        };
    }

    private Message buildUserMessage(ChatRequest request) {
        String text = request.text() != null ? request.text() : "";
        if (request.images().isEmpty()) {
            return Message.builder()
                    .role(Message.ROLE_USER)
                    .content(text)
                    .timestamp(clock.instant())
                    .build();
        }

        // Images first, then the text
        List<ContentPart> parts = new ArrayList<>();
        for (ImageAttachment image : request.images()) {
            String mimeType = resolveMimeType(image);
            if (mimeType == null) {
                log.warn("[Chat] Unsupported image format, skipping: {}", image.name());
                continue;
            }
            if (image.base64Data() == null || image.base64Data().isBlank()) {
                log.warn("[Chat] Empty image, skipping: {}", image.name());
                continue;
            }
            parts.add(ContentPart.image(mimeType, image.base64Data()));
        }
        parts.add(ContentPart.text(text));
        return Message.builder()
                .role(Message.ROLE_USER)
                .content(text)
                .parts(parts)
                .timestamp(clock.instant())
                .build();
    }

    static String resolveMimeType(ImageAttachment image) {
        if (image.mimeType() != null) {
            String declared = image.mimeType().toLowerCase(Locale.ROOT);
            if (SUPPORTED_IMAGE_TYPES.contains(declared)) {
                return declared;
            }
        }
        if (image.name() == null) {
            return null;
        }
        String name = image.name().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? IMAGE_TYPES_BY_EXTENSION.get(name.substring(dot + 1)) : null;
    }
}
