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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single turn of a transcript. A turn carries plain text, a list of
 * multimodal {@link ContentPart}s, or a list of {@link ToolResultEntry}s.
 * Assistant turns may additionally request tool calls; the {@code tool} turn
 * that answers them follows immediately and holds one entry per call.
 */
@Data
@Builder
public class Message {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL = "tool";

    private String role; // user, assistant, tool
    private String content;
    private List<ContentPart> parts;

    private List<ToolCall> toolCalls;
    private List<ToolResultEntry> toolResults;

    private Instant timestamp;

    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    public boolean isToolMessage() {
        return ROLE_TOOL.equals(role);
    }

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public boolean hasParts() {
        return parts != null && !parts.isEmpty();
    }

    /**
     * Creates a deep-enough copy for forking a transcript: lists are copied,
     * immutable leaves (parts, calls, entries) are shared.
     */
    public Message copy() {
        return Message.builder()
                .role(role)
                .content(content)
                .parts(parts != null ? new ArrayList<>(parts) : null)
                .toolCalls(toolCalls != null ? copyToolCalls(toolCalls) : null)
                .toolResults(toolResults != null ? new ArrayList<>(toolResults) : null)
                .timestamp(timestamp)
                .build();
    }

    private static List<ToolCall> copyToolCalls(List<ToolCall> calls) {
        List<ToolCall> copies = new ArrayList<>(calls.size());
        for (ToolCall call : calls) {
            copies.add(ToolCall.builder()
                    .id(call.getId())
                    .name(call.getName())
                    .arguments(call.getArguments() != null ? new LinkedHashMap<>(call.getArguments()) : null)
                    .build());
        }
        return copies;
    }

    /**
     * A tool invocation requested by the model. Only the model produces these.
     */
    @Data
    @Builder
    public static class ToolCall {
        private String id;
        private String name;
        private Map<String, Object> arguments;
    }

    /**
     * Transcript form of one tool result, correlated to its call by id.
     */
    @Data
    @Builder
    public static class ToolResultEntry {
        private String toolCallId;
        private String toolName;
        private String content;
        @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isError()
        private boolean error;
    }
}
