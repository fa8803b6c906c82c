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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A transient progress notification. Payloads are small maps that serialize
 * directly to JSON.
 */
public record ProgressEvent(ProgressEventType type, Map<String, Object> payload) {

    public ProgressEvent {
        payload = payload != null ? Map.copyOf(payload) : Map.of();
    }

    /**
     * Announces a tool call before its handler runs, so nested progress of the
     * call follows this event.
     */
    public static ProgressEvent toolDispatched(String toolName, String toolCallId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("tool", toolName != null ? toolName : "unknown");
        payload.put("tool_call_id", toolCallId != null ? toolCallId : "");
        return new ProgressEvent(ProgressEventType.TOOL_DISPATCHED, payload);
    }

    public static ProgressEvent rasterized(int slideNumber, int totalSlides, String filename) {
        return new ProgressEvent(ProgressEventType.RASTERIZATION_PROGRESS, Map.of(
                "slide_number", slideNumber,
                "total_slides", totalSlides,
                "filename", filename));
    }

    public static ProgressEvent slideAdded(int slideNumber, int totalSlides) {
        return new ProgressEvent(ProgressEventType.ASSEMBLY_PROGRESS, Map.of(
                "slide_number", slideNumber,
                "total_slides", totalSlides));
    }

    public static ProgressEvent completed(ChatReply reply) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("response", reply.getText() != null ? reply.getText() : "");
        payload.put("success", reply.isSuccess());
        payload.put("has_presentation", reply.getPresentationFile() != null);
        if (reply.getPresentationFile() != null) {
            payload.put("presentation_file", reply.getPresentationFile());
        }
        return new ProgressEvent(ProgressEventType.COMPLETED, payload);
    }

    public static ProgressEvent failed(String error) {
        return new ProgressEvent(ProgressEventType.FAILED,
                Map.of("error", error != null ? error : "unknown error"));
    }

    public static ProgressEvent keepalive() {
        return new ProgressEvent(ProgressEventType.KEEPALIVE, Map.of());
    }
}
