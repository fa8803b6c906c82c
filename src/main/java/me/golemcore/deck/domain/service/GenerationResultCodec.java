package me.golemcore.deck.domain.service;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.deck.domain.model.GenerationResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes and reads the terminal result text
 * {@code PPT_GENERATION_COMPLETE: <json>}. Anything that does not parse into a
 * well-formed result is turned into a failed {@link GenerationResult}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GenerationResultCodec {

    public static final String MARKER = "PPT_GENERATION_COMPLETE:";

    private static final String PARSE_ERROR_PREFIX = "Could not parse generation result: ";

    private final ObjectMapper objectMapper;

    /**
     * Serializes the model-supplied fields behind the marker. Values are written
     * as received so that {@link #decode(String)} decides whether they are well
     * formed.
     */
    public String encode(Object success, Object message, Object slideCount, Object slideFiles) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("success", success);
        payload.put("message", message);
        payload.put("slide_count", slideCount);
        payload.put("slide_files", slideFiles);
        try {
            return MARKER + " " + objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Generation result is not serializable", e);
        }
    }

    public String encode(GenerationResult result) {
        return encode(result.isSuccess(), result.getMessage(), result.getSlideCount(), result.getSlideFiles());
    }

    public boolean isCompletionText(String text) {
        return text != null && text.contains(MARKER);
    }

    public GenerationResult decode(String text) {
        if (!isCompletionText(text)) {
            return GenerationResult.failed(PARSE_ERROR_PREFIX + "completion marker missing");
        }
        String json = text.substring(text.indexOf(MARKER) + MARKER.length()).trim();
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("[ToolLoop] Malformed completion payload: {}", e.getOriginalMessage());
            return GenerationResult.failed(PARSE_ERROR_PREFIX + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return GenerationResult.failed(PARSE_ERROR_PREFIX + "payload is not a JSON object");
        }

        JsonNode success = root.get("success");
        if (success == null || !success.isBoolean()) {
            return GenerationResult.failed(PARSE_ERROR_PREFIX + "'success' must be a boolean");
        }
        JsonNode message = root.get("message");
        if (message != null && !message.isNull() && !message.isTextual()) {
            return GenerationResult.failed(PARSE_ERROR_PREFIX + "'message' must be a string");
        }
        JsonNode slideCount = root.get("slide_count");
        if (slideCount == null || !slideCount.isNumber() || !slideCount.canConvertToExactIntegral()
                || !slideCount.canConvertToInt()) {
            return GenerationResult.failed(PARSE_ERROR_PREFIX + "'slide_count' must be an integer");
        }
        JsonNode slideFiles = root.get("slide_files");
        if (slideFiles == null || !slideFiles.isArray()) {
            return GenerationResult.failed(PARSE_ERROR_PREFIX + "'slide_files' must be an array");
        }
        List<String> files = new ArrayList<>();
        for (JsonNode file : slideFiles) {
            if (!file.isTextual()) {
                return GenerationResult.failed(PARSE_ERROR_PREFIX + "'slide_files' must contain strings");
            }
            files.add(file.asText());
        }

        return GenerationResult.builder()
                .success(success.asBoolean())
                .message(message != null && !message.isNull() ? message.asText() : "")
                .slideCount(slideCount.asInt())
                .slideFiles(files)
                .build();
    }
}
