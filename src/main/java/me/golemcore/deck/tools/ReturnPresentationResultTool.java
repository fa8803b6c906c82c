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

package me.golemcore.deck.tools;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.deck.domain.component.ToolComponent;
import me.golemcore.deck.domain.model.GenerationResult;
import me.golemcore.deck.domain.model.ToolDefinition;
import me.golemcore.deck.domain.model.ToolName;
import me.golemcore.deck.domain.model.ToolResult;
import me.golemcore.deck.domain.service.GenerationResultCodec;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Terminal tool of a generation session. Produces the completion variant of
 * {@link ToolResult}, whose text carries the result behind the completion
 * marker.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReturnPresentationResultTool implements ToolComponent {

    private final GenerationResultCodec codec;

    @Override
    public ToolName getName() {
        return ToolName.RETURN_PRESENTATION_RESULT;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(ToolName.RETURN_PRESENTATION_RESULT.wireName())
                .description("Return the final result once all slides are created. "
                        + "Call this exactly once, as the last step.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "success", Map.of(
                                        "type", "boolean",
                                        "description", "Whether the presentation was created"),
                                "message", Map.of(
                                        "type", "string",
                                        "description", "Short summary of the result"),
                                "slide_count", Map.of(
                                        "type", "integer",
                                        "description", "Number of slides created"),
                                "slide_files", Map.of(
                                        "type", "array",
                                        "items", Map.of("type", "string"),
                                        "description", "Slide file paths in presentation order")),
                        "required", List.of("success", "message", "slide_count", "slide_files")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        String output = codec.encode(parameters.get("success"), parameters.get("message"),
                parameters.get("slide_count"), parameters.get("slide_files"));
        GenerationResult result = codec.decode(output);
        log.info("[Tools] Generation result returned: success={}, slides={}", result.isSuccess(),
                result.getSlideCount());
        return CompletableFuture.completedFuture(ToolResult.completion(output, result));
    }
}
