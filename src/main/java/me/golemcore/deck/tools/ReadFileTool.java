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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.deck.domain.component.ToolComponent;
import me.golemcore.deck.domain.model.ToolDefinition;
import me.golemcore.deck.domain.model.ToolName;
import me.golemcore.deck.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

@Component
@Slf4j
public class ReadFileTool implements ToolComponent {

    private final WorkspacePathResolver pathResolver;

    public ReadFileTool(WorkspacePathResolver pathResolver) {
        this.pathResolver = pathResolver;
    }

    @Override
    public ToolName getName() {
        return ToolName.READ_FILE;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(ToolName.READ_FILE.wireName())
                .description("Read the contents of a file in the workspace.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "file_path", Map.of(
                                        "type", "string",
                                        "description", "Path of the file to read")),
                        "required", List.of("file_path")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            String filePath = (String) parameters.get("file_path");
            Optional<Path> resolved = pathResolver.resolve(filePath);
            if (resolved.isEmpty()) {
                return ToolResult.failure("Path is outside the workspace: " + filePath);
            }
            if (!Files.isRegularFile(resolved.get())) {
                return ToolResult.failure("File not found: " + filePath);
            }
            try {
                String content = Files.readString(resolved.get(), StandardCharsets.UTF_8);
                return ToolResult.success("File contents of " + filePath + ":\n\n" + content);
            } catch (IOException e) {
                log.warn("[Tools] Failed to read file {}: {}", filePath, e.getMessage());
                return ToolResult.failure("Error reading file: " + e.getMessage());
            }
        });
    }
}
