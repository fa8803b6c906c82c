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
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Creates a directory (and its parents) in the workspace. Idempotent.
 */
@Component
@Slf4j
public class CreateFolderTool implements ToolComponent {

    private final WorkspacePathResolver pathResolver;

    public CreateFolderTool(WorkspacePathResolver pathResolver) {
        this.pathResolver = pathResolver;
    }

    @Override
    public ToolName getName() {
        return ToolName.CREATE_FOLDER;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(ToolName.CREATE_FOLDER.wireName())
                .description("Create a new folder in the workspace, e.g. 'slides'.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "folder_path", Map.of(
                                        "type", "string",
                                        "description", "Path of the folder to create, relative to the workspace")),
                        "required", List.of("folder_path")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            String folderPath = (String) parameters.get("folder_path");
            Optional<Path> resolved = pathResolver.resolve(folderPath);
            if (resolved.isEmpty()) {
                return ToolResult.failure("Path is outside the workspace: " + folderPath);
            }
            try {
                Files.createDirectories(resolved.get());
                log.info("[Tools] Folder ready: {}", folderPath);
                return ToolResult.success("Successfully created folder: " + folderPath);
            } catch (IOException e) {
                log.warn("[Tools] Failed to create folder {}: {}", folderPath, e.getMessage());
                return ToolResult.failure("Error creating folder: " + e.getMessage());
            }
        });
    }
}
