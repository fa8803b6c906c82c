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
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists the non-hidden files directly inside a directory, sorted, as workspace-relative
 * paths. Defaults to the slides directory.
 */
@Component
@Slf4j
public class ListFilesTool implements ToolComponent {

    private static final String DEFAULT_DIRECTORY = "slides";

    private final WorkspacePathResolver pathResolver;

    public ListFilesTool(WorkspacePathResolver pathResolver) {
        this.pathResolver = pathResolver;
    }

    @Override
    public ToolName getName() {
        return ToolName.LIST_FILES;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(ToolName.LIST_FILES.wireName())
                .description("List all files in a directory of the workspace.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "directory", Map.of(
                                        "type", "string",
                                        "description", "Directory to list (default: 'slides')"))))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            Object requested = parameters.get("directory");
            String directory = requested instanceof String text && !text.isBlank() ? text : DEFAULT_DIRECTORY;
            Optional<Path> resolved = pathResolver.resolve(directory);
            if (resolved.isEmpty()) {
                return ToolResult.failure("Path is outside the workspace: " + directory);
            }
            Path dir = resolved.get();
            if (!Files.isDirectory(dir)) {
                return ToolResult.success("Directory does not exist: " + directory);
            }

            try (Stream<Path> entries = Files.list(dir)) {
                List<String> files = entries
                        .filter(Files::isRegularFile)
                        .filter(path -> !path.getFileName().toString().startsWith("."))
                        .map(pathResolver::relativize)
                        .sorted()
                        .collect(Collectors.toList());
                if (files.isEmpty()) {
                    return ToolResult.success("No files found in " + directory);
                }
                return ToolResult.success("Files in " + directory + ":\n"
                        + files.stream().map(file -> "  - " + file).collect(Collectors.joining("\n")));
            } catch (IOException e) {
                log.warn("[Tools] Failed to list {}: {}", directory, e.getMessage());
                return ToolResult.failure("Error listing files: " + e.getMessage());
            }
        });
    }
}
