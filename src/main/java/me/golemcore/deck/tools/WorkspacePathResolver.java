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
import me.golemcore.deck.infrastructure.config.DeckProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Resolves tool-supplied paths inside the workspace root. Absolute paths,
 * {@code ..} escapes and symlinks pointing outside the workspace are rejected.
 */
@Component
@Slf4j
public class WorkspacePathResolver {

    private final Path workspaceRoot;

    @Autowired
    public WorkspacePathResolver(DeckProperties properties) {
        this(properties.getWorkspace().rootPath());
    }

    public WorkspacePathResolver(Path workspaceRoot) {
        this.workspaceRoot = workspaceRoot.toAbsolutePath().normalize();
    }

    public Optional<Path> resolve(String pathStr) {
        if (pathStr == null) {
            return Optional.empty();
        }
        try {
            Path requested = Path.of(pathStr);
            if (requested.isAbsolute()) {
                log.warn("[Tools] Absolute path rejected: {}", pathStr);
                return Optional.empty();
            }

            Path resolved = workspaceRoot.resolve(requested).normalize();
            if (!resolved.startsWith(workspaceRoot)) {
                log.warn("[Tools] Path escapes workspace: {}", pathStr);
                return Optional.empty();
            }

            // Follow symlinks to prevent symlink escape
            if (Files.exists(resolved)) {
                Path realPath = resolved.toRealPath();
                Path realWorkspace = workspaceRoot.toRealPath();
                if (!realPath.startsWith(realWorkspace)) {
                    log.warn("[Tools] Symlink escape blocked: {} -> {}", resolved, realPath);
                    return Optional.empty();
                }
            }
            return Optional.of(resolved);
        } catch (InvalidPathException e) {
            return Optional.empty();
        } catch (IOException e) {
            log.warn("[Tools] Failed to resolve real path: {}", pathStr);
            return Optional.empty();
        }
    }

    /**
     * Workspace-relative form of a path, with forward slashes.
     */
    public String relativize(Path path) {
        return workspaceRoot.relativize(path.toAbsolutePath().normalize()).toString().replace('\\', '/');
    }
}
