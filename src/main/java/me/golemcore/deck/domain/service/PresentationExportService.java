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
import me.golemcore.deck.domain.model.ExportResult;
import me.golemcore.deck.domain.model.ProgressEvent;
import me.golemcore.deck.domain.model.ProgressListener;
import me.golemcore.deck.infrastructure.config.DeckProperties;
import me.golemcore.deck.port.outbound.PresentationAssemblerPort;
import me.golemcore.deck.port.outbound.SlideRendererPort;
import me.golemcore.deck.tools.WorkspacePathResolver;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Two-stage export: rasterize every slide document to a PNG, then pack the
 * images into one presentation file.
 *
 * <p>
 * Slide paths are confined to the workspace the same way the file tools are.
 * Missing, out-of-workspace or unrenderable slides are skipped with a warning. When nothing was
 * captured the assembly stage is not run and no file is written. Any other
 * failure yields {@link ExportResult#empty()}.
 */
@Service
@Slf4j
public class PresentationExportService {

    private static final String DEFAULT_TITLE = "Presentation";

    private final SlideRendererPort slideRenderer;
    private final PresentationAssemblerPort assembler;
    private final WorkspacePathResolver pathResolver;
    private final DeckProperties.WorkspaceProperties workspace;

    public PresentationExportService(SlideRendererPort slideRenderer, PresentationAssemblerPort assembler,
            WorkspacePathResolver pathResolver, DeckProperties properties) {
        this.slideRenderer = slideRenderer;
        this.assembler = assembler;
        this.pathResolver = pathResolver;
        this.workspace = properties.getWorkspace();
    }

    public ExportResult export(List<String> slideFiles, String title, ProgressListener listener) {
        ProgressListener progress = listener != null ? listener : ProgressListener.NOOP;
        try {
            List<Path> screenshots = rasterize(slideFiles != null ? slideFiles : List.of(), progress);
            if (screenshots.isEmpty()) {
                log.warn("[Export] No slides captured, skipping assembly");
                return ExportResult.empty();
            }

            Path output = workspacePath(workspace.getExportsDir()).resolve(sanitizeTitle(title) + ".pptx");
            Files.createDirectories(output.getParent());
            int pages = assembler.assemble(screenshots, output, title, progress);
            if (pages == 0) {
                log.warn("[Export] Assembler wrote no pages");
                Files.deleteIfExists(output);
                return ExportResult.empty();
            }
            log.info("[Export] Presentation saved: {} ({} slides)", output, pages);

            List<String> screenshotPaths = new ArrayList<>(screenshots.size());
            for (Path screenshot : screenshots) {
                screenshotPaths.add(screenshot.toString());
            }
            return new ExportResult(output.toString(), screenshotPaths);
        } catch (IOException | RuntimeException e) {
            log.error("[Export] Export failed: {}", e.getMessage(), e);
            return ExportResult.empty();
        }
    }

    private List<Path> rasterize(List<String> slideFiles, ProgressListener progress) throws IOException {
        Path screenshotsDir = workspacePath(workspace.getScreenshotsDir());
        Files.createDirectories(screenshotsDir);

        List<Path> captured = new ArrayList<>();
        int total = slideFiles.size();
        for (int i = 0; i < total; i++) {
            int slideNumber = i + 1;
            Optional<Path> resolved = pathResolver.resolve(slideFiles.get(i));
            if (resolved.isEmpty()) {
                log.warn("[Export] Slide outside workspace, skipping: {}", slideFiles.get(i));
                continue;
            }
            Path slide = resolved.get();
            if (!Files.isRegularFile(slide)) {
                log.warn("[Export] Slide file not found, skipping: {}", slide);
                continue;
            }

            Path screenshot = screenshotsDir.resolve("slide_" + slideNumber + ".png");
            try {
                byte[] png = slideRenderer.render(slide).join();
                Files.write(screenshot, png);
            } catch (IOException | RuntimeException e) {
                log.warn("[Export] Failed to capture slide {}: {}", slide, e.getMessage());
                continue;
            }
            captured.add(screenshot);
            log.info("[Export] Captured slide {}/{}: {}", slideNumber, total, screenshot.getFileName());
            progress.onEvent(ProgressEvent.rasterized(slideNumber, total, screenshot.getFileName().toString()));
        }
        return captured;
    }

    private Path workspacePath(String relative) {
        return workspace.rootPath().resolve(relative).normalize();
    }

    /**
     * File name for a title: spaces become underscores, characters unsafe in
     * file names are dropped.
     */
    static String sanitizeTitle(String title) {
        if (title == null || title.isBlank()) {
            return DEFAULT_TITLE;
        }
        String sanitized = title.trim()
                .replace(' ', '_')
                .replaceAll("[^\\p{L}\\p{N}._-]", "");
        if (sanitized.isEmpty() || sanitized.chars().allMatch(ch -> ch == '.')) {
            return DEFAULT_TITLE;
        }
        return sanitized.length() > 120 ? sanitized.substring(0, 120) : sanitized;
    }
}
