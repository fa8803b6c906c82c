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
import me.golemcore.deck.domain.model.ExportResult;
import me.golemcore.deck.domain.model.GenerationResult;
import me.golemcore.deck.domain.model.Message;
import me.golemcore.deck.domain.model.PresentationBrief;
import me.golemcore.deck.domain.model.ProgressListener;
import me.golemcore.deck.domain.model.ToolName;
import me.golemcore.deck.domain.system.toolloop.LoopMode;
import me.golemcore.deck.domain.system.toolloop.ToolLoopRequest;
import me.golemcore.deck.domain.system.toolloop.ToolLoopResult;
import me.golemcore.deck.domain.system.toolloop.ToolLoopSystem;
import me.golemcore.deck.infrastructure.config.DeckProperties;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Runs one generation session: a fresh transcript, the generation tool catalog
 * and a tool-use-required loop. A successful result with slide files is handed
 * to the export pipeline.
 */
@Service
@Slf4j
public class SlideGenerationService {

    private final ToolLoopSystem toolLoopSystem;
    private final Supplier<ToolRegistry> toolsSupplier;
    private final PresentationExportService exportService;
    private final PromptCatalog prompts;
    private final DeckProperties properties;
    private final Clock clock;

    private volatile ToolRegistry tools;

    // The catalog is resolved lazily because generate_presentation is itself a
    // tool bean that depends on this service.
    @Autowired
    public SlideGenerationService(ToolLoopSystem toolLoopSystem, ObjectProvider<ToolComponent> toolProvider,
            PresentationExportService exportService, PromptCatalog prompts, DeckProperties properties,
            Clock clock) {
        this(toolLoopSystem,
                () -> ToolRegistry.forScope(ToolName.ToolScope.GENERATION,
                        toolProvider.orderedStream().collect(Collectors.toList())),
                exportService, prompts, properties, clock);
    }

    SlideGenerationService(ToolLoopSystem toolLoopSystem, Supplier<ToolRegistry> toolsSupplier,
            PresentationExportService exportService, PromptCatalog prompts, DeckProperties properties,
            Clock clock) {
        this.toolLoopSystem = toolLoopSystem;
        this.toolsSupplier = toolsSupplier;
        this.exportService = exportService;
        this.prompts = prompts;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Generates the slides for a brief and exports them. Never throws; failures
     * come back as an unsuccessful result.
     */
    public GenerationResult generate(PresentationBrief brief, ProgressListener listener) {
        ProgressListener progress = listener != null ? listener : ProgressListener.NOOP;
        try {
            log.info("[Generation] Starting presentation: {}", brief.getTopic());
            List<Message> transcript = new ArrayList<>();
            transcript.add(Message.builder()
                    .role(Message.ROLE_USER)
                    .content(prompts.generationUserPrompt(brief))
                    .timestamp(clock.instant())
                    .build());

            DeckProperties.LlmProperties llm = properties.getLlm();
            ToolLoopResult loopResult = toolLoopSystem.run(ToolLoopRequest.builder()
                    .systemPrompt(prompts.generationSystemPrompt())
                    .transcript(transcript)
                    .tools(generationTools())
                    .mode(LoopMode.GENERATION)
                    .maxIterations(properties.getLoop().getGenerationMaxIterations())
                    .model(llm.getGenerationModel())
                    .maxTokens(llm.getGenerationMaxTokens())
                    .listener(progress)
                    .build());

            GenerationResult result = loopResult.generationResult() != null
                    ? loopResult.generationResult()
                    : GenerationResult.failed(loopResult.error() != null ? loopResult.error() : "No result");
            log.info("[Generation] Loop ended with {} after {} iteration(s): success={}", loopResult.status(),
                    loopResult.iterations(), result.isSuccess());

            if (!result.isSuccess() || result.getSlideFiles() == null || result.getSlideFiles().isEmpty()) {
                return result;
            }
            ExportResult export = exportService.export(result.getSlideFiles(), brief.getTopic(), progress);
            return result.withExport(export);
        } catch (RuntimeException e) {
            log.error("[Generation] Generation failed: {}", e.getMessage(), e);
            return GenerationResult.failed("Error generating presentation: " + e.getMessage());
        }
    }

    private ToolRegistry generationTools() {
        ToolRegistry registry = tools;
        if (registry == null) {
            synchronized (this) {
                registry = tools;
                if (registry == null) {
                    registry = toolsSupplier.get();
                    tools = registry;
                }
            }
        }
        return registry;
    }
}
