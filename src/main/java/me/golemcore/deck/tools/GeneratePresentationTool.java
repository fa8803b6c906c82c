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
import me.golemcore.deck.domain.loop.ChatTurnContextHolder;
import me.golemcore.deck.domain.model.ChatTurnContext;
import me.golemcore.deck.domain.model.GenerationResult;
import me.golemcore.deck.domain.model.PresentationBrief;
import me.golemcore.deck.domain.model.ProgressListener;
import me.golemcore.deck.domain.model.ToolDefinition;
import me.golemcore.deck.domain.model.ToolName;
import me.golemcore.deck.domain.model.ToolResult;
import me.golemcore.deck.domain.service.SlideGenerationService;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Chat-level tool that hands the gathered requirements to a nested generation
 * session and reports the outcome back to the conversation.
 *
 * <p>
 * Runs on the calling thread so that it sees the turn's
 * {@link ChatTurnContext} and its progress events stay in order with the
 * surrounding loop.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GeneratePresentationTool implements ToolComponent {

    private static final String PARAM_TOPIC = "ppt_topic";
    private static final String PARAM_DESCRIPTION = "ppt_description";
    private static final String PARAM_DETAILS = "ppt_details";
    private static final String PARAM_DATA = "ppt_data";
    private static final String PARAM_LOGO = "brand_logo_details";
    private static final String PARAM_GUIDELINES = "brand_guideline_details";
    private static final String PARAM_COLORS = "brand_color_details";

    private final SlideGenerationService generationService;

    @Override
    public ToolName getName() {
        return ToolName.GENERATE_PRESENTATION;
    }

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(PARAM_TOPIC, stringProperty("Main topic and title of the presentation"));
        properties.put(PARAM_DESCRIPTION, stringProperty("Short description and purpose of the presentation"));
        properties.put(PARAM_DETAILS, stringProperty("Detailed outline: key points, structure, slide by slide"));
        properties.put(PARAM_DATA, stringProperty("Data, statistics and metrics to show"));
        properties.put(PARAM_LOGO, stringProperty("Logo description, including what was seen in provided images"));
        properties.put(PARAM_GUIDELINES, stringProperty("Brand tone, voice, style and fonts"));
        properties.put(PARAM_COLORS, stringProperty("Brand colors as hex codes"));

        return ToolDefinition.builder()
                .name(ToolName.GENERATE_PRESENTATION.wireName())
                .description("Generate the presentation once all requirements have been gathered "
                        + "from the user. Produces HTML slides and a PowerPoint file.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", properties,
                        "required", List.of(PARAM_TOPIC, PARAM_DESCRIPTION, PARAM_DETAILS, PARAM_DATA,
                                PARAM_LOGO, PARAM_GUIDELINES, PARAM_COLORS)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        PresentationBrief brief = PresentationBrief.builder()
                .topic((String) parameters.get(PARAM_TOPIC))
                .description((String) parameters.get(PARAM_DESCRIPTION))
                .details((String) parameters.get(PARAM_DETAILS))
                .data((String) parameters.get(PARAM_DATA))
                .logoDetails((String) parameters.get(PARAM_LOGO))
                .guidelineDetails((String) parameters.get(PARAM_GUIDELINES))
                .colorDetails((String) parameters.get(PARAM_COLORS))
                .build();

        ChatTurnContext context = ChatTurnContextHolder.get();
        ProgressListener listener = context != null ? context.getListener() : ProgressListener.NOOP;

        log.info("[Tools] Generating presentation: {}", brief.getTopic());
        GenerationResult result = generationService.generate(brief, listener);
        if (!result.isSuccess()) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure("Failed to generate presentation: " + result.getMessage()));
        }
        if (context != null && result.getPresentationFile() != null) {
            context.setPresentationFile(result.getPresentationFile());
        }
        return CompletableFuture.completedFuture(ToolResult.success(summarize(result)));
    }

    private static Map<String, Object> stringProperty(String description) {
        return Map.of("type", "string", "description", description);
    }

    static String summarize(GenerationResult result) {
        StringBuilder message = new StringBuilder()
                .append("Successfully generated presentation!\n\n")
                .append("Slide count: ").append(result.getSlideCount()).append('\n')
                .append("Files created: ").append(String.join(", ", result.getSlideFiles())).append("\n\n")
                .append(result.getMessage() != null ? result.getMessage() : "").append("\n\n");
        if (result.getPresentationFile() != null) {
            message.append("PPTX file: ").append(result.getPresentationFile()).append('\n')
                    .append("It can be opened in PowerPoint or Keynote.\n\n");
        }
        message.append("Individual HTML slides can also be opened in a browser, e.g. ")
                .append(result.getSlideFiles().isEmpty() ? "slides/slide_1.html" : result.getSlideFiles().get(0))
                .append('.');
        return message.toString();
    }
}
