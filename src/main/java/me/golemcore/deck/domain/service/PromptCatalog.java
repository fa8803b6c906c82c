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
import me.golemcore.deck.domain.model.PresentationBrief;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * System prompts of the two loops, loaded once from {@code prompts/} on the
 * classpath, and the user prompt that opens a generation session.
 */
@Component
@Slf4j
public class PromptCatalog {

    static final String CONVERSATION_PROMPT = "prompts/conversation-system.md";
    static final String GENERATION_PROMPT = "prompts/generation-system.md";

    private static final String NOT_AVAILABLE = "N/A";

    private final String conversationSystemPrompt;
    private final String generationSystemPrompt;

    public PromptCatalog() {
        this.conversationSystemPrompt = load(CONVERSATION_PROMPT);
        this.generationSystemPrompt = load(GENERATION_PROMPT);
    }

    public String conversationSystemPrompt() {
        return conversationSystemPrompt;
    }

    public String generationSystemPrompt() {
        return generationSystemPrompt;
    }

    public String generationUserPrompt(PresentationBrief brief) {
        return "Please generate a presentation with the following details:\n\n"
                + "**Topic**: " + orNotAvailable(brief.getTopic()) + "\n\n"
                + "**Description**: " + orNotAvailable(brief.getDescription()) + "\n\n"
                + "**Details**: " + orNotAvailable(brief.getDetails()) + "\n\n"
                + "**Data/Statistics**: " + orNotAvailable(brief.getData()) + "\n"
                + "**Brand Colors**: " + orNotAvailable(brief.getColorDetails()) + "\n"
                + "**Logo Details**: " + orNotAvailable(brief.getLogoDetails()) + "\n"
                + "**Brand Guidelines**: " + orNotAvailable(brief.getGuidelineDetails()) + "\n";
    }

    private static String orNotAvailable(String value) {
        return value == null || value.isBlank() ? NOT_AVAILABLE : value;
    }

    private static String load(String location) {
        ClassPathResource resource = new ClassPathResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("Prompt resource not found: " + location);
        }
        try (InputStream is = resource.getInputStream()) {
            String prompt = new String(is.readAllBytes(), StandardCharsets.UTF_8);
            log.debug("[Prompts] Loaded {} ({} chars)", location, prompt.length());
            return prompt;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read prompt resource: " + location, e);
        }
    }
}
