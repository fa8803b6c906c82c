package me.golemcore.deck;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Deck.
 *
 * <p>
 * GolemCore Deck talks with a user about the presentation they need, lets a
 * tool-using model write the slides as HTML files, and exports them to a
 * PowerPoint file.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters) around a bounded tool loop:
 *
 * <pre>
 * Input Layer        → ChatController (JSON and SSE)
 * Domain Layer       → ChatService, SlideGenerationService, ToolLoopSystem,
 *                      ProgressRelayService, PresentationExportService
 * Infrastructure     → LLM (langchain4j), Browser (Playwright),
 *                      PPTX (Apache POI), Session storage
 * </pre>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class DeckApplication {

    public static void main(String[] args) {
        SpringApplication.run(DeckApplication.class, args);
    }
}
