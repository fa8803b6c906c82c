package me.golemcore.deck.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Centralized configuration properties for the deck agent, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code deck.*} prefix:
 * <ul>
 * <li>{@link WorkspaceProperties} - where slides, screenshots and exports
 * live</li>
 * <li>{@link LlmProperties} - LLM provider settings</li>
 * <li>{@link LoopProperties} - iteration budgets</li>
 * <li>{@link ExportProperties} - rasterization and assembly</li>
 * <li>{@link RelayProperties} - progress streaming</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "deck")
@Data
public class DeckProperties {

    private WorkspaceProperties workspace = new WorkspaceProperties();
    private LlmProperties llm = new LlmProperties();
    private LoopProperties loop = new LoopProperties();
    private ExportProperties export = new ExportProperties();
    private RelayProperties relay = new RelayProperties();

    // ==================== WORKSPACE ====================

    @Data
    public static class WorkspaceProperties {
        private String root = ".";
        private String slidesDir = "slides";
        private String screenshotsDir = "screenshots";
        private String exportsDir = "exports";

        public Path rootPath() {
            return Path.of(root).toAbsolutePath().normalize();
        }
    }

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        private String provider = "anthropic"; // anthropic, openai
        private String apiKey;
        private String baseUrl;
        private String chatModel = "claude-sonnet-4-5";
        private String generationModel = "claude-sonnet-4-5";
        private int chatMaxTokens = 16000;
        private int generationMaxTokens = 4000;
        private double temperature = 0.0;
        private Duration timeout = Duration.ofSeconds(300);
    }

    // ==================== LOOP ====================

    @Data
    public static class LoopProperties {
        private int conversationMaxIterations = 10;
        private int generationMaxIterations = 30;
    }

    // ==================== EXPORT ====================

    @Data
    public static class ExportProperties {
        private int viewportWidth = 1920;
        private int viewportHeight = 1080;
        private long settleDelayMs = 500;
        private boolean headless = true;
        private long timeoutMs = 30000;
        private double slideWidthInches = 10.0;
        private double slideHeightInches = 5.625;
    }

    // ==================== RELAY ====================

    @Data
    public static class RelayProperties {
        private Duration pollInterval = Duration.ofSeconds(15);
        private int workerThreads = 4;
    }
}
