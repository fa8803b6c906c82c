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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.deck.port.outbound.LlmPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration for shared infrastructure beans, plus startup checks.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the {@link Clock}, the {@link ObjectMapper} and the executor
 * that runs streamed chat turns</li>
 * <li>Creates the workspace directories for slides, screenshots and
 * exports</li>
 * <li>Logs startup information (provider, models, workspace location)</li>
 * </ul>
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final DeckProperties properties;
    private final LlmPort llmPort;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean(name = "deckRelayExecutor", destroyMethod = "shutdownNow")
    public ExecutorService deckRelayExecutor() {
        AtomicInteger counter = new AtomicInteger();
        int threads = Math.max(1, properties.getRelay().getWorkerThreads());
        return Executors.newFixedThreadPool(threads, r -> {
            Thread thread = new Thread(r, "deck-relay-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @PostConstruct
    public void init() {
        DeckProperties.WorkspaceProperties workspace = properties.getWorkspace();
        Path root = workspace.rootPath();
        log.info("GolemCore Deck starting...");
        log.info("LLM Provider: {} (available: {})", properties.getLlm().getProvider(), llmPort.isAvailable());
        log.info("Chat Model: {}, Generation Model: {}", properties.getLlm().getChatModel(),
                properties.getLlm().getGenerationModel());
        log.info("Workspace: {}", root);

        for (String dir : new String[] { workspace.getSlidesDir(), workspace.getScreenshotsDir(),
                workspace.getExportsDir() }) {
            try {
                Files.createDirectories(root.resolve(dir));
            } catch (IOException e) {
                log.warn("Failed to create workspace directory {}: {}", dir, e.getMessage());
            }
        }
    }
}
