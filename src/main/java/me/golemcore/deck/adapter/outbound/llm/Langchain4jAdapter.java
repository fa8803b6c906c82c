package me.golemcore.deck.adapter.outbound.llm;

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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.Content;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ToolChoice;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.deck.domain.model.ContentPart;
import me.golemcore.deck.domain.model.LlmRequest;
import me.golemcore.deck.domain.model.LlmResponse;
import me.golemcore.deck.domain.model.Message;
import me.golemcore.deck.domain.model.ToolDefinition;
import me.golemcore.deck.infrastructure.config.DeckProperties;
import me.golemcore.deck.port.outbound.LlmPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * LLM adapter using the langchain4j library.
 *
 * <p>
 * Supports Anthropic (default) and any OpenAI-compatible endpoint, selected by
 * {@code deck.llm.provider}. Model name, output token limit and tool choice are
 * set per request. Requests are not retried: the models are built with
 * {@code maxRetries(0)} and failures surface to the tool loop.
 */
@Component
@Slf4j
public class Langchain4jAdapter implements LlmPort {

    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String PROVIDER_OPENAI = "openai";
    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final String EMPTY_ASSISTANT_TEXT = "(no text)";

    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final DeckProperties.LlmProperties settings;
    private final ObjectMapper objectMapper;

    private ChatModel chatModel;
    private volatile boolean initialized = false;

    @Autowired
    public Langchain4jAdapter(DeckProperties properties, ObjectMapper objectMapper) {
        this.settings = properties.getLlm();
        this.objectMapper = objectMapper;
    }

    // Visible for testing
    Langchain4jAdapter(DeckProperties properties, ObjectMapper objectMapper, ChatModel chatModel) {
        this(properties, objectMapper);
        this.chatModel = chatModel;
        this.initialized = true;
    }

    private synchronized void initialize() {
        if (initialized) {
            return;
        }
        if (settings.getApiKey() == null || settings.getApiKey().isBlank()) {
            log.warn("[LLM] No API key configured (deck.llm.api-key), adapter unavailable");
            return;
        }
        try {
            this.chatModel = createModel();
            initialized = true;
            log.info("[LLM] Langchain4j adapter initialized: provider={}, chat model={}, generation model={}",
                    settings.getProvider(), settings.getChatModel(), settings.getGenerationModel());
        } catch (RuntimeException e) {
            log.warn("[LLM] Failed to initialize Langchain4j adapter: {}", e.getMessage());
        }
    }

    private ChatModel createModel() {
        String provider = settings.getProvider() != null ? settings.getProvider() : PROVIDER_ANTHROPIC;
        if (PROVIDER_ANTHROPIC.equals(provider)) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(settings.getApiKey())
                    .modelName(settings.getChatModel())
                    .maxTokens(settings.getChatMaxTokens())
                    .temperature(settings.getTemperature())
                    .maxRetries(0)
                    .timeout(settings.getTimeout());
            if (settings.getBaseUrl() != null && !settings.getBaseUrl().isBlank()) {
                builder.baseUrl(settings.getBaseUrl());
            }
            return builder.build();
        }
        if (PROVIDER_OPENAI.equals(provider)) {
            var builder = OpenAiChatModel.builder()
                    .apiKey(settings.getApiKey())
                    .modelName(settings.getChatModel())
                    .temperature(settings.getTemperature())
                    .maxRetries(0)
                    .timeout(settings.getTimeout());
            if (settings.getBaseUrl() != null && !settings.getBaseUrl().isBlank()) {
                builder.baseUrl(settings.getBaseUrl());
            }
            return builder.build();
        }
        throw new IllegalStateException("Unsupported LLM provider: " + provider
                + ". Use deck.llm.provider=anthropic or openai");
    }

    private void ensureInitialized() {
        if (!initialized) {
            initialize();
        }
    }

    @Override
    public String getProviderId() {
        return settings.getProvider();
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();
            if (chatModel == null) {
                throw new IllegalStateException("LLM adapter not available: check deck.llm.api-key");
            }

            List<ChatMessage> messages = convertMessages(request);
            List<ToolSpecification> tools = convertTools(request);

            ChatRequest.Builder builder = ChatRequest.builder()
                    .messages(messages);
            if (request.getModel() != null) {
                builder.modelName(request.getModel());
            }
            if (request.getMaxTokens() != null) {
                builder.maxOutputTokens(request.getMaxTokens());
            }
            if (!tools.isEmpty()) {
                builder.toolSpecifications(tools);
                if (request.isToolUseRequired()) {
                    builder.toolChoice(ToolChoice.REQUIRED);
                }
            }

            try {
                log.debug("[LLM] Calling {} with {} messages and {} tools", request.getModel(), messages.size(),
                        tools.size());
                ChatResponse response = chatModel.chat(builder.build());
                return convertResponse(response, request.getModel());
            } catch (RuntimeException e) {
                log.error("[LLM] Chat failed: {}", e.getMessage(), e);
                throw new IllegalStateException("LLM chat failed: " + e.getMessage(), e);
            }
        });
    }

    @Override
    public boolean isAvailable() {
        ensureInitialized();
        return chatModel != null;
    }

    private List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();

        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }

        for (Message msg : request.getMessages()) {
            switch (msg.getRole()) {
            case Message.ROLE_USER -> messages.add(convertUserMessage(msg));
            case Message.ROLE_ASSISTANT -> messages.add(convertAssistantMessage(msg));
            case Message.ROLE_TOOL -> {
                if (msg.getToolResults() != null) {
                    for (Message.ToolResultEntry entry : msg.getToolResults()) {
                        messages.add(ToolExecutionResultMessage.from(
                                entry.getToolCallId(),
                                entry.getToolName(),
                                entry.getContent()));
                    }
                }
            }
            default -> log.warn("[LLM] Unknown message role: {}, skipping", msg.getRole());
            }
        }

        return messages;
    }

    private UserMessage convertUserMessage(Message msg) {
        if (!msg.hasParts()) {
            return UserMessage.from(msg.getContent() != null ? msg.getContent() : "");
        }
        List<Content> contents = new ArrayList<>();
        for (ContentPart part : msg.getParts()) {
            if (part.isImage()) {
                contents.add(ImageContent.from(part.base64Data(), part.mimeType()));
            } else {
                contents.add(TextContent.from(part.text()));
            }
        }
        return UserMessage.from(contents);
    }

    private AiMessage convertAssistantMessage(Message msg) {
        String text = msg.getContent();
        if (!msg.hasToolCalls()) {
            return AiMessage.from(text != null && !text.isBlank() ? text : EMPTY_ASSISTANT_TEXT);
        }
        List<ToolExecutionRequest> toolRequests = msg.getToolCalls().stream()
                .map(tc -> ToolExecutionRequest.builder()
                        .id(tc.getId())
                        .name(tc.getName())
                        .arguments(convertArgsToJson(tc.getArguments()))
                        .build())
                .toList();
        if (text != null && !text.isBlank()) {
            return AiMessage.from(text, toolRequests);
        }
        return AiMessage.from(toolRequests);
    }

    private List<ToolSpecification> convertTools(LlmRequest request) {
        if (request.getTools() == null || request.getTools().isEmpty()) {
            return Collections.emptyList();
        }

        return request.getTools().stream()
                .map(this::convertToolDefinition)
                .collect(Collectors.toList());
    }

    @SuppressWarnings("unchecked")
    private ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        if (tool.getInputSchema() != null) {
            Map<String, Object> schema = tool.getInputSchema();
            Map<String, Object> properties = (Map<String, Object>) schema.get(SCHEMA_KEY_PROPERTIES);
            List<String> required = (List<String>) schema.get("required");

            if (properties != null) {
                JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
                for (Map.Entry<String, Object> entry : properties.entrySet()) {
                    schemaBuilder.addProperty(entry.getKey(),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
                if (required != null && !required.isEmpty()) {
                    schemaBuilder.required(required);
                }
                builder.parameters(schemaBuilder.build());
            }
        }

        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = (String) paramSchema.get("type");
        String description = (String) paramSchema.get("description");
        List<String> enumValues = (List<String>) paramSchema.get("enum");
        boolean described = description != null && !description.isBlank();

        if (enumValues != null && !enumValues.isEmpty()) {
            JsonEnumSchema.Builder builder = JsonEnumSchema.builder().enumValues(enumValues);
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }

        switch (type != null ? type : "string") {
        case "integer" -> {
            JsonIntegerSchema.Builder builder = JsonIntegerSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        case "number" -> {
            JsonNumberSchema.Builder builder = JsonNumberSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        case "boolean" -> {
            JsonBooleanSchema.Builder builder = JsonBooleanSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder();
            if (described) {
                builder.description(description);
            }
            if (paramSchema.get("items") instanceof Map<?, ?> items) {
                builder.items(toJsonSchemaElement((Map<String, Object>) items));
            }
            return builder.build();
        }
        default -> {
            JsonStringSchema.Builder builder = JsonStringSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        }
    }

    private LlmResponse convertResponse(ChatResponse response, String requestedModel) {
        AiMessage aiMessage = response.aiMessage();

        List<Message.ToolCall> toolCalls = null;
        if (aiMessage.hasToolExecutionRequests()) {
            toolCalls = aiMessage.toolExecutionRequests().stream()
                    .map(ter -> Message.ToolCall.builder()
                            .id(ter.id())
                            .name(ter.name())
                            .arguments(parseJsonArgs(ter.arguments()))
                            .build())
                    .toList();
            log.trace("[LLM] Parsed {} tool calls from response", toolCalls.size());
        }

        return LlmResponse.builder()
                .content(aiMessage.text())
                .toolCalls(toolCalls)
                .model(requestedModel != null ? requestedModel : settings.getChatModel())
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }

    private String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (Exception e) {
            log.warn("[LLM] Failed to serialize tool arguments: {}", e.getMessage());
            return "{}";
        }
    }

    private Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE_REF);
        } catch (Exception e) {
            log.warn("[LLM] Failed to parse tool arguments: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }
}
