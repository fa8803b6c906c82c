package me.golemcore.deck.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.deck.domain.component.ToolComponent;
import me.golemcore.deck.domain.model.Message;
import me.golemcore.deck.domain.model.ToolDefinition;
import me.golemcore.deck.domain.model.ToolFailureKind;
import me.golemcore.deck.domain.model.ToolName;
import me.golemcore.deck.domain.model.ToolResult;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Closed tool catalog for one loop. Maps {@link ToolName} entries to their
 * handlers, validates required input against each definition's schema, and
 * never lets an exception escape {@link #dispatch(Message.ToolCall)}.
 */
@Slf4j
public class ToolRegistry {

    private final Map<ToolName, ToolComponent> tools;

    public ToolRegistry(Collection<? extends ToolComponent> components) {
        Map<ToolName, ToolComponent> registered = new EnumMap<>(ToolName.class);
        for (ToolComponent tool : components) {
            if (tool.isEnabled()) {
                registered.put(tool.getName(), tool);
            }
        }
        this.tools = Collections.unmodifiableMap(registered);
    }

    /**
     * Builds the catalog of one loop from all known tool handlers.
     */
    public static ToolRegistry forScope(ToolName.ToolScope scope, Collection<? extends ToolComponent> components) {
        List<ToolComponent> inScope = new ArrayList<>();
        for (ToolComponent tool : components) {
            if (tool.getName().scope() == scope) {
                inScope.add(tool);
            }
        }
        return new ToolRegistry(inScope);
    }

    public List<ToolDefinition> definitions() {
        List<ToolDefinition> definitions = new ArrayList<>(tools.size());
        for (ToolComponent tool : tools.values()) {
            definitions.add(tool.getDefinition());
        }
        return definitions;
    }

    public boolean contains(ToolName name) {
        return tools.containsKey(name);
    }

    /**
     * Runs one tool call. Unknown tools, invalid input and handler failures all
     * come back as error-flagged results.
     */
    public ToolResult dispatch(Message.ToolCall toolCall) {
        String requested = toolCall != null ? sanitizeToolName(toolCall.getName()) : null;
        Optional<ToolComponent> tool = ToolName.fromWireName(requested).map(tools::get);
        if (tool.isEmpty()) {
            log.warn("[Tools] Unknown tool requested: {}", requested);
            return ToolResult.failure(ToolFailureKind.POLICY_DENIED,
                    "Unknown tool: " + requested + ". Available tools: " + availableNames());
        }

        Map<String, Object> arguments = toolCall.getArguments() != null ? toolCall.getArguments() : Map.of();
        String invalid = validate(tool.get().getDefinition(), arguments);
        if (invalid != null) {
            log.warn("[Tools] Invalid input for {}: {}", requested, invalid);
            return ToolResult.failure(ToolFailureKind.INVALID_INPUT, invalid);
        }

        log.debug("[Tools] Executing {} ({})", requested, toolCall.getId());
        try {
            CompletableFuture<ToolResult> future = tool.get().execute(arguments);
            ToolResult result = future.get();
            if (result == null) {
                return ToolResult.failure("Tool returned no result: " + requested);
            }
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure("Tool execution interrupted: " + requested);
        } catch (ExecutionException | RuntimeException e) {
            log.error("[Tools] Tool execution failed: {}", requested, e);
            return ToolResult.failure("Tool execution failed: " + safeCauseMessage(e));
        }
    }

    private String availableNames() {
        List<String> names = new ArrayList<>();
        for (ToolName name : tools.keySet()) {
            names.add(name.wireName());
        }
        return String.join(", ", names);
    }

    private static String validate(ToolDefinition definition, Map<String, Object> arguments) {
        for (String property : definition.requiredProperties()) {
            Object value = arguments.get(property);
            if (value == null) {
                return "Missing required parameter: " + property;
            }
            Object type = definition.propertySchema(property).get("type");
            if (type instanceof String expected && !matchesType(expected, value)) {
                return "Parameter " + property + " must be of type " + expected;
            }
        }
        return null;
    }

    private static boolean matchesType(String expected, Object value) {
        return switch (expected) {
        case "string" -> value instanceof String;
        case "integer" -> value instanceof Integer || value instanceof Long
                || (value instanceof Number number && number.doubleValue() == Math.rint(number.doubleValue()));
        case "number" -> value instanceof Number;
        case "boolean" -> value instanceof Boolean;
        case "array" -> value instanceof List<?>;
        case "object" -> value instanceof Map<?, ?>;
        default -> true;
        };
    }

    private static String safeCauseMessage(Throwable error) {
        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null && !cause.equals(cursor)) {
            cursor = cause;
            cause = cursor.getCause();
        }
        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }

    /**
     * Strip special tokens some models leak into tool call names.
     */
    private static String sanitizeToolName(String name) {
        if (name == null) {
            return null;
        }
        String sanitized = name.replaceAll("[^a-zA-Z0-9_-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[Tools] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }
}
