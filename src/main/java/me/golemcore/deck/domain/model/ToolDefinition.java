package me.golemcore.deck.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Defines a tool that the LLM can call. Contains the tool name, description,
 * and JSON Schema for input parameters.
 */
@Data
@Builder
public class ToolDefinition {

    private String name;
    private String description;
    private Map<String, Object> inputSchema; // JSON Schema

    /**
     * Returns the declared required property names, or an empty list.
     */
    @SuppressWarnings("unchecked")
    public List<String> requiredProperties() {
        if (inputSchema == null || !(inputSchema.get("required") instanceof List<?>)) {
            return List.of();
        }
        return (List<String>) inputSchema.get("required");
    }

    /**
     * Returns the schema of one property, or an empty map.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> propertySchema(String property) {
        if (inputSchema == null || !(inputSchema.get("properties") instanceof Map<?, ?>)) {
            return Map.of();
        }
        Object schema = ((Map<String, Object>) inputSchema.get("properties")).get(property);
        return schema instanceof Map<?, ?> ? (Map<String, Object>) schema : Map.of();
    }
}
