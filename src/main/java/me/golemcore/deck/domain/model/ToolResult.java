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

/**
 * Result of tool execution. Failures carry an error text and a
 * {@link ToolFailureKind}; the terminal tool produces the distinct
 * {@link #completion(String, GenerationResult)} variant whose typed payload
 * ends the generation loop.
 */
@Data
@Builder
public class ToolResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private String output;
    private String error;
    private ToolFailureKind failureKind;
    private GenerationResult completion;

    /**
     * Creates a successful tool result with output text.
     */
    public static ToolResult success(String output) {
        return ToolResult.builder()
                .success(true)
                .output(output)
                .build();
    }

    /**
     * Creates a failed tool result with an error message.
     */
    public static ToolResult failure(String error) {
        return failure(ToolFailureKind.EXECUTION_FAILED, error);
    }

    public static ToolResult failure(ToolFailureKind kind, String error) {
        return ToolResult.builder()
                .success(false)
                .error(error)
                .failureKind(kind)
                .build();
    }

    /**
     * Creates the terminal result. {@code output} is the marker-prefixed text
     * the model sees; {@code result} is the parsed payload.
     */
    public static ToolResult completion(String output, GenerationResult result) {
        return ToolResult.builder()
                .success(true)
                .output(output)
                .completion(result)
                .build();
    }

    public boolean isCompletion() {
        return completion != null;
    }

    /**
     * Text placed into the transcript for this result.
     */
    public String toTranscriptText() {
        if (success) {
            return output != null ? output : "";
        }
        return "Error: " + (error != null ? error : "unknown error");
    }
}
