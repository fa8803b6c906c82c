package me.golemcore.deck.domain.system.toolloop;

import me.golemcore.deck.domain.model.Message;
import me.golemcore.deck.domain.model.ToolResult;

/**
 * Result of a single tool dispatch, paired with the call that produced it.
 *
 * @param toolCallId
 *            tool_call_id as provided by the LLM
 * @param toolName
 *            tool name as requested
 * @param toolResult
 *            raw result from the registry
 */
public record ToolExecutionOutcome(String toolCallId, String toolName, ToolResult toolResult) {

    public static ToolExecutionOutcome of(Message.ToolCall toolCall, ToolResult result) {
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), result);
    }

    public String messageContent() {
        return toolResult.toTranscriptText();
    }
}
