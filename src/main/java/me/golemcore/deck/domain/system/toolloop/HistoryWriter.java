package me.golemcore.deck.domain.system.toolloop;

import me.golemcore.deck.domain.model.LlmResponse;
import me.golemcore.deck.domain.model.Message;

import java.util.List;

/**
 * Single point of mutation for a transcript during a loop run.
 *
 * <p>
 * ToolLoopSystem should not write messages directly.
 */
public interface HistoryWriter {

    /**
     * Appends the assistant turn that requested tools and, right after it, one
     * tool turn holding a result entry for each of its calls.
     */
    void appendToolTurn(List<Message> transcript, LlmResponse llmResponse, List<ToolExecutionOutcome> outcomes);

    void appendFinalAssistantAnswer(List<Message> transcript, String finalText);
}
