package me.golemcore.deck.domain.system.toolloop;

import me.golemcore.deck.domain.model.LlmResponse;
import me.golemcore.deck.domain.model.Message;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public class DefaultHistoryWriter implements HistoryWriter {

    private final Clock clock;

    public DefaultHistoryWriter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void appendToolTurn(List<Message> transcript, LlmResponse llmResponse,
            List<ToolExecutionOutcome> outcomes) {
        Instant now = now();
        Message assistant = Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content(llmResponse.getContent())
                .toolCalls(new ArrayList<>(llmResponse.getToolCalls()))
                .timestamp(now)
                .build();

        List<Message.ToolResultEntry> entries = new ArrayList<>(outcomes.size());
        for (ToolExecutionOutcome outcome : outcomes) {
            entries.add(Message.ToolResultEntry.builder()
                    .toolCallId(outcome.toolCallId())
                    .toolName(outcome.toolName())
                    .content(outcome.messageContent())
                    .error(!outcome.toolResult().isSuccess())
                    .build());
        }
        Message toolTurn = Message.builder()
                .role(Message.ROLE_TOOL)
                .toolResults(entries)
                .timestamp(now)
                .build();

        transcript.add(assistant);
        transcript.add(toolTurn);
    }

    @Override
    public void appendFinalAssistantAnswer(List<Message> transcript, String finalText) {
        transcript.add(Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content(finalText)
                .timestamp(now())
                .build());
    }

    private Instant now() {
        return clock != null ? clock.instant() : Instant.now();
    }
}
