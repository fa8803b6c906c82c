package me.golemcore.deck.domain.system.toolloop;

import me.golemcore.deck.domain.model.GenerationResult;
import me.golemcore.deck.domain.model.LlmRequest;
import me.golemcore.deck.domain.model.LlmResponse;
import me.golemcore.deck.domain.model.Message;
import me.golemcore.deck.domain.model.ProgressEvent;
import me.golemcore.deck.domain.model.ProgressListener;
import me.golemcore.deck.domain.model.ToolResult;
import me.golemcore.deck.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;

/**
 * Bounded tool loop orchestrator.
 *
 * <p>
 * Each iteration makes one model request over the whole transcript, dispatches
 * every requested tool call in order, and appends the assistant turn together
 * with the aggregated tool turn. The run ends on a free-text answer
 * (conversation mode), on a terminal tool result, or after exactly
 * {@code maxIterations} model requests.
 */
public class DefaultToolLoopSystem implements ToolLoopSystem {

    private static final Logger log = LoggerFactory.getLogger(DefaultToolLoopSystem.class);

    static final String UNEXPECTED_STOP_PREFIX = "Agent stopped unexpectedly: ";

    private final LlmPort llmPort;
    private final HistoryWriter historyWriter;

    public DefaultToolLoopSystem(LlmPort llmPort, HistoryWriter historyWriter) {
        this.llmPort = llmPort;
        this.historyWriter = historyWriter;
    }

    @Override
    public ToolLoopResult run(ToolLoopRequest request) {
        LoopMode mode = request.getMode() != null ? request.getMode() : LoopMode.CONVERSATION;
        int iterations = 0;
        try {
            ensureTranscript(request);
            ProgressListener listener = request.getListener() != null ? request.getListener() : ProgressListener.NOOP;

            while (iterations < request.getMaxIterations()) {
                // 1) LLM call
                LlmResponse response = llmPort.chat(buildRequest(request, mode)).join();
                iterations++;

                // 2) No tool calls: answer or anomaly
                if (response == null || !response.hasToolCalls()) {
                    String text = response != null && response.getContent() != null ? response.getContent() : "";
                    historyWriter.appendFinalAssistantAnswer(request.getTranscript(), text);
                    if (mode == LoopMode.GENERATION) {
                        log.warn("[ToolLoop] Generation stopped without tool use after {} iteration(s)",
                                iterations);
                        return ToolLoopResult.completed(GenerationResult.failed(UNEXPECTED_STOP_PREFIX + text),
                                iterations);
                    }
                    log.debug("[ToolLoop] Final answer after {} iteration(s)", iterations);
                    return ToolLoopResult.answered(text, iterations);
                }

                // 3) Dispatch every call, then append assistant + tool turns together
                List<ToolExecutionOutcome> outcomes = new ArrayList<>(response.getToolCalls().size());
                GenerationResult completion = null;
                for (Message.ToolCall toolCall : response.getToolCalls()) {
                    listener.onEvent(ProgressEvent.toolDispatched(toolCall.getName(), toolCall.getId()));
                    ToolResult result = request.getTools().dispatch(toolCall);
                    outcomes.add(ToolExecutionOutcome.of(toolCall, result));
                    if (result.isCompletion()) {
                        if (completion == null) {
                            completion = result.getCompletion();
                        } else {
                            log.warn("[ToolLoop] Ignoring repeated completion in the same turn ({})",
                                    toolCall.getId());
                        }
                    }
                }
                historyWriter.appendToolTurn(request.getTranscript(), response, outcomes);

                // 4) Terminal result ends the run
                if (completion != null) {
                    log.info("[ToolLoop] Completed after {} iteration(s): success={}", iterations,
                            completion.isSuccess());
                    return ToolLoopResult.completed(completion, iterations);
                }
            }

            log.warn("[ToolLoop] Budget of {} iteration(s) exhausted", request.getMaxIterations());
            return ToolLoopResult.budgetExceeded(mode, iterations);
        } catch (RuntimeException e) {
            String message = describe(e);
            log.error("[ToolLoop] Run failed after {} iteration(s): {}", iterations, message, e);
            return ToolLoopResult.failed(mode, message, iterations);
        }
    }

    private void ensureTranscript(ToolLoopRequest request) {
        if (request.getTranscript() == null) {
            request.setTranscript(new ArrayList<>());
        }
    }

    private LlmRequest buildRequest(ToolLoopRequest request, LoopMode mode) {
        return LlmRequest.builder()
                .model(request.getModel())
                .systemPrompt(request.getSystemPrompt())
                .messages(new ArrayList<>(request.getTranscript()))
                .tools(request.getTools() != null ? request.getTools().definitions() : new ArrayList<>())
                .maxTokens(request.getMaxTokens())
                .toolUseRequired(mode == LoopMode.GENERATION)
                .build();
    }

    private static String describe(Throwable error) {
        Throwable cursor = error;
        while (cursor instanceof CompletionException && cursor.getCause() != null) {
            cursor = cursor.getCause();
        }
        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }
}
