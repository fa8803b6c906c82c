package me.golemcore.deck.domain.system.toolloop;

import me.golemcore.deck.domain.model.GenerationResult;

/**
 * Outcome of a loop run.
 *
 * @param status
 *            how the loop ended
 * @param answer
 *            final text for the user (conversation mode), otherwise null
 * @param generationResult
 *            terminal result (generation mode), otherwise null
 * @param iterations
 *            model requests made
 * @param error
 *            failure description when {@code status} is FAILED
 */
public record ToolLoopResult(Status status, String answer, GenerationResult generationResult, int iterations,
        String error) {

    public static final String BUDGET_EXCEEDED_MESSAGE = "Max iterations reached without completion";
    public static final String BUDGET_EXCEEDED_ANSWER = "Sorry, I encountered an issue. Please try again.";

    public enum Status {
        /** Model answered in free text (conversation mode). */
        ANSWERED,
        /** A terminal result was produced (possibly a failed one). */
        COMPLETED,
        /** The iteration budget ran out. */
        BUDGET_EXCEEDED,
        /** An unexpected exception ended the run. */
        FAILED
    }

    public static ToolLoopResult answered(String answer, int iterations) {
        return new ToolLoopResult(Status.ANSWERED, answer, null, iterations, null);
    }

    public static ToolLoopResult completed(GenerationResult result, int iterations) {
        return new ToolLoopResult(Status.COMPLETED, null, result, iterations, null);
    }

    public static ToolLoopResult budgetExceeded(LoopMode mode, int iterations) {
        if (mode == LoopMode.GENERATION) {
            return new ToolLoopResult(Status.BUDGET_EXCEEDED, null,
                    GenerationResult.failed(BUDGET_EXCEEDED_MESSAGE), iterations, null);
        }
        return new ToolLoopResult(Status.BUDGET_EXCEEDED, BUDGET_EXCEEDED_ANSWER, null, iterations, null);
    }

    public static ToolLoopResult failed(LoopMode mode, String error, int iterations) {
        GenerationResult result = mode == LoopMode.GENERATION ? GenerationResult.failed(error) : null;
        return new ToolLoopResult(Status.FAILED, null, result, iterations, error);
    }
}
